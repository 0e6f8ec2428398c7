package com.examify.data.repository;

import com.examify.data.entity.UserProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * All writes to {@code user_profiles} are single SQL statements. Counters are added in the database,
 * never read, incremented and written back.
 */
@Repository
public interface UserProfileRepository extends JpaRepository<UserProfile, UUID> {

    // Plain INSERT: a concurrent creator makes this fail with a key violation instead of overwriting.
    @Modifying
    @Query(value = """
        INSERT INTO user_profiles
            (user_id, mock_exams_completed, average_mock_exam_score, study_materials_uploaded_count, total_points, updated_at)
        VALUES (:userId, 0, NULL, 0, 0, CURRENT_TIMESTAMP)
        """, nativeQuery = true)
    int insertEmpty(@Param("userId") UUID userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM UserProfile p WHERE p.userId = :userId")
    Optional<UserProfile> findByIdForUpdate(@Param("userId") UUID userId);

    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE UserProfile p
        SET p.totalPoints = p.totalPoints + :points, p.updatedAt = :now
        WHERE p.userId = :userId
        """)
    int addPoints(@Param("userId") UUID userId, @Param("points") long points, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE UserProfile p
        SET p.studyMaterialsUploadedCount = p.studyMaterialsUploadedCount + 1, p.updatedAt = :now
        WHERE p.userId = :userId
        """)
    int incrementMaterialsUploaded(@Param("userId") UUID userId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE UserProfile p
        SET p.mockExamsCompleted = :completed, p.averageMockExamScore = :average, p.updatedAt = :now
        WHERE p.userId = :userId
        """)
    int updateExamStatistics(
        @Param("userId") UUID userId,
        @Param("completed") int completed,
        @Param("average") Double average,
        @Param("now") Instant now
    );
}
