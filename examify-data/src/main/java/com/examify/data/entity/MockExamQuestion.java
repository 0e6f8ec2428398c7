package com.examify.data.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "mock_exam_questions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MockExamQuestion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "mock_exam_id", nullable = false)
    private MockExam mockExam;

    @Column(name = "order_index", nullable = false)
    private Integer orderIndex;

    @Column(name = "question_text", nullable = false, columnDefinition = "TEXT")
    private String questionText;

    @Enumerated(EnumType.STRING)
    @Column(name = "question_type", nullable = false)
    private QuestionType questionType;

    @Column(name = "points", nullable = false)
    private Double points;

    // option key -> option text, MCQ only
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "mock_exam_question_options", joinColumns = @JoinColumn(name = "question_id"))
    @MapKeyColumn(name = "option_key")
    @Column(name = "option_text", columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, String> options = new LinkedHashMap<>();

    @Column(name = "correct_option")
    private String correctOption;

    /** Optional chunk the question was written from, used to ground AI grading. */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "source_chunk_id")
    private DocumentChunk sourceChunk;
}
