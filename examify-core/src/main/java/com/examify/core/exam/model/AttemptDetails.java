package com.examify.core.exam.model;

import com.examify.data.entity.AttemptStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class AttemptDetails {
    UUID attemptId;
    UUID examId;
    String examTitle;
    AttemptStatus status;
    Double score;
    Instant startedAt;
    Instant completedAt;
    /** Empty while the attempt is in progress. */
    List<GradeResult> answers;
}
