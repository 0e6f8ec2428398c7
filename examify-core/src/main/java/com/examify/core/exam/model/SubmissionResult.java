package com.examify.core.exam.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class SubmissionResult {
    UUID attemptId;
    double totalScore;
    List<GradeResult> perQuestion;
}
