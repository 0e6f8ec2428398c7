package com.examify.core.exam.model;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Outcome of grading one question. {@code correct} is only set for multiple choice.
 */
@Value
@Builder(toBuilder = true)
public class GradeResult {
    UUID questionId;
    String submittedContent;
    double awardedPoints;
    Boolean correct;
    String feedback;
}
