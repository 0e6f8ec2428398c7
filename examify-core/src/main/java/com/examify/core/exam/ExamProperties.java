package com.examify.core.exam;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "examify.exam")
public class ExamProperties {

    /** Lets a user hold several in-progress attempts of the same exam. */
    private boolean allowConcurrentAttempts = false;

    /** Per-answer limit for an automated grading call. */
    private int gradingTimeoutSeconds = 90;

    private int gradingThreads = 4;
}
