package com.examify.core.exam.model;

import lombok.Value;

import java.util.UUID;

@Value
public class SubmittedAnswer {
    UUID questionId;
    String submittedContent;
}
