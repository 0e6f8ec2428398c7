package com.examify.data.entity;

public enum AttemptStatus {
    IN_PROGRESS,
    COMPLETED
}
