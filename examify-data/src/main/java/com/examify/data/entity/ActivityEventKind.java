package com.examify.data.entity;

public enum ActivityEventKind {
    EXAM_COMPLETED,
    MATERIAL_UPLOADED
}
