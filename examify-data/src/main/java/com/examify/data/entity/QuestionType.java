package com.examify.data.entity;

public enum QuestionType {
    MULTIPLE_CHOICE,
    SHORT_ANSWER,
    ESSAY;

    public boolean isOpenEnded() {
        return this != MULTIPLE_CHOICE;
    }
}
