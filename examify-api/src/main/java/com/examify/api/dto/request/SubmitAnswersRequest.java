package com.examify.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
public class SubmitAnswersRequest {

    @NotNull(message = "Answers are required")
    @Valid
    private List<Answer> answers = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Answer {

        @NotNull(message = "Question id is required")
        private UUID questionId;

        private String submittedContent;
    }
}
