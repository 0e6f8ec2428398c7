package com.examify.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.UUID;

@Data
public class StartAttemptRequest {

    @NotNull(message = "Exam id is required")
    private UUID examId;
}
