package com.examify.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class QueryRequest {

    @NotBlank(message = "Question is required")
    @Size(max = 4000, message = "Question must be at most 4000 characters")
    private String questionText;
}
