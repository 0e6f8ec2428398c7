package com.examify.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GradedAnswerResponse {
    private UUID questionId;
    private String submittedContent;
    private double awardedPoints;
    private Boolean correct;
    private String feedback;
}
