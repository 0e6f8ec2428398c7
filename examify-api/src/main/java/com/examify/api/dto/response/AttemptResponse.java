package com.examify.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttemptResponse {
    private UUID attemptId;
    private UUID examId;
    private String examTitle;
    /** in_progress or completed */
    private String state;
    private Double score;
    private Instant startedAt;
    private Instant completedAt;
    private List<GradedAnswerResponse> answers;
}
