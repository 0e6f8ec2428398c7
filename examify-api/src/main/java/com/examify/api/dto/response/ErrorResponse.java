package com.examify.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private String error;
    private String message;
    private Integer status;
    private Instant timestamp;
    private String path;
    private Map<String, String> fieldErrors;
    /** Id of the resource the request collided with, e.g. the attempt already in progress. */
    private Object conflictingId;
    /** Set when retrying later may succeed. */
    private Boolean retryable;
}
