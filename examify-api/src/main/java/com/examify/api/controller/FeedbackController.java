package com.examify.api.controller;

import com.examify.api.dto.request.FeedbackRequest;
import com.examify.api.dto.response.FeedbackResponse;
import com.examify.core.feedback.FeedbackService;
import com.examify.data.entity.AiFeedback;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/feedback")
@RequiredArgsConstructor
public class FeedbackController {

    private final FeedbackService feedbackService;

    @PostMapping
    public ResponseEntity<FeedbackResponse> submitFeedback(
            @Valid @RequestBody FeedbackRequest request,
            Authentication authentication
    ) {
        UUID userId = UUID.fromString(authentication.getName());
        AiFeedback feedback = feedbackService.submitFeedback(
            userId,
            request.getSessionId(),
            request.getRating(),
            request.getComment(),
            Boolean.TRUE.equals(request.getAiLowConfidence()),
            request.getContextChunkIds()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(new FeedbackResponse(feedback.getId(), "recorded"));
    }
}
