package com.examify.api.controller;

import com.examify.api.dto.request.StartAttemptRequest;
import com.examify.api.dto.request.SubmitAnswersRequest;
import com.examify.api.dto.response.AttemptResponse;
import com.examify.api.dto.response.GradedAnswerResponse;
import com.examify.api.dto.response.SubmissionResponse;
import com.examify.core.exam.ExamAttemptService;
import com.examify.core.exam.model.AttemptDetails;
import com.examify.core.exam.model.GradeResult;
import com.examify.core.exam.model.SubmissionResult;
import com.examify.core.exam.model.SubmittedAnswer;
import com.examify.data.entity.AttemptStatus;
import com.examify.data.entity.MockExamAttempt;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/mock-exams")
@RequiredArgsConstructor
public class MockExamController {

    private final ExamAttemptService attemptService;

    @PostMapping("/attempts")
    public ResponseEntity<AttemptResponse> startAttempt(
            @Valid @RequestBody StartAttemptRequest request,
            Authentication authentication
    ) {
        UUID userId = UUID.fromString(authentication.getName());
        MockExamAttempt attempt = attemptService.startAttempt(userId, request.getExamId());
        return ResponseEntity.status(HttpStatus.CREATED).body(AttemptResponse.builder()
            .attemptId(attempt.getId())
            .examId(request.getExamId())
            .state(state(attempt.getStatus()))
            .startedAt(attempt.getStartedAt())
            .build());
    }

    @PostMapping("/attempts/{attemptId}/submit")
    public ResponseEntity<SubmissionResponse> submitAnswers(
            @PathVariable UUID attemptId,
            @Valid @RequestBody SubmitAnswersRequest request,
            Authentication authentication
    ) {
        UUID userId = UUID.fromString(authentication.getName());
        List<SubmittedAnswer> answers = request.getAnswers().stream()
            .map(a -> new SubmittedAnswer(a.getQuestionId(), a.getSubmittedContent()))
            .collect(Collectors.toList());

        SubmissionResult result = attemptService.submitAnswers(userId, attemptId, answers);
        return ResponseEntity.ok(SubmissionResponse.builder()
            .attemptId(result.getAttemptId())
            .totalScore(result.getTotalScore())
            .perQuestion(toResponses(result.getPerQuestion()))
            .build());
    }

    @GetMapping("/attempts/{attemptId}")
    public ResponseEntity<AttemptResponse> getAttempt(
            @PathVariable UUID attemptId,
            Authentication authentication
    ) {
        UUID userId = UUID.fromString(authentication.getName());
        AttemptDetails details = attemptService.getAttempt(userId, attemptId);
        return ResponseEntity.ok(AttemptResponse.builder()
            .attemptId(details.getAttemptId())
            .examId(details.getExamId())
            .examTitle(details.getExamTitle())
            .state(state(details.getStatus()))
            .score(details.getScore())
            .startedAt(details.getStartedAt())
            .completedAt(details.getCompletedAt())
            .answers(toResponses(details.getAnswers()))
            .build());
    }

    private static String state(AttemptStatus status) {
        return status.name().toLowerCase(Locale.ROOT);
    }

    private static List<GradedAnswerResponse> toResponses(List<GradeResult> grades) {
        return grades.stream()
            .map(g -> GradedAnswerResponse.builder()
                .questionId(g.getQuestionId())
                .submittedContent(g.getSubmittedContent())
                .awardedPoints(g.getAwardedPoints())
                .correct(g.getCorrect())
                .feedback(g.getFeedback())
                .build())
            .collect(Collectors.toList());
    }
}
