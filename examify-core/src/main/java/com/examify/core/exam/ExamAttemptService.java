package com.examify.core.exam;

import com.examify.common.exception.ConflictException;
import com.examify.common.exception.NotFoundException;
import com.examify.common.exception.ValidationException;
import com.examify.core.exam.model.AttemptDetails;
import com.examify.core.exam.model.GradeResult;
import com.examify.core.exam.model.SubmissionResult;
import com.examify.core.exam.model.SubmittedAnswer;
import com.examify.data.entity.AttemptStatus;
import com.examify.data.entity.MockExam;
import com.examify.data.entity.MockExamAnswer;
import com.examify.data.entity.MockExamAttempt;
import com.examify.data.entity.MockExamQuestion;
import com.examify.data.repository.MockExamAnswerRepository;
import com.examify.data.repository.MockExamAttemptRepository;
import com.examify.data.repository.MockExamQuestionRepository;
import com.examify.data.repository.MockExamRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Mock exam attempt lifecycle: {@code start -> IN_PROGRESS -> submit -> COMPLETED}.
 *
 * <p>Submission validates everything up front, grades with no transaction open, then hands the grades to
 * {@link AttemptCompletionWriter} for the single locked write.
 */
@Service
@Slf4j
public class ExamAttemptService {

    private final MockExamRepository examRepository;
    private final MockExamQuestionRepository questionRepository;
    private final MockExamAttemptRepository attemptRepository;
    private final MockExamAnswerRepository answerRepository;
    private final AnswerGrader answerGrader;
    private final AttemptCompletionWriter completionWriter;
    private final ExamProperties properties;
    private final ExecutorService gradingExecutor;

    public ExamAttemptService(
        MockExamRepository examRepository,
        MockExamQuestionRepository questionRepository,
        MockExamAttemptRepository attemptRepository,
        MockExamAnswerRepository answerRepository,
        AnswerGrader answerGrader,
        AttemptCompletionWriter completionWriter,
        ExamProperties properties
    ) {
        this.examRepository = examRepository;
        this.questionRepository = questionRepository;
        this.attemptRepository = attemptRepository;
        this.answerRepository = answerRepository;
        this.answerGrader = answerGrader;
        this.completionWriter = completionWriter;
        this.properties = properties;
        this.gradingExecutor = Executors.newFixedThreadPool(Math.max(1, properties.getGradingThreads()));
    }

    /**
     * @throws ConflictException carrying the existing attempt id when the user already has one in progress
     *                           and concurrent attempts are disabled
     */
    @Transactional
    public MockExamAttempt startAttempt(UUID userId, UUID examId) {
        MockExam exam = examRepository.findById(examId)
            .orElseThrow(() -> new NotFoundException("MockExam", examId));

        if (!properties.isAllowConcurrentAttempts()) {
            List<MockExamAttempt> open = attemptRepository.findByUserIdAndMockExam_IdAndStatusOrderByStartedAtDesc(
                userId, examId, AttemptStatus.IN_PROGRESS);
            if (!open.isEmpty()) {
                UUID existingId = open.get(0).getId();
                log.info("[EXAM] Start rejected, attempt already in progress | userId={} | examId={} | attemptId={}",
                    userId, examId, existingId);
                throw new ConflictException("An attempt for this exam is already in progress", existingId);
            }
        }

        MockExamAttempt attempt = attemptRepository.save(MockExamAttempt.builder()
            .userId(userId)
            .mockExam(exam)
            .status(AttemptStatus.IN_PROGRESS)
            .build());
        log.info("[EXAM] Attempt started | userId={} | examId={} | attemptId={}", userId, examId, attempt.getId());
        return attempt;
    }

    public SubmissionResult submitAnswers(UUID userId, UUID attemptId, List<SubmittedAnswer> answers) {
        long startTime = System.currentTimeMillis();

        MockExamAttempt attempt = loadOwnedAttempt(userId, attemptId);
        if (!attempt.isInProgress()) {
            throw new ConflictException("Attempt " + attemptId + " has already been submitted", attemptId);
        }
        List<MockExamQuestion> questions = questionRepository.findForGrading(attempt.getMockExamId());
        Map<UUID, String> contentByQuestion = validateAnswers(questions, answers);

        log.info("[EXAM] Grading submission | attemptId={} | questions={} | answered={}",
            attemptId, questions.size(), answers != null ? answers.size() : 0);

        List<GradeResult> grades = gradeAll(questions, contentByQuestion);
        double total = completionWriter.complete(attemptId, grades);

        log.info("[EXAM] Submission graded | attemptId={} | score={} | durationMs={}",
            attemptId, total, System.currentTimeMillis() - startTime);
        return SubmissionResult.builder()
            .attemptId(attemptId)
            .totalScore(total)
            .perQuestion(grades)
            .build();
    }

    @Transactional(readOnly = true)
    public AttemptDetails getAttempt(UUID userId, UUID attemptId) {
        MockExamAttempt attempt = loadOwnedAttempt(userId, attemptId);
        List<GradeResult> graded = answerRepository.findByAttemptId(attemptId).stream()
            .map(ExamAttemptService::toGradeResult)
            .collect(Collectors.toList());
        return AttemptDetails.builder()
            .attemptId(attempt.getId())
            .examId(attempt.getMockExam().getId())
            .examTitle(attempt.getMockExam().getTitle())
            .status(attempt.getStatus())
            .score(attempt.getScore())
            .startedAt(attempt.getStartedAt())
            .completedAt(attempt.getCompletedAt())
            .answers(graded)
            .build();
    }

    private MockExamAttempt loadOwnedAttempt(UUID userId, UUID attemptId) {
        return attemptRepository.findWithExam(attemptId)
            .filter(a -> a.getUserId().equals(userId))
            .orElseThrow(() -> new NotFoundException("MockExamAttempt", attemptId));
    }

    /**
     * Submitted content keyed by question id, in exam order. Questions left out are answered with "".
     */
    private Map<UUID, String> validateAnswers(List<MockExamQuestion> questions, List<SubmittedAnswer> answers) {
        Map<UUID, String> submitted = new HashMap<>();
        if (answers != null) {
            Map<UUID, MockExamQuestion> byId = questions.stream()
                .collect(Collectors.toMap(MockExamQuestion::getId, q -> q));
            for (SubmittedAnswer answer : answers) {
                if (answer.getQuestionId() == null) {
                    throw new ValidationException("Every answer needs a question id");
                }
                if (!byId.containsKey(answer.getQuestionId())) {
                    throw new ValidationException("Question " + answer.getQuestionId() + " does not belong to this exam");
                }
                if (submitted.putIfAbsent(answer.getQuestionId(),
                        answer.getSubmittedContent() != null ? answer.getSubmittedContent() : "") != null) {
                    throw new ValidationException("Question " + answer.getQuestionId() + " was answered more than once");
                }
            }
        }

        Map<UUID, String> ordered = new LinkedHashMap<>();
        for (MockExamQuestion question : questions) {
            ordered.put(question.getId(), submitted.getOrDefault(question.getId(), ""));
        }
        return ordered;
    }

    /**
     * Multiple choice is graded inline; open-ended answers run in parallel and each wait is bounded by the
     * grading timeout.
     */
    private List<GradeResult> gradeAll(List<MockExamQuestion> questions, Map<UUID, String> contentByQuestion) {
        Map<UUID, CompletableFuture<GradeResult>> pending = new HashMap<>();
        for (MockExamQuestion question : questions) {
            String content = contentByQuestion.get(question.getId());
            if (question.getQuestionType().isOpenEnded() && !content.isBlank()) {
                pending.put(question.getId(),
                    CompletableFuture.supplyAsync(() -> answerGrader.grade(question, content), gradingExecutor));
            }
        }

        List<GradeResult> grades = new ArrayList<>(questions.size());
        for (MockExamQuestion question : questions) {
            String content = contentByQuestion.get(question.getId());
            CompletableFuture<GradeResult> future = pending.get(question.getId());
            grades.add(future == null ? answerGrader.grade(question, content) : await(future, question, content));
        }
        return grades;
    }

    private GradeResult await(CompletableFuture<GradeResult> future, MockExamQuestion question, String content) {
        try {
            return future.get(properties.getGradingTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[GRADING] Grading timed out | questionId={} | timeoutSeconds={}",
                question.getId(), properties.getGradingTimeoutSeconds());
            return answerGrader.failed(question, content, "grading timed out");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return answerGrader.failed(question, content, "grading was interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[GRADING] Grading task failed | questionId={}", question.getId(), cause);
            return answerGrader.failed(question, content, cause.getMessage());
        }
    }

    private static GradeResult toGradeResult(MockExamAnswer answer) {
        return GradeResult.builder()
            .questionId(answer.getQuestion().getId())
            .submittedContent(answer.getSubmittedContent())
            .awardedPoints(answer.getPointsAwarded())
            .correct(answer.getCorrect())
            .feedback(answer.getFeedback())
            .build();
    }

    @PreDestroy
    public void shutdown() {
        gradingExecutor.shutdown();
    }
}
