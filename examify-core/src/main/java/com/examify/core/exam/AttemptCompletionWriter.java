package com.examify.core.exam;

import com.examify.common.exception.ConflictException;
import com.examify.common.exception.NotFoundException;
import com.examify.core.event.ExamCompletedEvent;
import com.examify.core.exam.model.GradeResult;
import com.examify.data.entity.MockExamAnswer;
import com.examify.data.entity.MockExamAttempt;
import com.examify.data.repository.MockExamAnswerRepository;
import com.examify.data.repository.MockExamAttemptRepository;
import com.examify.data.repository.MockExamQuestionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Writes graded answers, the total score and the COMPLETED transition in one transaction under the
 * attempt row lock. Only the first of two concurrent submissions gets past the status check.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AttemptCompletionWriter {

    private final MockExamAttemptRepository attemptRepository;
    private final MockExamAnswerRepository answerRepository;
    private final MockExamQuestionRepository questionRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public double complete(UUID attemptId, List<GradeResult> grades) {
        MockExamAttempt attempt = attemptRepository.findByIdForUpdate(attemptId)
            .orElseThrow(() -> new NotFoundException("MockExamAttempt", attemptId));
        if (!attempt.isInProgress()) {
            throw new ConflictException("Attempt " + attemptId + " has already been submitted", attemptId);
        }

        List<MockExamAnswer> answers = grades.stream()
            .map(g -> MockExamAnswer.builder()
                .attempt(attempt)
                .question(questionRepository.getReferenceById(g.getQuestionId()))
                .submittedContent(g.getSubmittedContent())
                .pointsAwarded(g.getAwardedPoints())
                .correct(g.getCorrect())
                .feedback(g.getFeedback())
                .build())
            .collect(Collectors.toList());
        answerRepository.saveAll(answers);

        double total = grades.stream().mapToDouble(GradeResult::getAwardedPoints).sum();
        attempt.complete(total, Instant.now());
        attemptRepository.save(attempt);

        eventPublisher.publishEvent(new ExamCompletedEvent(attemptId, attempt.getUserId(), total));
        log.info("[EXAM] Attempt completed | attemptId={} | userId={} | answers={} | score={}",
            attemptId, attempt.getUserId(), answers.size(), total);
        return total;
    }
}
