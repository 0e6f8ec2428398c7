package com.examify.api.exam;

import com.examify.api.support.StubProviderClient;
import com.examify.common.exception.ConflictException;
import com.examify.common.exception.NotFoundException;
import com.examify.common.exception.ValidationException;
import com.examify.core.exam.ExamAttemptService;
import com.examify.core.exam.model.AttemptDetails;
import com.examify.core.exam.model.GradeResult;
import com.examify.core.exam.model.SubmissionResult;
import com.examify.core.exam.model.SubmittedAnswer;
import com.examify.core.ledger.ProgressLedger;
import com.examify.data.entity.AttemptStatus;
import com.examify.data.entity.MockExam;
import com.examify.data.entity.MockExamAttempt;
import com.examify.data.entity.MockExamQuestion;
import com.examify.data.entity.QuestionType;
import com.examify.data.entity.UserProfile;
import com.examify.data.repository.MockExamRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ExamAttemptFlowTest {

    @Autowired
    private ExamAttemptService examAttemptService;

    @Autowired
    private ProgressLedger progressLedger;

    @Autowired
    private MockExamRepository examRepository;

    @Autowired
    private StubProviderClient stubProvider;

    private UUID userId;
    private MockExam exam;
    private UUID firstChoice;
    private UUID secondChoice;
    private UUID essay;

    @BeforeEach
    void setUp() {
        stubProvider.reset();
        userId = UUID.randomUUID();

        MockExam draft = MockExam.builder().title("Cell Biology Midterm").courseId("BIO-101").build();
        draft.addQuestion(MockExamQuestion.builder()
            .questionText("Which organelle produces ATP?")
            .questionType(QuestionType.MULTIPLE_CHOICE)
            .points(10.0)
            .options(new LinkedHashMap<>(Map.of("A", "Nucleus", "B", "Mitochondrion")))
            .correctOption("B")
            .build());
        draft.addQuestion(MockExamQuestion.builder()
            .questionText("Which organelle holds the DNA?")
            .questionType(QuestionType.MULTIPLE_CHOICE)
            .points(10.0)
            .options(new LinkedHashMap<>(Map.of("A", "Nucleus", "B", "Ribosome")))
            .correctOption("A")
            .build());
        draft.addQuestion(MockExamQuestion.builder()
            .questionText("Explain the role of the cell membrane.")
            .questionType(QuestionType.ESSAY)
            .points(20.0)
            .build());
        exam = examRepository.save(draft);

        firstChoice = exam.getQuestions().get(0).getId();
        secondChoice = exam.getQuestions().get(1).getId();
        essay = exam.getQuestions().get(2).getId();
    }

    @Test
    void gradesEveryQuestionAndCompletesTheAttempt() {
        stubProvider.reply("Awarded Points: 15\nFeedback: Covers permeability but not transport proteins.");
        MockExamAttempt attempt = examAttemptService.startAttempt(userId, exam.getId());

        SubmissionResult result = examAttemptService.submitAnswers(userId, attempt.getId(), List.of(
            new SubmittedAnswer(firstChoice, " b "),
            new SubmittedAnswer(secondChoice, "B"),
            new SubmittedAnswer(essay, "It controls what enters and leaves the cell.")));

        assertEquals(25.0, result.getTotalScore(), 1e-9);
        GradeResult mcqRight = result.getPerQuestion().get(0);
        assertEquals(10.0, mcqRight.getAwardedPoints(), 1e-9);
        assertTrue(mcqRight.getCorrect());
        GradeResult mcqWrong = result.getPerQuestion().get(1);
        assertEquals(0.0, mcqWrong.getAwardedPoints(), 1e-9);
        assertFalse(mcqWrong.getCorrect());
        assertEquals(15.0, result.getPerQuestion().get(2).getAwardedPoints(), 1e-9);
        assertEquals("Covers permeability but not transport proteins.", result.getPerQuestion().get(2).getFeedback());

        AttemptDetails details = examAttemptService.getAttempt(userId, attempt.getId());
        assertEquals(AttemptStatus.COMPLETED, details.getStatus());
        assertEquals(25.0, details.getScore(), 1e-9);
        assertNotNull(details.getCompletedAt());
        assertEquals(3, details.getAnswers().size());

        UserProfile profile = progressLedger.getProfile(userId);
        assertEquals(1, profile.getMockExamsCompleted());
        assertEquals(25.0, profile.getAverageMockExamScore(), 1e-9);
        assertEquals(25L, profile.getTotalPoints());
    }

    @Test
    void providerFailureScoresZeroButStillCompletes() {
        stubProvider.failWith(400, false);
        MockExamAttempt attempt = examAttemptService.startAttempt(userId, exam.getId());

        SubmissionResult result = examAttemptService.submitAnswers(userId, attempt.getId(), List.of(
            new SubmittedAnswer(firstChoice, "B"),
            new SubmittedAnswer(essay, "The membrane is selectively permeable.")));

        GradeResult essayGrade = result.getPerQuestion().get(2);
        assertEquals(0.0, essayGrade.getAwardedPoints(), 1e-9);
        assertTrue(essayGrade.getFeedback().startsWith("Automated grading failed due to an AI service error: "));
        assertEquals(10.0, result.getTotalScore(), 1e-9);
        assertEquals(AttemptStatus.COMPLETED, examAttemptService.getAttempt(userId, attempt.getId()).getStatus());
    }

    @Test
    void unansweredQuestionsScoreZeroWithoutCallingTheModel() {
        MockExamAttempt attempt = examAttemptService.startAttempt(userId, exam.getId());

        SubmissionResult result = examAttemptService.submitAnswers(userId, attempt.getId(), List.of());

        assertEquals(0.0, result.getTotalScore(), 1e-9);
        assertEquals(3, result.getPerQuestion().size());
        assertEquals("No answer was provided by the user for this question.",
            result.getPerQuestion().get(2).getFeedback());
        assertTrue(stubProvider.getPrompts().isEmpty());
    }

    @Test
    void secondSubmissionIsRejected() {
        MockExamAttempt attempt = examAttemptService.startAttempt(userId, exam.getId());
        examAttemptService.submitAnswers(userId, attempt.getId(), List.of(new SubmittedAnswer(firstChoice, "B")));

        ConflictException conflict = assertThrows(ConflictException.class, () ->
            examAttemptService.submitAnswers(userId, attempt.getId(), List.of(new SubmittedAnswer(firstChoice, "A"))));
        assertEquals(attempt.getId(), conflict.getConflictingId());
        assertEquals(10.0, examAttemptService.getAttempt(userId, attempt.getId()).getScore(), 1e-9);
    }

    @Test
    void startingTwiceReportsTheOpenAttempt() {
        MockExamAttempt first = examAttemptService.startAttempt(userId, exam.getId());

        ConflictException conflict = assertThrows(ConflictException.class,
            () -> examAttemptService.startAttempt(userId, exam.getId()));
        assertEquals(first.getId(), conflict.getConflictingId());
    }

    @Test
    void foreignQuestionsAndForeignUsersAreRejected() {
        MockExamAttempt attempt = examAttemptService.startAttempt(userId, exam.getId());

        assertThrows(ValidationException.class, () -> examAttemptService.submitAnswers(userId, attempt.getId(),
            List.of(new SubmittedAnswer(UUID.randomUUID(), "B"))));
        assertThrows(ValidationException.class, () -> examAttemptService.submitAnswers(userId, attempt.getId(),
            List.of(new SubmittedAnswer(firstChoice, "B"), new SubmittedAnswer(firstChoice, "A"))));
        assertThrows(NotFoundException.class, () -> examAttemptService.submitAnswers(UUID.randomUUID(),
            attempt.getId(), List.of()));
        assertThrows(NotFoundException.class, () -> examAttemptService.startAttempt(userId, UUID.randomUUID()));

        assertEquals(AttemptStatus.IN_PROGRESS, examAttemptService.getAttempt(userId, attempt.getId()).getStatus());
    }
}
