package com.examify.core.exam;

import com.examify.core.exam.model.GradeResult;
import com.examify.data.entity.DocumentChunk;
import com.examify.data.entity.MockExamQuestion;
import com.examify.data.entity.QuestionType;
import com.examify.llm.prompt.TaskType;
import com.examify.llm.provider.ProviderClient.ProviderException;
import com.examify.llm.service.LlmService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnswerGraderTest {

    @Mock
    private LlmService llmService;

    private AnswerGrader grader;

    @BeforeEach
    void setUp() {
        grader = new AnswerGrader(llmService);
    }

    @Test
    void multipleChoiceMatchIgnoresCaseAndWhitespace() {
        MockExamQuestion question = mcq("B", 2.0);

        GradeResult result = grader.grade(question, "  b ");

        assertEquals(2.0, result.getAwardedPoints());
        assertTrue(result.getCorrect());
        verifyNoInteractions(llmService);
    }

    @Test
    void multipleChoiceMismatchScoresZero() {
        GradeResult result = grader.grade(mcq("B", 2.0), "C");

        assertEquals(0.0, result.getAwardedPoints());
        assertFalse(result.getCorrect());
        assertTrue(result.getFeedback().contains("B"));
    }

    @Test
    void blankOpenEndedAnswerSkipsModel() {
        GradeResult result = grader.grade(essay(10.0, null), "   ");

        assertEquals(0.0, result.getAwardedPoints());
        assertEquals(AnswerGrader.NO_ANSWER_FEEDBACK, result.getFeedback());
        verifyNoInteractions(llmService);
    }

    @Test
    void openEndedReplyIsParsedAndClamped() {
        when(llmService.generate(eq(TaskType.GRADE_ANSWER), anyString()))
            .thenReturn("Awarded Points: 14\nFeedback: Thorough and accurate.");

        GradeResult result = grader.grade(essay(10.0, null), "Mitochondria produce ATP.");

        assertEquals(10.0, result.getAwardedPoints());
        assertEquals("Thorough and accurate.", result.getFeedback());
    }

    @Test
    void negativeScoreIsClampedToZero() {
        when(llmService.generate(any(), anyString())).thenReturn("awarded points: -3\nWrong topic.");

        GradeResult result = grader.grade(essay(5.0, null), "Something unrelated");

        assertEquals(0.0, result.getAwardedPoints());
        assertEquals("Wrong topic.", result.getFeedback());
    }

    @Test
    void providerFailureYieldsZeroWithExplanation() {
        when(llmService.generate(any(), anyString()))
            .thenThrow(new ProviderException("service unavailable", "stub", 503, false));

        GradeResult result = grader.grade(essay(10.0, null), "An answer");

        assertEquals(0.0, result.getAwardedPoints());
        assertTrue(result.getFeedback().startsWith(AnswerGrader.FAILURE_FEEDBACK_PREFIX));
    }

    @Test
    void replyWithoutScoreCountsAsFailure() {
        when(llmService.generate(any(), anyString())).thenReturn("Nice effort, but I cannot grade this.");

        GradeResult result = grader.grade(essay(10.0, null), "An answer");

        assertEquals(0.0, result.getAwardedPoints());
        assertTrue(result.getFeedback().startsWith(AnswerGrader.FAILURE_FEEDBACK_PREFIX));
    }

    @Test
    void referenceChunkIsIncludedInPrompt() {
        DocumentChunk chunk = DocumentChunk.builder().content("ATP synthase sits in the inner membrane.").build();
        when(llmService.generate(any(), anyString())).thenReturn("Awarded Points: 3\nFeedback: ok");

        grader.grade(essay(5.0, chunk), "Inner membrane");

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmService).generate(eq(TaskType.GRADE_ANSWER), prompt.capture());
        assertTrue(prompt.getValue().contains("ATP synthase sits in the inner membrane."));
    }

    @Test
    void parseAcceptsFractionsAndDecimals() {
        assertEquals(2.5, AnswerGrader.parse("Awarded Points: 2.5 / 5", 5.0).points);
        assertNull(AnswerGrader.parse("Awarded Points: none", 5.0));
        assertNull(AnswerGrader.parse("", 5.0));
    }

    private static MockExamQuestion mcq(String correct, double points) {
        return MockExamQuestion.builder()
            .id(UUID.randomUUID())
            .questionText("Which organelle produces ATP?")
            .questionType(QuestionType.MULTIPLE_CHOICE)
            .points(points)
            .correctOption(correct)
            .build();
    }

    private static MockExamQuestion essay(double points, DocumentChunk source) {
        return MockExamQuestion.builder()
            .id(UUID.randomUUID())
            .questionText("Explain how cells produce energy.")
            .questionType(QuestionType.ESSAY)
            .points(points)
            .sourceChunk(source)
            .build();
    }
}
