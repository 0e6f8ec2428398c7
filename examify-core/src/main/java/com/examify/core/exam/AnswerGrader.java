package com.examify.core.exam;

import com.examify.core.exam.model.GradeResult;
import com.examify.data.entity.MockExamQuestion;
import com.examify.llm.prompt.PromptTemplates;
import com.examify.llm.prompt.TaskType;
import com.examify.llm.service.LlmService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grades a single answer. Multiple choice is a key comparison; open-ended answers go to the language
 * model. Never throws: any grading failure becomes zero points with an explanatory feedback string.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnswerGrader {

    static final String NO_ANSWER_FEEDBACK = "No answer was provided by the user for this question.";
    static final String FAILURE_FEEDBACK_PREFIX = "Automated grading failed due to an AI service error: ";
    static final String CORRECT_FEEDBACK = "Correct.";
    static final String INCORRECT_FEEDBACK_PREFIX = "Incorrect. The correct option is ";

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");
    private static final String POINTS_PREFIX = PromptTemplates.AWARDED_POINTS_LABEL.toLowerCase(Locale.ROOT);
    private static final String FEEDBACK_PREFIX = PromptTemplates.FEEDBACK_LABEL.toLowerCase(Locale.ROOT);

    private final LlmService llmService;

    public GradeResult grade(MockExamQuestion question, String submittedContent) {
        String content = submittedContent != null ? submittedContent : "";
        if (question.getQuestionType().isOpenEnded()) {
            return gradeOpenEnded(question, content);
        }
        return gradeMultipleChoice(question, content);
    }

    GradeResult gradeMultipleChoice(MockExamQuestion question, String content) {
        if (content.isBlank()) {
            return noAnswer(question, content).toBuilder().correct(false).build();
        }
        String expected = question.getCorrectOption();
        boolean correct = expected != null && expected.trim().equalsIgnoreCase(content.trim());
        return GradeResult.builder()
            .questionId(question.getId())
            .submittedContent(content)
            .awardedPoints(correct ? question.getPoints() : 0.0)
            .correct(correct)
            .feedback(correct ? CORRECT_FEEDBACK : INCORRECT_FEEDBACK_PREFIX + expected + ".")
            .build();
    }

    GradeResult gradeOpenEnded(MockExamQuestion question, String content) {
        if (content.isBlank()) {
            return noAnswer(question, content);
        }

        String reference = question.getSourceChunk() != null ? question.getSourceChunk().getContent() : null;
        String prompt = PromptTemplates.gradeAnswer(question.getQuestionText(), content, question.getPoints(), reference);

        long startTime = System.currentTimeMillis();
        String reply;
        try {
            reply = llmService.generate(TaskType.GRADE_ANSWER, prompt);
        } catch (RuntimeException e) {
            log.error("[GRADING] Grading call failed | questionId={} | error={}", question.getId(), e.getMessage());
            return failed(question, content, e.getMessage());
        }

        ParsedGrade parsed = parse(reply, question.getPoints());
        if (parsed == null) {
            log.warn("[GRADING] Unparseable grading reply | questionId={} | replyLength={}",
                question.getId(), reply != null ? reply.length() : 0);
            return failed(question, content, "the grading reply did not contain a score");
        }

        log.info("[GRADING] Graded | questionId={} | awarded={} | max={} | durationMs={}",
            question.getId(), parsed.points, question.getPoints(), System.currentTimeMillis() - startTime);
        return GradeResult.builder()
            .questionId(question.getId())
            .submittedContent(content)
            .awardedPoints(parsed.points)
            .feedback(parsed.feedback)
            .build();
    }

    /**
     * Zero-point result used when grading could not produce a score (error, timeout, bad reply).
     */
    public GradeResult failed(MockExamQuestion question, String content, String reason) {
        return GradeResult.builder()
            .questionId(question.getId())
            .submittedContent(content)
            .awardedPoints(0.0)
            .feedback(FAILURE_FEEDBACK_PREFIX + (reason != null ? reason : "unknown error"))
            .build();
    }

    private GradeResult noAnswer(MockExamQuestion question, String content) {
        return GradeResult.builder()
            .questionId(question.getId())
            .submittedContent(content)
            .awardedPoints(0.0)
            .feedback(NO_ANSWER_FEEDBACK)
            .build();
    }

    /**
     * Reads the first {@code Awarded Points:} line, clamped into [0, max]; every other line is feedback.
     *
     * @return null when no line carries a number
     */
    static ParsedGrade parse(String reply, double maxPoints) {
        if (reply == null || reply.isBlank()) {
            return null;
        }
        Double points = null;
        List<String> feedbackLines = new ArrayList<>();
        for (String line : reply.split("\\R")) {
            String normalized = line.trim().toLowerCase(Locale.ROOT);
            if (points == null && normalized.startsWith(POINTS_PREFIX)) {
                Matcher m = NUMBER.matcher(normalized.substring(POINTS_PREFIX.length()));
                if (m.find()) {
                    points = Double.parseDouble(m.group());
                    continue;
                }
            }
            if (normalized.startsWith(FEEDBACK_PREFIX)) {
                feedbackLines.add(line.trim().substring(FEEDBACK_PREFIX.length()).trim());
            } else {
                feedbackLines.add(line);
            }
        }
        if (points == null) {
            return null;
        }
        double clamped = Math.min(Math.max(0.0, points), maxPoints);
        String feedback = String.join("\n", feedbackLines).trim();
        if (feedback.isEmpty()) {
            feedback = "Grading complete. Please review the awarded points.";
        }
        return new ParsedGrade(clamped, feedback);
    }

    static final class ParsedGrade {
        final double points;
        final String feedback;

        ParsedGrade(double points, String feedback) {
            this.points = points;
            this.feedback = feedback;
        }
    }
}
