package com.examify.llm.prompt;

import java.util.List;
import java.util.Locale;

public final class PromptTemplates {

    public static final String CONTEXT_START = "=== CONTEXT START ===";
    public static final String CONTEXT_END = "=== CONTEXT END ===";
    public static final String CHUNK_SEPARATOR = "\n\n---\n\n";

    public static final String AWARDED_POINTS_LABEL = "Awarded Points:";
    public static final String FEEDBACK_LABEL = "Feedback:";

    /**
     * Context passages first (most similar first), then the question, with explicit markers between them.
     */
    public static String groundedAnswer(String question, List<String> contextPassages) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(CONTEXT_START).append("\n");
        for (int i = 0; i < contextPassages.size(); i++) {
            if (i > 0) {
                prompt.append(CHUNK_SEPARATOR);
            }
            prompt.append("[Passage ").append(i + 1).append("]\n");
            prompt.append(contextPassages.get(i));
        }
        prompt.append("\n").append(CONTEXT_END).append("\n\n");
        prompt.append("QUESTION: ").append(question).append("\n\n");
        prompt.append("Answer the question using the passages above. Cite passages as [Passage N].");
        return prompt.toString();
    }

    public static String ungroundedAnswer(String question) {
        return "QUESTION: " + question + "\n\nAnswer the question clearly and concisely.";
    }

    public static String gradeAnswer(String questionText, String submittedAnswer, double maxPoints, String referenceText) {
        StringBuilder prompt = new StringBuilder();
        if (referenceText != null && !referenceText.isBlank()) {
            prompt.append(CONTEXT_START).append("\n");
            prompt.append(referenceText);
            prompt.append("\n").append(CONTEXT_END).append("\n\n");
        }
        prompt.append("QUESTION:\n").append(questionText).append("\n\n");
        prompt.append("STUDENT ANSWER:\n").append(submittedAnswer).append("\n\n");
        prompt.append("MAXIMUM POINTS: ").append(formatPoints(maxPoints)).append("\n\n");
        prompt.append("Evaluate the answer for correctness and completeness");
        if (referenceText != null && !referenceText.isBlank()) {
            prompt.append(" against the reference material");
        }
        prompt.append(". Respond with exactly two lines:\n");
        prompt.append(AWARDED_POINTS_LABEL).append(" <number between 0 and ").append(formatPoints(maxPoints)).append(">\n");
        prompt.append(FEEDBACK_LABEL).append(" <one short paragraph explaining the grade>");
        return prompt.toString();
    }

    public static String summarize(String title, String text) {
        return "Summarize the following study material titled \"" + title + "\" in a few paragraphs, "
            + "keeping the key definitions and facts a student would need for an exam.\n\n"
            + CONTEXT_START + "\n" + text + "\n" + CONTEXT_END;
    }

    static String formatPoints(double points) {
        if (points == Math.rint(points)) {
            return String.valueOf((long) points);
        }
        return String.format(Locale.ROOT, "%.2f", points);
    }

    private PromptTemplates() {}
}
