package com.examify.common.util;

/**
 * Token estimate stored with each chunk. Takes the larger of a character-based and a word-based guess,
 * so dense prose and long runs of short words are both counted conservatively.
 */
public final class TokenCounter {

    private static final double CHARS_PER_TOKEN = 4.0;
    private static final double TOKENS_PER_WORD = 1.3;

    private TokenCounter() {}

    public static int countTokens(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        int byChars = (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
        int byWords = (int) Math.ceil(countWords(text) * TOKENS_PER_WORD);
        return Math.max(byChars, byWords);
    }

    static int countWords(String text) {
        int words = 0;
        boolean inWord = false;
        for (int i = 0; i < text.length(); i++) {
            boolean whitespace = Character.isWhitespace(text.charAt(i));
            if (!whitespace && !inWord) {
                words++;
            }
            inWord = !whitespace;
        }
        return words;
    }
}
