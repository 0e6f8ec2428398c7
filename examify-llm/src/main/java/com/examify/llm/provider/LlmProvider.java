package com.examify.llm.provider;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;
import java.util.Set;

/**
 * Hosted model vendors the platform can be configured against.
 */
@Getter
@RequiredArgsConstructor
public enum LlmProvider {

    GEMINI(
        "gemini",
        Set.of("google"),
        "https://generativelanguage.googleapis.com/v1beta",
        "gemini-2.0-flash",
        "text-embedding-004",
        768
    ),

    OPENAI(
        "openai",
        Set.of(),
        "https://api.openai.com/v1",
        "gpt-4o-mini",
        "text-embedding-3-small",
        1536
    );

    private final String id;
    private final Set<String> aliases;
    private final String baseUrl;
    private final String defaultModel;
    private final String defaultEmbeddingModel;
    private final int defaultEmbeddingDimension;

    /**
     * Maps a configured provider name ("google", "Gemini", "openai") to the id strategies register under.
     * Names that match no built-in vendor are returned lower-cased unchanged.
     */
    public static String canonicalName(String configured) {
        if (configured == null) {
            return null;
        }
        String name = configured.trim().toLowerCase(Locale.ROOT);
        for (LlmProvider provider : values()) {
            if (provider.id.equals(name) || provider.aliases.contains(name)) {
                return provider.id;
            }
        }
        return name;
    }
}
