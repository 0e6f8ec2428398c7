package com.examify.core.chunking;

import com.examify.common.exception.ValidationException;
import com.examify.common.util.TokenCounter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits extracted text into overlapping, bounded chunks.
 *
 * <p>Every chunk after the first starts with exactly {@code overlap} characters copied from the end of
 * the chunk before it, so the original text is {@code chunk[0] + chunk[1].substring(overlap) + ...}.
 * Cut points are chosen, in order of preference, after a paragraph break, after the end of a sentence,
 * after any whitespace, and only then at the size limit.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TextChunker {

    private final ChunkingProperties properties;

    public List<TextChunk> chunk(String text) {
        List<String> parts = split(text, properties.getMaxChars(), properties.getOverlapChars());
        List<TextChunk> chunks = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size(); i++) {
            chunks.add(TextChunk.builder()
                .content(parts.get(i))
                .chunkIndex(i)
                .tokenCount(TokenCounter.countTokens(parts.get(i)))
                .build());
        }
        log.info("[CHUNKER] Created chunks | inputChars={} | chunks={} | maxChars={} | overlapChars={}",
            text == null ? 0 : text.length(), chunks.size(), properties.getMaxChars(), properties.getOverlapChars());
        return chunks;
    }

    public static List<String> split(String text, int maxChars, int overlap) {
        if (maxChars <= 0) {
            throw new ValidationException("maxChars must be positive, got " + maxChars);
        }
        if (overlap < 0 || overlap >= maxChars) {
            throw new ValidationException("overlap must be in [0, maxChars), got " + overlap);
        }

        List<String> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }

        int length = text.length();
        int start = 0;
        while (length - start > maxChars) {
            int limit = start + maxChars;
            // the next chunk starts at end - overlap, which must lie past start
            int minEnd = start + overlap + 1;
            int preferredFloor = Math.max(minEnd, start + maxChars / 2);

            int end = paragraphBoundary(text, preferredFloor, limit);
            if (end < 0) {
                end = sentenceBoundary(text, preferredFloor, limit);
            }
            if (end < 0) {
                end = whitespaceBoundary(text, minEnd, limit);
            }
            if (end < 0) {
                end = hardCut(text, minEnd, limit);
            }

            chunks.add(text.substring(start, end));
            start = end - overlap;
        }
        chunks.add(text.substring(start));
        return chunks;
    }

    /** Position just after the last "\n\n" ending within [floor, limit], or -1. */
    private static int paragraphBoundary(String text, int floor, int limit) {
        int idx = text.lastIndexOf("\n\n", limit - 2);
        if (idx >= 0 && idx + 2 >= floor) {
            return idx + 2;
        }
        return -1;
    }

    private static int sentenceBoundary(String text, int floor, int limit) {
        for (int end = limit; end >= floor && end >= 2; end--) {
            char terminator = text.charAt(end - 2);
            if (Character.isWhitespace(text.charAt(end - 1))
                    && (terminator == '.' || terminator == '!' || terminator == '?')) {
                return end;
            }
        }
        return -1;
    }

    private static int whitespaceBoundary(String text, int floor, int limit) {
        for (int end = limit; end >= floor && end >= 1; end--) {
            if (Character.isWhitespace(text.charAt(end - 1))) {
                return end;
            }
        }
        return -1;
    }

    private static int hardCut(String text, int floor, int limit) {
        // keep surrogate pairs together when there is room to
        if (Character.isHighSurrogate(text.charAt(limit - 1)) && limit - 1 >= floor) {
            return limit - 1;
        }
        return limit;
    }
}
