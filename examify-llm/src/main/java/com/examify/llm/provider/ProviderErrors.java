package com.examify.llm.provider;

import com.examify.llm.provider.ProviderClient.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Locale;

/**
 * Translates HTTP and transport failures into {@link ProviderException}s.
 * 429 and 5xx are retryable, every other HTTP status is permanent.
 */
@Slf4j
public final class ProviderErrors {

    private ProviderErrors() {}

    public static ProviderException fromResponse(WebClientResponseException e, String provider, ObjectMapper objectMapper) {
        int status = e.getStatusCode().value();
        boolean retryable = status == 429 || status >= 500;
        String message = String.format("%s API error: %d %s", provider, status, e.getStatusText());

        try {
            JsonNode error = objectMapper.readTree(e.getResponseBodyAsString());
            if (error.has("error") && error.get("error").has("message")) {
                message = provider + " API error: " + error.get("error").get("message").asText();
            }
        } catch (Exception parseFailure) {
            log.debug("[{}] Error body was not JSON | statusCode={}", provider.toUpperCase(Locale.ROOT), status);
        }

        return new ProviderException(message, provider, status, retryable, e);
    }

    /**
     * Connection resets, DNS failures and client-side timeouts: worth another try.
     */
    public static ProviderException fromTransport(Exception e, String provider) {
        return new ProviderException(
            provider + " request failed: " + e.getMessage(),
            provider, 503, true, e
        );
    }

    public static ProviderException malformed(String provider, String what, Throwable cause) {
        return new ProviderException(
            "Failed to parse " + provider + " " + what,
            provider, 502, false, cause
        );
    }
}
