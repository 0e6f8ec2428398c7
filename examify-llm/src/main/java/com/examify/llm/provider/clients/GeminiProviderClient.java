package com.examify.llm.provider.clients;

import com.examify.llm.config.LlmProperties;
import com.examify.llm.provider.LlmProvider;
import com.examify.llm.provider.ProviderClient;
import com.examify.llm.provider.ProviderErrors;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class GeminiProviderClient implements ProviderClient {

    private static final String NAME = LlmProvider.GEMINI.getId();

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties properties;
    private final String model;

    public GeminiProviderClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, LlmProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.model = properties.getGenerationModel() != null && NAME.equals(LlmProvider.canonicalName(properties.getProvider()))
            ? properties.getGenerationModel()
            : LlmProvider.GEMINI.getDefaultModel();
        String baseUrl = properties.getGeminiBaseUrl() != null
            ? properties.getGeminiBaseUrl()
            : LlmProvider.GEMINI.getBaseUrl();
        this.webClient = webClientBuilder.clone()
            .baseUrl(baseUrl)
            .build();
    }

    @Override
    public String generateContent(String systemInstruction, String prompt) throws ProviderException {
        long startTime = System.currentTimeMillis();

        log.info("[GEMINI] Starting content generation | model={} | promptLength={}", model, prompt.length());

        Map<String, Object> request = Map.of(
            "systemInstruction", Map.of(
                "parts", List.of(Map.of("text", systemInstruction))
            ),
            "contents", List.of(
                Map.of("role", "user", "parts", List.of(
                    Map.of("text", prompt)
                ))
            ),
            "generationConfig", Map.of(
                "maxOutputTokens", properties.getMaxOutputTokens(),
                "temperature", properties.getTemperature()
            )
        );

        try {
            String response = webClient.post()
                .uri("/models/{model}:generateContent", model)
                .header("x-goog-api-key", properties.getApiKey())
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .block();

            String content = extractContent(response);
            log.info("[GEMINI] Content generated | model={} | durationMs={} | responseLength={}",
                model, System.currentTimeMillis() - startTime, content.length());
            return content;

        } catch (WebClientResponseException e) {
            log.error("[GEMINI] HTTP error | model={} | statusCode={} | durationMs={} | error={}",
                model, e.getStatusCode().value(), System.currentTimeMillis() - startTime, e.getMessage());
            throw ProviderErrors.fromResponse(e, NAME, objectMapper);
        } catch (ProviderException e) {
            throw e;
        } catch (Exception e) {
            log.error("[GEMINI] Request failed | model={} | durationMs={} | error={}",
                model, System.currentTimeMillis() - startTime, e.getMessage());
            throw ProviderErrors.fromTransport(e, NAME);
        }
    }

    private String extractContent(String response) throws ProviderException {
        JsonNode text;
        try {
            JsonNode root = objectMapper.readTree(response);
            text = root.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        } catch (Exception e) {
            throw ProviderErrors.malformed(NAME, "generation response", e);
        }
        if (text.isMissingNode() || text.asText().isBlank()) {
            throw ProviderErrors.malformed(NAME, "generation response (no candidate text)", null);
        }
        return text.asText();
    }

    @Override
    public String getProviderName() {
        return NAME;
    }

    @Override
    public String getModel() {
        return model;
    }
}
