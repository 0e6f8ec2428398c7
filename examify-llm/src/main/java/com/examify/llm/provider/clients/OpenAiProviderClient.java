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

/**
 * Chat Completions API.
 */
@Component
@Slf4j
public class OpenAiProviderClient implements ProviderClient {

    private static final String NAME = LlmProvider.OPENAI.getId();

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties properties;
    private final String model;

    public OpenAiProviderClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, LlmProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.model = properties.getGenerationModel() != null && NAME.equals(LlmProvider.canonicalName(properties.getProvider()))
            ? properties.getGenerationModel()
            : LlmProvider.OPENAI.getDefaultModel();
        String baseUrl = properties.getOpenaiBaseUrl() != null
            ? properties.getOpenaiBaseUrl()
            : LlmProvider.OPENAI.getBaseUrl();
        this.webClient = webClientBuilder.clone()
            .baseUrl(baseUrl)
            .build();
    }

    @Override
    public String generateContent(String systemInstruction, String prompt) throws ProviderException {
        long startTime = System.currentTimeMillis();

        log.info("[OPENAI] Starting content generation | model={} | promptLength={}", model, prompt.length());

        Map<String, Object> request = Map.of(
            "model", model,
            "messages", List.of(
                Map.of("role", "system", "content", systemInstruction),
                Map.of("role", "user", "content", prompt)
            ),
            "max_tokens", properties.getMaxOutputTokens(),
            "temperature", properties.getTemperature()
        );

        try {
            String response = webClient.post()
                .uri("/chat/completions")
                .header("Authorization", "Bearer " + properties.getApiKey())
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .block();

            String content = extractContent(response);
            log.info("[OPENAI] Content generated | model={} | durationMs={} | responseLength={}",
                model, System.currentTimeMillis() - startTime, content.length());
            return content;

        } catch (WebClientResponseException e) {
            log.error("[OPENAI] HTTP error | model={} | statusCode={} | durationMs={} | error={}",
                model, e.getStatusCode().value(), System.currentTimeMillis() - startTime, e.getMessage());
            throw ProviderErrors.fromResponse(e, NAME, objectMapper);
        } catch (ProviderException e) {
            throw e;
        } catch (Exception e) {
            log.error("[OPENAI] Request failed | model={} | durationMs={} | error={}",
                model, System.currentTimeMillis() - startTime, e.getMessage());
            throw ProviderErrors.fromTransport(e, NAME);
        }
    }

    private String extractContent(String response) throws ProviderException {
        JsonNode content;
        try {
            JsonNode root = objectMapper.readTree(response);
            content = root.path("choices").path(0).path("message").path("content");
        } catch (Exception e) {
            throw ProviderErrors.malformed(NAME, "chat completion", e);
        }
        if (content.isMissingNode() || content.isNull() || content.asText().isBlank()) {
            throw ProviderErrors.malformed(NAME, "chat completion (empty message)", null);
        }
        return content.asText();
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
