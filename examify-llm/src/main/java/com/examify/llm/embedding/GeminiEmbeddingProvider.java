package com.examify.llm.embedding;

import com.examify.llm.config.LlmProperties;
import com.examify.llm.provider.LlmProvider;
import com.examify.llm.provider.ProviderClient.ProviderException;
import com.examify.llm.provider.ProviderErrors;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Gemini {@code batchEmbedContents}, up to 100 texts per call.
 */
@Component
@Slf4j
public class GeminiEmbeddingProvider implements EmbeddingProvider {

    private static final String NAME = LlmProvider.GEMINI.getId();
    private static final int MAX_BATCH_SIZE = 100;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties properties;
    private final String model;
    private final int dimension;
    private final boolean explicitDimension;

    public GeminiEmbeddingProvider(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, LlmProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        boolean active = NAME.equals(LlmProvider.canonicalName(properties.getProvider()));
        this.model = active && properties.getEmbeddingModel() != null
            ? properties.getEmbeddingModel()
            : LlmProvider.GEMINI.getDefaultEmbeddingModel();
        this.explicitDimension = active && properties.getEmbeddingDimension() != null;
        this.dimension = explicitDimension
            ? properties.getEmbeddingDimension()
            : LlmProvider.GEMINI.getDefaultEmbeddingDimension();
        String baseUrl = properties.getGeminiBaseUrl() != null
            ? properties.getGeminiBaseUrl()
            : LlmProvider.GEMINI.getBaseUrl();
        this.webClient = webClientBuilder.clone()
            .baseUrl(baseUrl)
            .build();
    }

    @Override
    public List<float[]> embedBatch(List<String> texts, EmbeddingPurpose purpose) throws ProviderException {
        String taskType = purpose == EmbeddingPurpose.QUERY ? "RETRIEVAL_QUERY" : "RETRIEVAL_DOCUMENT";

        List<Map<String, Object>> requests = new ArrayList<>(texts.size());
        for (String text : texts) {
            Map<String, Object> entry = new HashMap<>();
            entry.put("model", "models/" + model);
            entry.put("content", Map.of("parts", List.of(Map.of("text", text))));
            entry.put("taskType", taskType);
            if (explicitDimension) {
                entry.put("outputDimensionality", dimension);
            }
            requests.add(entry);
        }

        long startTime = System.currentTimeMillis();
        try {
            String response = webClient.post()
                .uri("/models/{model}:batchEmbedContents", model)
                .header("x-goog-api-key", properties.getApiKey())
                .bodyValue(Map.of("requests", requests))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .block();

            List<float[]> vectors = parse(response);
            log.debug("[GEMINI_EMBED] Batch embedded | model={} | texts={} | taskType={} | durationMs={}",
                model, texts.size(), taskType, System.currentTimeMillis() - startTime);
            return vectors;

        } catch (WebClientResponseException e) {
            log.warn("[GEMINI_EMBED] HTTP error | model={} | statusCode={} | texts={} | error={}",
                model, e.getStatusCode().value(), texts.size(), e.getMessage());
            throw ProviderErrors.fromResponse(e, NAME, objectMapper);
        } catch (ProviderException e) {
            throw e;
        } catch (Exception e) {
            log.warn("[GEMINI_EMBED] Request failed | model={} | texts={} | error={}", model, texts.size(), e.getMessage());
            throw ProviderErrors.fromTransport(e, NAME);
        }
    }

    private List<float[]> parse(String response) {
        try {
            JsonNode embeddings = objectMapper.readTree(response).path("embeddings");
            List<float[]> vectors = new ArrayList<>(embeddings.size());
            for (JsonNode embedding : embeddings) {
                JsonNode values = embedding.path("values");
                float[] vector = new float[values.size()];
                for (int i = 0; i < values.size(); i++) {
                    vector[i] = (float) values.get(i).asDouble();
                }
                vectors.add(vector);
            }
            return vectors;
        } catch (Exception e) {
            throw ProviderErrors.malformed(NAME, "embedding response", e);
        }
    }

    @Override
    public String getProviderName() {
        return NAME;
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    @Override
    public int getMaxBatchSize() {
        return MAX_BATCH_SIZE;
    }
}
