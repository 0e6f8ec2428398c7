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
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI {@code /embeddings}. The API reports an index per vector, results are placed by that index.
 */
@Component
@Slf4j
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final String NAME = LlmProvider.OPENAI.getId();
    private static final int MAX_BATCH_SIZE = 256;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties properties;
    private final String model;
    private final int dimension;
    private final boolean explicitDimension;

    public OpenAiEmbeddingProvider(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, LlmProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        boolean active = NAME.equals(LlmProvider.canonicalName(properties.getProvider()));
        this.model = active && properties.getEmbeddingModel() != null
            ? properties.getEmbeddingModel()
            : LlmProvider.OPENAI.getDefaultEmbeddingModel();
        this.explicitDimension = active && properties.getEmbeddingDimension() != null;
        this.dimension = explicitDimension
            ? properties.getEmbeddingDimension()
            : LlmProvider.OPENAI.getDefaultEmbeddingDimension();
        String baseUrl = properties.getOpenaiBaseUrl() != null
            ? properties.getOpenaiBaseUrl()
            : LlmProvider.OPENAI.getBaseUrl();
        this.webClient = webClientBuilder.clone()
            .baseUrl(baseUrl)
            .build();
    }

    @Override
    public List<float[]> embedBatch(List<String> texts, EmbeddingPurpose purpose) throws ProviderException {
        Map<String, Object> request = new HashMap<>();
        request.put("model", model);
        request.put("input", texts);
        if (explicitDimension) {
            request.put("dimensions", dimension);
        }

        long startTime = System.currentTimeMillis();
        try {
            String response = webClient.post()
                .uri("/embeddings")
                .header("Authorization", "Bearer " + properties.getApiKey())
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .block();

            List<float[]> vectors = parse(response, texts.size());
            log.debug("[OPENAI_EMBED] Batch embedded | model={} | texts={} | durationMs={}",
                model, texts.size(), System.currentTimeMillis() - startTime);
            return vectors;

        } catch (WebClientResponseException e) {
            log.warn("[OPENAI_EMBED] HTTP error | model={} | statusCode={} | texts={} | error={}",
                model, e.getStatusCode().value(), texts.size(), e.getMessage());
            throw ProviderErrors.fromResponse(e, NAME, objectMapper);
        } catch (ProviderException e) {
            throw e;
        } catch (Exception e) {
            log.warn("[OPENAI_EMBED] Request failed | model={} | texts={} | error={}", model, texts.size(), e.getMessage());
            throw ProviderErrors.fromTransport(e, NAME);
        }
    }

    private List<float[]> parse(String response, int expected) {
        float[][] ordered = new float[expected][];
        try {
            JsonNode data = objectMapper.readTree(response).path("data");
            for (JsonNode item : data) {
                int index = item.path("index").asInt(-1);
                if (index < 0 || index >= expected) {
                    throw new IllegalStateException("embedding index out of range: " + index);
                }
                JsonNode values = item.path("embedding");
                float[] vector = new float[values.size()];
                for (int i = 0; i < values.size(); i++) {
                    vector[i] = (float) values.get(i).asDouble();
                }
                ordered[index] = vector;
            }
        } catch (Exception e) {
            throw ProviderErrors.malformed(NAME, "embedding response", e);
        }
        // a missing slot stays null and is rejected by EmbeddingService
        return Arrays.asList(ordered);
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
