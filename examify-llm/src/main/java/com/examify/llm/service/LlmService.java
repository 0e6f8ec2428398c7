package com.examify.llm.service;

import com.examify.common.exception.ConfigurationException;
import com.examify.llm.config.LlmProperties;
import com.examify.llm.prompt.TaskType;
import com.examify.llm.provider.LlmProvider;
import com.examify.llm.provider.ProviderClient;
import com.examify.llm.provider.ProviderClient.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Single entry point for text generation. The vendor is resolved once, here, from
 * {@code examify.llm.provider}; callers only pass a {@link TaskType} and a prompt.
 */
@Service
@Slf4j
public class LlmService {

    private final ProviderClient client;
    private final ProviderRetry retry;

    public LlmService(List<ProviderClient> clients, LlmProperties properties) {
        String wanted = LlmProvider.canonicalName(properties.getProvider());
        this.client = clients.stream()
            .filter(c -> c.getProviderName().equals(wanted))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException(
                "No generation provider named '" + properties.getProvider() + "', available: "
                    + clients.stream().map(ProviderClient::getProviderName).collect(Collectors.joining(", "))));

        if (client.requiresApiKey() && (properties.getApiKey() == null || properties.getApiKey().isBlank())) {
            throw new ConfigurationException("examify.llm.api-key is required for provider " + wanted);
        }
        this.retry = new ProviderRetry(properties);

        log.info("[LLM] Generation provider selected | provider={} | model={} | maxAttempts={}",
            client.getProviderName(), client.getModel(), retry.getMaxAttempts());
    }

    /**
     * Runs one generation call, retrying transient failures.
     *
     * @throws ProviderException non-retryable, either immediately or after retries ran out
     */
    public String generate(TaskType taskType, String prompt) {
        long startTime = System.currentTimeMillis();
        String result = retry.execute(taskType.getTag(),
            () -> client.generateContent(taskType.getSystemInstruction(), prompt));
        log.debug("[LLM] Generation done | task={} | provider={} | promptLength={} | responseLength={} | durationMs={}",
            taskType.getTag(), client.getProviderName(), prompt.length(), result.length(),
            System.currentTimeMillis() - startTime);
        return result;
    }

    public String getProviderName() {
        return client.getProviderName();
    }

    public String getModel() {
        return client.getModel();
    }
}
