package com.examify.llm.service;

import com.examify.common.exception.ConfigurationException;
import com.examify.llm.config.LlmProperties;
import com.examify.llm.prompt.TaskType;
import com.examify.llm.provider.ProviderClient;
import com.examify.llm.provider.ProviderClient.ProviderException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LlmServiceTest {

    @Test
    void selectsProviderByConfiguredNameIncludingAlias() {
        ProviderClient gemini = client("gemini");
        ProviderClient openai = client("openai");
        when(gemini.generateContent(anyString(), anyString())).thenReturn("from gemini");

        LlmService service = new LlmService(List.of(openai, gemini), properties("google"));

        assertEquals("gemini", service.getProviderName());
        assertEquals("from gemini", service.generate(TaskType.SUMMARIZE, "text"));
        verify(openai, never()).generateContent(anyString(), anyString());
    }

    @Test
    void passesTaskSystemInstruction() {
        ProviderClient gemini = client("gemini");
        when(gemini.generateContent(anyString(), anyString())).thenReturn("ok");

        new LlmService(List.of(gemini), properties("gemini")).generate(TaskType.GRADE_ANSWER, "prompt");

        verify(gemini).generateContent(eq(TaskType.GRADE_ANSWER.getSystemInstruction()), eq("prompt"));
    }

    @Test
    void retriesTransientThenSucceeds() {
        ProviderClient gemini = client("gemini");
        when(gemini.generateContent(anyString(), anyString()))
            .thenThrow(new ProviderException("busy", "gemini", 503, true))
            .thenReturn("answer");

        String result = new LlmService(List.of(gemini), properties("gemini"))
            .generate(TaskType.ANSWER_WITH_CONTEXT, "q");

        assertEquals("answer", result);
        verify(gemini, times(2)).generateContent(anyString(), anyString());
    }

    @Test
    void permanentErrorIsNotRetried() {
        ProviderClient gemini = client("gemini");
        when(gemini.generateContent(anyString(), anyString()))
            .thenThrow(new ProviderException("bad key", "gemini", 401, false));

        LlmService service = new LlmService(List.of(gemini), properties("gemini"));

        ProviderException e = assertThrows(ProviderException.class,
            () -> service.generate(TaskType.ANSWER_WITH_CONTEXT, "q"));
        assertTrue(e.isAuthError());
        verify(gemini, times(1)).generateContent(anyString(), anyString());
    }

    @Test
    void missingApiKeyFailsAtConstruction() {
        ProviderClient gemini = client("gemini");
        when(gemini.requiresApiKey()).thenReturn(true);
        LlmProperties properties = properties("gemini");
        properties.setApiKey(" ");

        assertThrows(ConfigurationException.class, () -> new LlmService(List.of(gemini), properties));
    }

    private static ProviderClient client(String name) {
        ProviderClient client = mock(ProviderClient.class);
        when(client.getProviderName()).thenReturn(name);
        when(client.getModel()).thenReturn(name + "-model");
        return client;
    }

    private static LlmProperties properties(String provider) {
        LlmProperties properties = new LlmProperties();
        properties.setProvider(provider);
        properties.setApiKey("test-key");
        properties.setInitialBackoffMs(1);
        properties.setMaxBackoffMs(1);
        return properties;
    }
}
