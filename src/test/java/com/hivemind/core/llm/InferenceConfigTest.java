package com.hivemind.core.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class InferenceConfigTest {

    private final InferenceConfig config = new InferenceConfig();

    @SuppressWarnings("unchecked")
    private static ObjectProvider<ChatClient.Builder> builderProvider(ChatClient.Builder builder) {
        ObjectProvider<ChatClient.Builder> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(builder);
        return provider;
    }

    @Test
    @DisplayName("offline is the default provider")
    void offlineByDefault() {
        var provider = config.inferenceProvider(new InferenceProperties(), builderProvider(mock(ChatClient.Builder.class)));
        assertInstanceOf(OfflineInferenceProvider.class, provider);
    }

    @Test
    @DisplayName("chat-client uses Spring AI when a builder is available")
    void chatClient() {
        var properties = new InferenceProperties();
        properties.setProvider("chat-client");
        ChatClient.Builder builder = mock(ChatClient.Builder.class);
        when(builder.build()).thenReturn(mock(ChatClient.class));

        assertInstanceOf(ChatClientInferenceProvider.class, config.inferenceProvider(properties, builderProvider(builder)));
    }

    @Test
    @DisplayName("chat-client without a model falls back to offline")
    void chatClientUnavailable() {
        var properties = new InferenceProperties();
        properties.setProvider("chat-client");

        assertInstanceOf(OfflineInferenceProvider.class, config.inferenceProvider(properties, builderProvider(null)));
    }
}
