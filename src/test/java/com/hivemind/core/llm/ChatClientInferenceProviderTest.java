package com.hivemind.core.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;
import org.springframework.ai.chat.prompt.ChatOptions;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Mocks the entire {@link ChatClient} chain so no real model calls are made.
 */
class ChatClientInferenceProviderTest {

    private ChatClient mockChatClient;
    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private ChatClientInferenceProvider provider;

    @BeforeEach
    void setUp() {
        mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.options(any(ChatOptions.class))).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        provider = new ChatClientInferenceProvider(mockChatClient);
    }

    @Test
    @DisplayName("sends the prompt as the user message and returns the content")
    void sendsPrompt() {
        when(mockCallResponse.content()).thenReturn("reflection text");

        assertEquals("reflection text", provider.infer("Reflect on your recent actions", "default"));
        verify(mockRequestSpec).user("Reflect on your recent actions");
    }

    @Test
    @DisplayName("the default model does not override chat options")
    void defaultModelKeepsOptions() {
        when(mockCallResponse.content()).thenReturn("ok");

        provider.infer("p", "default");

        verify(mockRequestSpec, never()).options(any(ChatOptions.class));
    }

    @Test
    @DisplayName("a named model is passed as a chat option")
    void namedModelSetsOption() {
        when(mockCallResponse.content()).thenReturn("ok");

        provider.infer("p", "gpt-4o");

        verify(mockRequestSpec).options(argThat((ChatOptions o) -> "gpt-4o".equals(o.getModel())));
    }

    @Test
    @DisplayName("blank content is an InferenceException")
    void blankContent() {
        when(mockCallResponse.content()).thenReturn("  ");
        assertThrows(InferenceException.class, () -> provider.infer("p", "default"));
    }
}
