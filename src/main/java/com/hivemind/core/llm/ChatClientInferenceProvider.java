package com.hivemind.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;

/**
 * {@link InferenceProvider} backed by Spring AI's {@link ChatClient}.
 */
public class ChatClientInferenceProvider implements InferenceProvider {

    private static final Logger log = LoggerFactory.getLogger(ChatClientInferenceProvider.class);

    private final ChatClient chatClient;

    public ChatClientInferenceProvider(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public String infer(String prompt, String model) {
        log.debug("Sending prompt to model {} ({} chars)", model, prompt.length());
        var request = chatClient.prompt().user(prompt);
        if (model != null && !model.isBlank() && !"default".equals(model)) {
            request = request.options(ChatOptions.builder().model(model).build());
        }
        String response = request.call().content();
        if (response == null || response.isBlank()) {
            throw new InferenceException("Model returned empty content. Check that the model is running and reachable.");
        }
        return response;
    }
}
