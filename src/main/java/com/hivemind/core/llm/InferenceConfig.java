package com.hivemind.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the {@link InferenceProvider}: Spring AI's {@link ChatClient} when
 * {@code hivemind.inference.provider=chat-client} and a model is configured,
 * otherwise the {@link OfflineInferenceProvider}.
 */
@Configuration
public class InferenceConfig {

    private static final Logger log = LoggerFactory.getLogger(InferenceConfig.class);

    @Bean
    public InferenceProvider inferenceProvider(InferenceProperties properties,
                                               ObjectProvider<ChatClient.Builder> chatClientBuilder) {
        if (properties.useChatClient()) {
            ChatClient.Builder builder = chatClientBuilder.getIfAvailable();
            if (builder != null) {
                log.info("Inference via Spring AI ChatClient (model: {})", properties.getModel());
                return new ChatClientInferenceProvider(builder.build());
            }
            log.warn("hivemind.inference.provider=chat-client but no ChatClient.Builder is available; falling back to offline inference");
        }
        log.info("Inference via offline responder");
        return new OfflineInferenceProvider();
    }
}
