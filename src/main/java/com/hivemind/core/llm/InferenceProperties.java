package com.hivemind.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "hivemind.inference")
public class InferenceProperties {

    public static final String PROVIDER_OFFLINE = "offline";
    public static final String PROVIDER_CHAT_CLIENT = "chat-client";

    private String provider = PROVIDER_OFFLINE;
    private String model = "default";
    private int timeoutSeconds = 60;
    private int maxConcurrent = 8;

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public void setMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
    }

    public boolean useChatClient() {
        return PROVIDER_CHAT_CLIENT.equalsIgnoreCase(provider);
    }
}
