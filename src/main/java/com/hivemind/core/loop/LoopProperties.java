package com.hivemind.core.loop;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "hivemind.loop")
public class LoopProperties {

    /** Recent memories fed into a loop prompt when the request names no limit. */
    private int defaultMemoryLimit = 5;

    public int getDefaultMemoryLimit() {
        return defaultMemoryLimit;
    }

    public void setDefaultMemoryLimit(int defaultMemoryLimit) {
        this.defaultMemoryLimit = defaultMemoryLimit;
    }
}
