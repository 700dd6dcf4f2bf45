package com.hivemind.core.caps;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "hivemind.caps")
public class CapsProperties {

    private String file = "./config/system_caps.json";

    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }
}
