package com.shinmonzen.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

@Data
@ConfigurationProperties(prefix = "shinmonzen.vision")
public class VisionModelProperties {

    /**
     * Enables the vision-model fallback. Without an api key the fallback stays disabled.
     */
    private boolean enabled = true;

    private String apiKey = "";

    /**
     * Optional override, e.g. for an OpenAI-compatible gateway.
     */
    private String baseUrl = "";

    private String model = "gpt-4o";

    private int maxTokens = 8000;

    /**
     * Page images are large; the call gets a generous timeout and is never retried.
     */
    private int timeoutSeconds = 120;

    private int maxPages = 5;

    private int renderDpi = 150;

    public boolean isConfigured() {
        return enabled && apiKey != null && !apiKey.isBlank();
    }
}
