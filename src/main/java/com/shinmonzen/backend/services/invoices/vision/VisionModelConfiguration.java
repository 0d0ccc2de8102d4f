package com.shinmonzen.backend.services.invoices.vision;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.shinmonzen.backend.config.VisionModelProperties;

import lombok.extern.slf4j.Slf4j;

@Configuration
@EnableConfigurationProperties(VisionModelProperties.class)
@Slf4j
public class VisionModelConfiguration {

    @Bean
    @ConditionalOnMissingBean(VisionModelClient.class)
    public VisionModelClient visionModelClient(VisionModelProperties properties) {
        if (!properties.isEnabled()) {
            log.info("[VisionModel] Disabled (shinmonzen.vision.enabled=false)");
            return new DisabledVisionModelClient("shinmonzen.vision.enabled=false");
        }
        if (!properties.isConfigured()) {
            log.info("[VisionModel] Disabled: shinmonzen.vision.api-key is empty");
            return new DisabledVisionModelClient("no api key configured");
        }
        log.info("[VisionModel] Enabled: model='{}' maxTokens={} timeoutSeconds={} maxPages={} renderDpi={}",
                properties.getModel(),
                properties.getMaxTokens(),
                properties.getTimeoutSeconds(),
                properties.getMaxPages(),
                properties.getRenderDpi());
        return new OpenAiVisionModelClient(properties);
    }
}
