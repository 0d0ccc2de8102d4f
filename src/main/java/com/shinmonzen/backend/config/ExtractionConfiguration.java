package com.shinmonzen.backend.config;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.shinmonzen.backend.services.invoices.detection.VendorCatalog;

import lombok.extern.slf4j.Slf4j;

@Configuration
@EnableConfigurationProperties(ExtractionProperties.class)
@Slf4j
public class ExtractionConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public VendorCatalog vendorCatalog() {
        VendorCatalog catalog = VendorCatalog.defaults();
        log.info("[Extraction] Vendor catalog loaded: {} vendors", catalog.getPatterns().size());
        return catalog;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
