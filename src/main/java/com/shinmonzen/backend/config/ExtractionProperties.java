package com.shinmonzen.backend.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Extraction tuning loaded from application.properties with prefix "shinmonzen.extraction".
 *
 * Example:
 * shinmonzen.extraction.scanned-text-threshold=100
 * shinmonzen.extraction.container-default-grams=100
 * shinmonzen.extraction.hirayama.min-kg=4.0
 */
@Data
@ConfigurationProperties(prefix = "shinmonzen.extraction")
public class ExtractionProperties {

    /**
     * Below this many extracted characters a PDF is treated as scanned (no usable text layer).
     */
    private int scannedTextThreshold = 100;

    /**
     * Grams per container unit (can, pc, box, unknown token) when converting to weight.
     */
    private BigDecimal containerDefaultGrams = BigDecimal.valueOf(100);

    /**
     * Credit/return lines with a negative amount are dropped unless this is set.
     */
    private boolean keepNegativeAmounts = false;

    /**
     * Directory for decoded scratch copies of uploaded documents. Empty uses the JVM temp dir.
     */
    private String scratchDir = "";

    private Hirayama hirayama = new Hirayama();

    @Data
    public static class Hirayama {

        /**
         * Beef deliveries outside [minKg, maxKg] are treated as OCR digit corruption.
         */
        private BigDecimal minKg = new BigDecimal("4.0");

        private BigDecimal maxKg = new BigDecimal("10.0");

        /**
         * Used to back-compute the amount when a line only carries the weight.
         */
        private BigDecimal defaultUnitPrice = BigDecimal.valueOf(12000);
    }
}
