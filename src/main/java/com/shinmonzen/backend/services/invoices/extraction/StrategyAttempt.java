package com.shinmonzen.backend.services.invoices.extraction;

/**
 * One step of the escalation chain and how it ended.
 */
public record StrategyAttempt(String strategy, boolean succeeded, int recordCount, String detail) {

    public static StrategyAttempt success(String strategy, int recordCount, String detail) {
        return new StrategyAttempt(strategy, true, recordCount, detail);
    }

    public static StrategyAttempt failure(String strategy, String detail) {
        return new StrategyAttempt(strategy, false, 0, detail);
    }
}
