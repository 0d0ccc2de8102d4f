package com.shinmonzen.backend.services.invoices.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.slf4j.helpers.MessageFormatter;

import lombok.extern.slf4j.Slf4j;

/**
 * Append-only diagnostic trace owned by exactly one extraction session.
 *
 * Messages use SLF4J "{}" placeholders. Every entry is also logged with the session id, but the
 * list returned by {@link #entries()} is what callers get back.
 */
@Slf4j
public final class ExtractionTrace {

    private final String sessionId;
    private final List<String> entries = new ArrayList<>();

    public ExtractionTrace(String sessionId) {
        this.sessionId = sessionId;
    }

    public static ExtractionTrace newTrace() {
        return new ExtractionTrace(UUID.randomUUID().toString().substring(0, 8));
    }

    public String getSessionId() {
        return sessionId;
    }

    public synchronized void add(String message, Object... args) {
        String formatted = MessageFormatter.arrayFormat(message, args).getMessage();
        entries.add(formatted);
        log.info("[Extraction][{}] {}", sessionId, formatted);
    }

    public synchronized List<String> entries() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }
}
