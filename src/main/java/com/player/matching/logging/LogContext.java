package com.player.matching.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries for a matching run, a single record or a file import.
 *
 * <p>Closing the context restores every key it touched to its previous value, so contexts
 * can nest:</p>
 * <pre>
 * try (LogContext run = LogContext.forMatchRun(runId)) {
 *     try (LogContext record = LogContext.forRecord(correlationId, externalId)) {
 *         log.debug("match.found tier={}", tier);
 *     }
 *     log.info("match.completed summary={}", summary);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forMatchRun(String runId) {
        return new LogContext()
                .with("runId", runId)
                .with("operation", "match-all");
    }

    /**
     * Context for one event record. Leaves {@code operation} untouched so the run's value
     * stays visible.
     */
    public static LogContext forRecord(String correlationId, String externalId) {
        return new LogContext()
                .with("correlationId", correlationId)
                .with("externalId", externalId);
    }

    public static LogContext forImport(String source) {
        return new LogContext()
                .with("source", source)
                .with("operation", "import");
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
