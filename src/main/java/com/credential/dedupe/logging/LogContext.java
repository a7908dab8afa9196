package com.credential.dedupe.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forImport(runId, "bitwarden")) {
 *     log.info("import.completed rows={}", rows.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for importing rows of one provider.
     */
    public static LogContext forImport(String runId, String providerId) {
        return forOperation(runId, "import").with("providerId", providerId);
    }

    /**
     * Context for exporting records to one provider.
     */
    public static LogContext forExport(String runId, String providerId) {
        return forOperation(runId, "export").with("providerId", providerId);
    }

    /**
     * Context for a provider-independent step (detect, group, decide).
     */
    public static LogContext forOperation(String runId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", operation);
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
