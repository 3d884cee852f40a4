package com.network.matching.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forMatch(correlationId, requesterId)) {
 *     log.info("match.completed results={}", results.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forMatch(String correlationId, String requesterId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("requesterId", requesterId);
        ctx.put("operation", "match");
        return ctx;
    }

    public static LogContext forLoad(String correlationId, String source) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("source", source);
        ctx.put("operation", "load");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds another key-value pair to this context.
     */
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
