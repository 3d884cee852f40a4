package com.network.matching.tracing;

/**
 * A unit of work in a distributed trace.
 * Implements {@link AutoCloseable} so the span ends when a try-with-resources block exits.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("match.find")) {
 *     span.setAttribute("requesterId", requesterId);
 *     // ... do work ...
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    /**
     * Records a point-in-time event, such as a degraded input.
     */
    void addEvent(String name);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
