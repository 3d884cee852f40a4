package com.network.matching.tracing;

import java.util.Map;

/**
 * Interface for distributed tracing integration.
 * The default {@link NoOpTracingService} does nothing, so the library works
 * without any tracing dependencies on the classpath.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
