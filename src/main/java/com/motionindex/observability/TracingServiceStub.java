package com.motionindex.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;

/**
 * Hands out no-op spans when Datadog is disabled, so callers never branch on tracing.
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "false", matchIfMissing = true)
public class TracingServiceStub implements TracingServiceInterface {

    private final Tracer tracer = TracerProvider.noop().get("com.motionindex");

    @Override
    @Nonnull
    public SpanBuilder spanBuilder(@Nonnull String spanName) {
        return tracer.spanBuilder(spanName);
    }

    @Override
    public void recordFailure(@Nonnull Span span, @Nonnull Throwable error) {
        // No-op when Datadog is disabled
    }
}
