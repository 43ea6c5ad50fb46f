package com.motionindex.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;

import javax.annotation.Nonnull;

/**
 * Span creation for pipeline steps, provider calls and bulk index writes.
 */
public interface TracingServiceInterface {
    @Nonnull SpanBuilder spanBuilder(@Nonnull String spanName);
    void recordFailure(@Nonnull Span span, @Nonnull Throwable error);
}
