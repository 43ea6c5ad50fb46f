package com.motionindex.observability;

import com.motionindex.util.Strings;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;

/**
 * OpenTelemetry spans exported through whatever agent configured GlobalOpenTelemetry
 * (dd-java-agent in production). Only active when datadog.enabled=true.
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "true", matchIfMissing = false)
public class TracingService implements TracingServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(TracingService.class);
    private final Tracer tracer;

    public TracingService() {
        this.tracer = GlobalOpenTelemetry.getTracer("com.motionindex", "1.0.0");
        logger.info("TracingService initialized with OpenTelemetry tracer");
    }

    @Override
    @Nonnull
    public SpanBuilder spanBuilder(@Nonnull String spanName) {
        return tracer.spanBuilder(Strings.safe(spanName));
    }

    @Override
    public void recordFailure(@Nonnull Span span, @Nonnull Throwable error) {
        span.setStatus(StatusCode.ERROR);
        span.setAttribute("error", true);
        span.setAttribute("error.message", Strings.safe(error.getMessage()));
        span.recordException(error);
    }
}
