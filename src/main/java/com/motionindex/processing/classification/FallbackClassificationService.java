package com.motionindex.processing.classification;

import com.motionindex.observability.DatadogMetricsServiceInterface;
import com.motionindex.observability.TracingServiceInterface;
import com.motionindex.util.Deadlines;
import io.opentelemetry.api.trace.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Classifies documents through an ordered chain of providers.
 * <p>
 * Providers are tried cheapest first (by default local Ollama, then Gemini, then OpenAI).
 * Every attempt runs under its own deadline. A failure is categorized with
 * {@link ErrorCategory}: retryable categories are retried on the same provider with a
 * fixed delay, fallback-eligible ones move on to the next provider, and the rest fail
 * the whole call immediately. An interrupted caller also ends the call at once, whatever
 * the category. With no provider configured the chain fails closed.
 */
@Service
public class FallbackClassificationService implements ClassificationService {

    private static final Logger logger = LoggerFactory.getLogger(FallbackClassificationService.class);

    private final List<ClassificationProvider> providers;
    private final boolean fallbackEnabled;
    private final int retryAttempts;
    private final Duration retryDelay;
    private final Duration attemptTimeout;
    private final AsyncTaskExecutor callExecutor;
    private final DatadogMetricsServiceInterface metricsService;
    private final TracingServiceInterface tracingService;

    @Autowired
    public FallbackClassificationService(
            ObjectProvider<ClassificationProvider> providers,
            @Value("${classification.provider-order:ollama,gemini,openai}") String providerOrder,
            @Value("${classification.fallback-enabled:true}") boolean fallbackEnabled,
            @Value("${classification.retry-attempts:2}") int retryAttempts,
            @Value("${classification.retry-delay-ms:1000}") long retryDelayMs,
            @Value("${classification.attempt-timeout-seconds:90}") long attemptTimeoutSeconds,
            @Qualifier("classificationExecutor") AsyncTaskExecutor callExecutor,
            DatadogMetricsServiceInterface metricsService,
            TracingServiceInterface tracingService) {
        this(orderProviders(providers.orderedStream().collect(Collectors.toList()), providerOrder),
                fallbackEnabled, retryAttempts, Duration.ofMillis(retryDelayMs),
                Duration.ofSeconds(attemptTimeoutSeconds), callExecutor, metricsService, tracingService);
    }

    public FallbackClassificationService(List<ClassificationProvider> providers,
                                         boolean fallbackEnabled,
                                         int retryAttempts,
                                         Duration retryDelay,
                                         Duration attemptTimeout,
                                         AsyncTaskExecutor callExecutor,
                                         DatadogMetricsServiceInterface metricsService,
                                         TracingServiceInterface tracingService) {
        this.providers = Collections.unmodifiableList(new ArrayList<>(providers));
        this.fallbackEnabled = fallbackEnabled;
        this.retryAttempts = Math.max(1, retryAttempts);
        this.retryDelay = retryDelay;
        this.attemptTimeout = attemptTimeout;
        this.callExecutor = callExecutor;
        this.metricsService = metricsService;
        this.tracingService = tracingService;

        if (this.providers.isEmpty()) {
            logger.warn("No classification providers configured; classification requests will fail");
        } else {
            logger.info("Classification chain initialized: providers={}, fallbackEnabled={}, retryAttempts={}, retryDelay={}ms",
                    getProviderNames(), fallbackEnabled, this.retryAttempts, retryDelay.toMillis());
        }
    }

    /**
     * Sorts providers by their position in the comma separated order list.
     * Providers missing from the list go last, by name.
     */
    static List<ClassificationProvider> orderProviders(List<ClassificationProvider> available, String providerOrder) {
        List<String> order = Arrays.stream(providerOrder == null ? new String[0] : providerOrder.split(","))
                .map(name -> name.trim().toLowerCase(Locale.ROOT))
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toList());
        List<ClassificationProvider> sorted = new ArrayList<>(available);
        sorted.sort(Comparator
                .comparingInt((ClassificationProvider p) -> {
                    int index = order.indexOf(p.getName().toLowerCase(Locale.ROOT));
                    return index < 0 ? Integer.MAX_VALUE : index;
                })
                .thenComparing(ClassificationProvider::getName));
        return sorted;
    }

    public List<String> getProviderNames() {
        return providers.stream().map(ClassificationProvider::getName).collect(Collectors.toList());
    }

    @Override
    public ClassificationResult classify(String text, ClassificationMetadata metadata) throws ClassificationException {
        if (providers.isEmpty()) {
            throw new ClassificationException(ErrorCategory.CONFIGURATION_ERROR, null,
                    "no classification provider is configured; enable one of classification.ollama.enabled, "
                            + "vertexai.enabled or classification.openai.enabled");
        }
        if (text == null || text.isBlank()) {
            throw new ClassificationException(ErrorCategory.VALIDATION_ERROR, null, "no text to classify");
        }

        ClassificationException lastError = null;
        for (int i = 0; i < providers.size(); i++) {
            ClassificationProvider provider = providers.get(i);
            try {
                return classifyWithRetries(provider, text, metadata);
            } catch (ClassificationException e) {
                lastError = e;
                ErrorCategory category = e.getCategory();
                if (Thread.currentThread().isInterrupted()) {
                    logger.warn("Classification interrupted while using provider {}, not trying further providers",
                            provider.getName());
                    throw e;
                }
                if (!category.isFallbackAllowed()) {
                    logger.warn("Provider {} failed with non-recoverable category {}, not trying further providers",
                            provider.getName(), category);
                    throw e;
                }
                if (!fallbackEnabled) {
                    throw e;
                }
                if (i + 1 < providers.size()) {
                    String next = providers.get(i + 1).getName();
                    logger.warn("Provider {} failed ({}), falling back to {}", provider.getName(), category, next);
                    metricsService.recordProviderFallback(provider.getName(), next);
                    sleep(retryDelay);
                }
            }
        }

        throw new ClassificationException(lastError.getCategory(), null,
                "all " + providers.size() + " classification providers failed, last error: " + lastError.getDetail(),
                lastError);
    }

    private ClassificationResult classifyWithRetries(ClassificationProvider provider, String text,
                                                     ClassificationMetadata metadata) throws ClassificationException {
        ClassificationException lastError = null;
        for (int attempt = 1; attempt <= retryAttempts; attempt++) {
            try {
                return attempt(provider, text, metadata, attempt);
            } catch (ClassificationException e) {
                lastError = e;
                metricsService.recordClassificationFailure(provider.getName(), e.getCategory().name());
                if (!e.getCategory().isRetryable() || attempt == retryAttempts
                        || Thread.currentThread().isInterrupted()) {
                    break;
                }
                logger.info("Provider {} attempt {}/{} failed ({}), retrying in {}ms",
                        provider.getName(), attempt, retryAttempts, e.getCategory(), retryDelay.toMillis());
                sleep(retryDelay);
            }
        }
        throw lastError;
    }

    private ClassificationResult attempt(ClassificationProvider provider, String text,
                                         ClassificationMetadata metadata, int attempt) throws ClassificationException {
        long startTime = System.currentTimeMillis();
        Span span = tracingService.spanBuilder("classification.attempt")
                .setAttribute("provider", provider.getName())
                .setAttribute("attempt", attempt)
                .setAttribute("text_length", text.length())
                .startSpan();
        try {
            ClassificationResult result = Deadlines.await(callExecutor, attemptTimeout,
                    () -> provider.classify(text, metadata));
            long durationMs = System.currentTimeMillis() - startTime;
            result.setProcessingTimeMs(durationMs);
            metricsService.recordClassificationAttempt(provider.getName(), true, durationMs);
            span.setAttribute("document_type", String.valueOf(result.getDocumentType()));
            logger.debug("Provider {} classified document {} as {} ({}ms)", provider.getName(),
                    metadata != null ? metadata.getDocumentId() : null, result.getDocumentType(), durationMs);
            return result;
        } catch (TimeoutException e) {
            ClassificationException failure = new ClassificationException(ErrorCategory.TIMEOUT, provider.getName(),
                    "no response within " + attemptTimeout.toSeconds() + "s", e);
            recordAttemptFailure(provider, span, failure, startTime);
            throw failure;
        } catch (ExecutionException e) {
            Exception cause = Deadlines.unwrap(e);
            ClassificationException failure = cause instanceof ClassificationException
                    ? (ClassificationException) cause
                    : new ClassificationException(ErrorCategory.categorize(cause), provider.getName(),
                            String.valueOf(cause.getMessage()), cause);
            recordAttemptFailure(provider, span, failure, startTime);
            throw failure;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ClassificationException failure = new ClassificationException(ErrorCategory.UNKNOWN_ERROR,
                    provider.getName(), "interrupted while waiting for provider", e);
            recordAttemptFailure(provider, span, failure, startTime);
            throw failure;
        } finally {
            span.end();
        }
    }

    private void recordAttemptFailure(ClassificationProvider provider, Span span,
                                      ClassificationException failure, long startTime) {
        metricsService.recordClassificationAttempt(provider.getName(), false, System.currentTimeMillis() - startTime);
        tracingService.recordFailure(span, failure);
        logger.warn("Provider {} attempt failed: {}", provider.getName(), failure.getMessage());
    }

    private static void sleep(Duration delay) throws ClassificationException {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClassificationException(ErrorCategory.UNKNOWN_ERROR, null, "interrupted between attempts", e);
        }
    }
}
