package com.motionindex.processing.classification;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Categories of classification provider failures.
 * <p>
 * {@code retryable} categories are retried on the same provider before falling back;
 * categories that are neither retryable nor fallback-eligible fail the whole call.
 */
public enum ErrorCategory {
    QUOTA_EXCEEDED(false, true),
    INSUFFICIENT_QUOTA(false, true),
    RATE_LIMIT(true, true),
    API_AUTH_ERROR(false, false),
    API_BAD_REQUEST(false, false),
    API_SERVER_ERROR(true, true),
    TIMEOUT(true, true),
    NETWORK_ERROR(true, true),
    RESPONSE_PARSE_ERROR(false, true),
    VALIDATION_ERROR(false, false),
    CONFIGURATION_ERROR(false, false),
    UNKNOWN_ERROR(false, true);

    private final boolean retryable;
    private final boolean fallbackAllowed;

    ErrorCategory(boolean retryable, boolean fallbackAllowed) {
        this.retryable = retryable;
        this.fallbackAllowed = fallbackAllowed;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isFallbackAllowed() {
        return fallbackAllowed;
    }

    /**
     * Categorizes a provider failure, first by exception type along the cause chain,
     * then by well-known fragments of the error message.
     */
    public static ErrorCategory categorize(Throwable error) {
        if (error == null) {
            return UNKNOWN_ERROR;
        }
        if (error instanceof ClassificationException) {
            ErrorCategory category = ((ClassificationException) error).getCategory();
            if (category != null) {
                return category;
            }
        }

        for (Throwable current = error; current != null; current = current.getCause()) {
            ErrorCategory byType = fromType(current);
            if (byType != null) {
                return byType;
            }
        }

        return fromMessage(error.getMessage());
    }

    private static ErrorCategory fromType(Throwable error) {
        if (error instanceof TimeoutException
                || error instanceof SocketTimeoutException
                || error instanceof HttpTimeoutException) {
            return TIMEOUT;
        }
        if (error instanceof ConnectException || error instanceof UnknownHostException) {
            return NETWORK_ERROR;
        }
        if (error instanceof RestClientResponseException) {
            RestClientResponseException responseError = (RestClientResponseException) error;
            ErrorCategory byBody = fromMessage(responseError.getResponseBodyAsString());
            if (byBody == INSUFFICIENT_QUOTA || byBody == QUOTA_EXCEEDED) {
                return byBody;
            }
            return fromStatus(responseError.getStatusCode().value());
        }
        if (error instanceof ResourceAccessException && !(error.getCause() instanceof SocketTimeoutException)) {
            return NETWORK_ERROR;
        }
        if (error instanceof JsonProcessingException) {
            return RESPONSE_PARSE_ERROR;
        }
        return null;
    }

    static ErrorCategory fromStatus(int status) {
        if (status == 429) {
            return RATE_LIMIT;
        }
        if (status == 401 || status == 403) {
            return API_AUTH_ERROR;
        }
        if (status == 402) {
            return QUOTA_EXCEEDED;
        }
        if (status == 408) {
            return TIMEOUT;
        }
        if (status >= 500) {
            return API_SERVER_ERROR;
        }
        if (status >= 400) {
            return API_BAD_REQUEST;
        }
        return UNKNOWN_ERROR;
    }

    static ErrorCategory fromMessage(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN_ERROR;
        }
        String msg = message.toLowerCase(Locale.ROOT);

        if (msg.contains("insufficient_quota") || msg.contains("insufficient quota")) {
            return INSUFFICIENT_QUOTA;
        }
        if (msg.contains("quota") || msg.contains("billing")) {
            return QUOTA_EXCEEDED;
        }
        if (msg.contains("rate limit") || msg.contains("status 429") || msg.contains("too many requests")
                || msg.contains("resource exhausted") || msg.contains("resource_exhausted")) {
            return RATE_LIMIT;
        }
        if (msg.contains("status 401") || msg.contains("unauthorized") || msg.contains("unauthenticated")
                || msg.contains("invalid api key") || msg.contains("permission denied")) {
            return API_AUTH_ERROR;
        }
        if (msg.contains("status 400") || msg.contains("bad request") || msg.contains("invalid argument")) {
            return API_BAD_REQUEST;
        }
        if (msg.contains("status 5") || msg.contains("server error") || msg.contains("service unavailable")) {
            return API_SERVER_ERROR;
        }
        if (msg.contains("timeout") || msg.contains("timed out") || msg.contains("deadline exceeded")) {
            return TIMEOUT;
        }
        if (msg.contains("connection") || msg.contains("network")) {
            return NETWORK_ERROR;
        }
        if (msg.contains("json") || msg.contains("unmarshal") || msg.contains("parse")) {
            return RESPONSE_PARSE_ERROR;
        }
        if (msg.contains("validation")) {
            return VALIDATION_ERROR;
        }
        return UNKNOWN_ERROR;
    }
}
