package com.motionindex.processing.classification;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorCategoryTest {

    @Test
    void testRetryAndFallbackFlags() {
        assertThat(ErrorCategory.RATE_LIMIT.isRetryable()).isTrue();
        assertThat(ErrorCategory.TIMEOUT.isRetryable()).isTrue();
        assertThat(ErrorCategory.NETWORK_ERROR.isRetryable()).isTrue();
        assertThat(ErrorCategory.API_SERVER_ERROR.isRetryable()).isTrue();

        assertThat(ErrorCategory.QUOTA_EXCEEDED.isRetryable()).isFalse();
        assertThat(ErrorCategory.QUOTA_EXCEEDED.isFallbackAllowed()).isTrue();
        assertThat(ErrorCategory.RESPONSE_PARSE_ERROR.isFallbackAllowed()).isTrue();

        assertThat(ErrorCategory.API_AUTH_ERROR.isFallbackAllowed()).isFalse();
        assertThat(ErrorCategory.API_BAD_REQUEST.isFallbackAllowed()).isFalse();
        assertThat(ErrorCategory.VALIDATION_ERROR.isFallbackAllowed()).isFalse();
        assertThat(ErrorCategory.CONFIGURATION_ERROR.isFallbackAllowed()).isFalse();
    }

    @Test
    void testCategorizesByExceptionType() {
        assertThat(ErrorCategory.categorize(new TimeoutException())).isEqualTo(ErrorCategory.TIMEOUT);
        assertThat(ErrorCategory.categorize(new ResourceAccessException("I/O error", new SocketTimeoutException("Read timed out"))))
                .isEqualTo(ErrorCategory.TIMEOUT);
        assertThat(ErrorCategory.categorize(new ResourceAccessException("I/O error", new ConnectException("refused"))))
                .isEqualTo(ErrorCategory.NETWORK_ERROR);
        assertThat(ErrorCategory.categorize(new JsonParseException((JsonParser) null, "Unexpected character")))
                .isEqualTo(ErrorCategory.RESPONSE_PARSE_ERROR);
    }

    @Test
    void testCategorizesHttpStatus() {
        assertThat(ErrorCategory.categorize(HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS,
                "Too Many Requests", null, new byte[0], StandardCharsets.UTF_8))).isEqualTo(ErrorCategory.RATE_LIMIT);
        assertThat(ErrorCategory.categorize(HttpClientErrorException.create(HttpStatus.UNAUTHORIZED,
                "Unauthorized", null, new byte[0], StandardCharsets.UTF_8))).isEqualTo(ErrorCategory.API_AUTH_ERROR);
        assertThat(ErrorCategory.categorize(HttpServerErrorException.create(HttpStatus.BAD_GATEWAY,
                "Bad Gateway", null, new byte[0], StandardCharsets.UTF_8))).isEqualTo(ErrorCategory.API_SERVER_ERROR);
        assertThat(ErrorCategory.categorize(HttpClientErrorException.create(HttpStatus.UNPROCESSABLE_ENTITY,
                "Unprocessable", null, new byte[0], StandardCharsets.UTF_8))).isEqualTo(ErrorCategory.API_BAD_REQUEST);
    }

    @Test
    void testQuotaMessageInBodyWinsOverStatus() {
        byte[] body = "{\"error\":{\"code\":\"insufficient_quota\"}}".getBytes(StandardCharsets.UTF_8);

        ErrorCategory category = ErrorCategory.categorize(HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS,
                "Too Many Requests", null, body, StandardCharsets.UTF_8));

        assertThat(category).isEqualTo(ErrorCategory.INSUFFICIENT_QUOTA);
    }

    @Test
    void testExplicitCategoryWins() {
        ClassificationException error = new ClassificationException(ErrorCategory.VALIDATION_ERROR, "ollama", "timeout field missing");

        assertThat(ErrorCategory.categorize(error)).isEqualTo(ErrorCategory.VALIDATION_ERROR);
    }

    @Test
    void testCategorizesByMessage() {
        assertThat(ErrorCategory.fromMessage("You exceeded your current quota")).isEqualTo(ErrorCategory.QUOTA_EXCEEDED);
        assertThat(ErrorCategory.fromMessage("429 RESOURCE_EXHAUSTED")).isEqualTo(ErrorCategory.RATE_LIMIT);
        assertThat(ErrorCategory.fromMessage("Invalid API key provided")).isEqualTo(ErrorCategory.API_AUTH_ERROR);
        assertThat(ErrorCategory.fromMessage("context deadline exceeded")).isEqualTo(ErrorCategory.TIMEOUT);
        assertThat(ErrorCategory.fromMessage("model 'llama3' not found")).isEqualTo(ErrorCategory.UNKNOWN_ERROR);
        assertThat(ErrorCategory.fromMessage(null)).isEqualTo(ErrorCategory.UNKNOWN_ERROR);
        assertThat(ErrorCategory.categorize(null)).isEqualTo(ErrorCategory.UNKNOWN_ERROR);
    }
}
