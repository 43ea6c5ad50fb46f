package com.motionindex.processing.classification;

import com.fasterxml.jackson.databind.JsonNode;
import com.motionindex.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hosted fallback using the OpenAI chat completions API (or any compatible endpoint).
 */
@Component
@ConditionalOnProperty(name = "classification.openai.enabled", havingValue = "true")
public class OpenAiClassificationProvider implements ClassificationProvider {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiClassificationProvider.class);
    static final String NAME = "openai";
    private static final String SYSTEM_PROMPT =
            "You classify legal documents and always answer with one JSON object.";

    private final RestClient restClient;
    private final String apiKey;
    private final String model;
    private final int maxTextLength;
    private final ClassificationResponseParser responseParser;

    @Autowired
    public OpenAiClassificationProvider(
            @Value("${classification.openai.base-url:https://api.openai.com}") String baseUrl,
            @Value("${classification.openai.api-key:${OPENAI_API_KEY:}}") String apiKey,
            @Value("${classification.openai.model:gpt-4o-mini}") String model,
            @Value("${classification.openai.timeout-seconds:60}") int timeoutSeconds,
            @Value("${classification.openai.max-text-length:12000}") int maxTextLength,
            ClassificationResponseParser responseParser) {
        this(RestClient.builder().requestFactory(requestFactory(timeoutSeconds)),
                baseUrl, apiKey, model, maxTextLength, responseParser);
    }

    OpenAiClassificationProvider(RestClient.Builder builder, String baseUrl, String apiKey, String model,
                                 int maxTextLength, ClassificationResponseParser responseParser) {
        this.restClient = builder.baseUrl(baseUrl).build();
        this.apiKey = apiKey;
        this.model = model;
        this.maxTextLength = maxTextLength;
        this.responseParser = responseParser;
        if (Strings.isBlank(apiKey)) {
            logger.warn("OpenAI provider enabled without an API key; calls will fail with a configuration error");
        }
        logger.info("OpenAI classification provider initialized: baseUrl={}, model={}", baseUrl, model);
    }

    private static SimpleClientHttpRequestFactory requestFactory(int timeoutSeconds) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(5_000);
        factory.setReadTimeout(timeoutSeconds * 1000);
        return factory;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ClassificationResult classify(String text, ClassificationMetadata metadata) throws ClassificationException {
        if (Strings.isBlank(apiKey)) {
            throw new ClassificationException(ErrorCategory.CONFIGURATION_ERROR, NAME,
                    "classification.openai.api-key is not set");
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("temperature", 0.1);
        body.put("response_format", Map.of("type", "json_object"));
        body.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", ClassificationPrompts.build(text, metadata, maxTextLength))));

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/v1/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new ClassificationException(ErrorCategory.categorize(e), NAME,
                    "OpenAI request failed: " + e.getMessage(), e);
        }

        JsonNode content = response == null ? null : response.path("choices").path(0).path("message").path("content");
        if (content == null || content.isMissingNode() || content.isNull()) {
            throw new ClassificationException(ErrorCategory.RESPONSE_PARSE_ERROR, NAME, "no completion content in response");
        }

        ClassificationResult result = responseParser.parse(content.asText(), NAME);
        result.setProvider(NAME + ":" + model);
        return result;
    }
}
