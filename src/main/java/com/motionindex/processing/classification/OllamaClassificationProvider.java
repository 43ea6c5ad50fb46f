package com.motionindex.processing.classification;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.HashMap;
import java.util.Map;

/**
 * Local or self-hosted model served by Ollama. First in the default provider order
 * because it has no per-call cost.
 */
@Component
@ConditionalOnProperty(name = "classification.ollama.enabled", havingValue = "true")
public class OllamaClassificationProvider implements ClassificationProvider {

    private static final Logger logger = LoggerFactory.getLogger(OllamaClassificationProvider.class);
    static final String NAME = "ollama";

    private final RestClient restClient;
    private final String model;
    private final int maxTextLength;
    private final ClassificationResponseParser responseParser;

    @Autowired
    public OllamaClassificationProvider(
            @Value("${classification.ollama.base-url:http://localhost:11434}") String baseUrl,
            @Value("${classification.ollama.model:llama3}") String model,
            @Value("${classification.ollama.timeout-seconds:120}") int timeoutSeconds,
            @Value("${classification.ollama.max-text-length:8000}") int maxTextLength,
            ClassificationResponseParser responseParser) {
        this(RestClient.builder().requestFactory(requestFactory(timeoutSeconds)),
                baseUrl, model, maxTextLength, responseParser);
    }

    OllamaClassificationProvider(RestClient.Builder builder, String baseUrl, String model,
                                 int maxTextLength, ClassificationResponseParser responseParser) {
        this.restClient = builder.baseUrl(baseUrl).build();
        this.model = model;
        this.maxTextLength = maxTextLength;
        this.responseParser = responseParser;
        logger.info("Ollama classification provider initialized: baseUrl={}, model={}", baseUrl, model);
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
        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("prompt", ClassificationPrompts.build(text, metadata, maxTextLength));
        body.put("stream", false);
        body.put("format", "json");
        body.put("options", Map.of("temperature", 0.1));

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new ClassificationException(ErrorCategory.categorize(e), NAME,
                    "Ollama request failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new ClassificationException(ErrorCategory.RESPONSE_PARSE_ERROR, NAME, "Ollama returned an empty body");
        }
        if (response.hasNonNull("error")) {
            String error = response.get("error").asText();
            throw new ClassificationException(ErrorCategory.fromMessage(error), NAME, error);
        }

        ClassificationResult result = responseParser.parse(response.path("response").asText(""), NAME);
        result.setProvider(NAME + ":" + model);
        return result;
    }
}
