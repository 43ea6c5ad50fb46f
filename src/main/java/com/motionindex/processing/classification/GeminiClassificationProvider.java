package com.motionindex.processing.classification;

import com.google.genai.Client;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.HttpOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Hosted fallback calling Gemini on Vertex AI through the Google Gen AI SDK.
 * Authenticates with Application Default Credentials.
 */
@Component
@ConditionalOnProperty(name = "vertexai.enabled", havingValue = "true")
public class GeminiClassificationProvider implements ClassificationProvider {

    private static final Logger logger = LoggerFactory.getLogger(GeminiClassificationProvider.class);
    static final String NAME = "gemini";
    private static final String DEFAULT_MODEL = "gemini-2.0-flash";

    private final String model;
    private final int maxTextLength;
    private final ClassificationResponseParser responseParser;
    private final Client client;

    public GeminiClassificationProvider(
            @Value("${vertexai.project-id:${GOOGLE_CLOUD_PROJECT:}}") String projectId,
            @Value("${vertexai.location:us-central1}") String location,
            @Value("${vertexai.model:gemini-2.0-flash}") String model,
            @Value("${vertexai.max-text-length:12000}") int maxTextLength,
            ClassificationResponseParser responseParser) {
        this.model = model != null && !model.isEmpty() ? model : DEFAULT_MODEL;
        this.maxTextLength = maxTextLength;
        this.responseParser = responseParser;
        this.client = initializeClient(projectId, location);
        logger.info("Gemini classification provider initialized: projectId={}, location={}, model={}",
                projectId, location, this.model);
    }

    private static Client initializeClient(String projectId, String location) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalStateException("vertexai.enabled=true requires vertexai.project-id or GOOGLE_CLOUD_PROJECT");
        }
        try {
            return Client.builder()
                    .project(projectId)
                    .location(location)
                    .vertexAI(true)
                    .httpOptions(HttpOptions.builder().apiVersion("v1").build())
                    .build();
        } catch (Exception e) {
            logger.error("Failed to initialize Google Gen AI SDK client: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to initialize Google Gen AI SDK client", e);
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ClassificationResult classify(String text, ClassificationMetadata metadata) throws ClassificationException {
        String prompt = ClassificationPrompts.build(text, metadata, maxTextLength);
        logger.debug("Calling Gemini: model={}, promptLength={}", model, prompt.length());

        String responseText;
        try {
            GenerateContentResponse response = client.models.generateContent(model, prompt, null);
            responseText = response.text();
        } catch (Exception e) {
            throw new ClassificationException(ErrorCategory.categorize(e), NAME,
                    "Gemini API call failed: " + e.getMessage(), e);
        }

        ClassificationResult result = responseParser.parse(responseText, NAME);
        result.setProvider(NAME + ":" + model);
        return result;
    }
}
