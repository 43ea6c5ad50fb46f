package com.motionindex.processing.classification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.motionindex.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns raw model output into a validated {@link ClassificationResult}.
 * Handles responses wrapped in markdown code fences.
 */
@Component
public class ClassificationResponseParser {

    private static final Logger logger = LoggerFactory.getLogger(ClassificationResponseParser.class);

    private final ObjectMapper objectMapper;

    public ClassificationResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ClassificationResult parse(String responseText, String provider) throws ClassificationException {
        if (Strings.isBlank(responseText)) {
            throw new ClassificationException(ErrorCategory.RESPONSE_PARSE_ERROR, provider, "empty response from model");
        }

        String cleaned = stripCodeFence(responseText);
        JsonNode root;
        try {
            root = objectMapper.readTree(cleaned);
        } catch (Exception e) {
            logger.error("Failed to parse classification response from {}: {}", provider, Strings.truncate(cleaned, 200));
            throw new ClassificationException(ErrorCategory.RESPONSE_PARSE_ERROR, provider,
                    "response is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ClassificationException(ErrorCategory.RESPONSE_PARSE_ERROR, provider, "response is not a JSON object");
        }

        String documentType = normalizeType(root.path("document_type").asText(""));
        if (documentType.isEmpty()) {
            throw new ClassificationException(ErrorCategory.VALIDATION_ERROR, provider, "document_type is missing");
        }

        ClassificationResult result = new ClassificationResult();
        result.setDocumentType(documentType);
        result.setLegalCategory(Strings.safe(root.path("legal_category").asText(null), ClassificationResult.UNCLASSIFIED_CATEGORY));
        result.setSubCategory(textOrNull(root, "sub_category"));
        result.setSubject(textOrNull(root, "subject"));
        result.setSummary(textOrNull(root, "summary"));
        result.setConfidence(clamp(root.path("confidence").asDouble(0.0)));
        result.setKeywords(stringList(root.path("keywords")));
        result.setTags(stringList(root.path("legal_tags")));
        result.setProvider(provider);
        return result;
    }

    static String stripCodeFence(String responseText) {
        String cleaned = responseText.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }

    private static String normalizeType(String raw) {
        return raw.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static double clamp(double confidence) {
        if (Double.isNaN(confidence) || confidence < 0.0) {
            return 0.0;
        }
        return Math.min(confidence, 1.0);
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(item -> {
                if (!item.isNull() && !item.asText().isBlank()) {
                    values.add(item.asText());
                }
            });
        }
        return values;
    }
}
