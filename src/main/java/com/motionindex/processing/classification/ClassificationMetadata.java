package com.motionindex.processing.classification;

import java.util.HashMap;
import java.util.Map;

/**
 * Context passed to classification providers alongside the document text.
 */
public class ClassificationMetadata {

    private final String documentId;
    private final String fileName;
    private final String documentPath;
    private final Map<String, String> attributes = new HashMap<>();

    public ClassificationMetadata(String documentId, String fileName, String documentPath) {
        this.documentId = documentId;
        this.fileName = fileName;
        this.documentPath = documentPath;
    }

    public ClassificationMetadata withAttributes(Map<String, String> values) {
        if (values != null) {
            attributes.putAll(values);
        }
        return this;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getFileName() {
        return fileName;
    }

    public String getDocumentPath() {
        return documentPath;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }
}
