package com.motionindex.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One document submitted in a batch. Any of the fields may be missing; text wins
 * over the stored document at {@code documentPath}.
 */
public class BatchDocument {

    private String documentId;
    private String documentPath;
    private String text;
    private String contentType;

    public BatchDocument() {
    }

    public BatchDocument(String documentId, String documentPath, String text) {
        this.documentId = documentId;
        this.documentPath = documentPath;
        this.text = text;
    }

    public String getDocumentId() {
        return documentId;
    }

    public void setDocumentId(String documentId) {
        this.documentId = documentId;
    }

    public String getDocumentPath() {
        return documentPath;
    }

    public void setDocumentPath(String documentPath) {
        this.documentPath = documentPath;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    /**
     * Last segment of the document path, or null without a path.
     */
    @JsonIgnore
    public String getFileName() {
        if (documentPath == null || documentPath.isBlank()) {
            return null;
        }
        String normalized = documentPath.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }
}
