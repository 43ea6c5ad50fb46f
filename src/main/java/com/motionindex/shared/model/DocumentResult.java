package com.motionindex.shared.model;

import com.motionindex.processing.classification.ClassificationResult;

import java.time.Instant;

/**
 * Outcome of one document inside a batch job.
 * A document is never both indexed and carrying an index error.
 */
public class DocumentResult {

    private final String documentId;
    private final String documentPath;
    private DocumentStatus status;
    private ClassificationResult classification;
    private String error;
    private boolean indexed;
    private String indexError;
    private String indexId;
    private Instant processedAt;

    public DocumentResult(String documentId, String documentPath) {
        this.documentId = documentId;
        this.documentPath = documentPath;
    }

    public static DocumentResult success(String documentId, String documentPath, ClassificationResult classification) {
        DocumentResult result = new DocumentResult(documentId, documentPath);
        result.status = DocumentStatus.SUCCESS;
        result.classification = classification;
        result.processedAt = Instant.now();
        return result;
    }

    public static DocumentResult error(String documentId, String documentPath, String error) {
        DocumentResult result = new DocumentResult(documentId, documentPath);
        result.status = DocumentStatus.ERROR;
        result.error = error;
        result.processedAt = Instant.now();
        return result;
    }

    public static DocumentResult skipped(String documentId, String documentPath, String reason) {
        DocumentResult result = new DocumentResult(documentId, documentPath);
        result.status = DocumentStatus.SKIPPED;
        result.error = reason;
        result.processedAt = Instant.now();
        return result;
    }

    public void markIndexed(String indexId) {
        this.indexed = true;
        this.indexId = indexId;
        this.indexError = null;
    }

    public void markIndexFailed(String indexError) {
        this.indexed = false;
        this.indexId = null;
        this.indexError = indexError;
    }

    public DocumentResult copy() {
        DocumentResult copy = new DocumentResult(documentId, documentPath);
        copy.status = status;
        copy.classification = classification != null ? classification.copy() : null;
        copy.error = error;
        copy.indexed = indexed;
        copy.indexError = indexError;
        copy.indexId = indexId;
        copy.processedAt = processedAt;
        return copy;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getDocumentPath() {
        return documentPath;
    }

    public DocumentStatus getStatus() {
        return status;
    }

    public ClassificationResult getClassification() {
        return classification;
    }

    public String getError() {
        return error;
    }

    public boolean isIndexed() {
        return indexed;
    }

    public String getIndexError() {
        return indexError;
    }

    public String getIndexId() {
        return indexId;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }
}
