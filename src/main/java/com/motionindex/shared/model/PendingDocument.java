package com.motionindex.shared.model;

import com.motionindex.processing.classification.ClassificationResult;

/**
 * A classified document waiting for its job's bulk index write.
 * {@code resultPosition} points at the job's DocumentResult for reconciliation.
 */
public class PendingDocument {

    private final String documentId;
    private final BatchDocument document;
    private final String text;
    private final ClassificationResult classification;
    private final int resultPosition;

    public PendingDocument(String documentId, BatchDocument document, String text,
                           ClassificationResult classification, int resultPosition) {
        this.documentId = documentId;
        this.document = document;
        this.text = text;
        this.classification = classification;
        this.resultPosition = resultPosition;
    }

    public String getDocumentId() {
        return documentId;
    }

    public BatchDocument getDocument() {
        return document;
    }

    public String getText() {
        return text;
    }

    public ClassificationResult getClassification() {
        return classification;
    }

    public int getResultPosition() {
        return resultPosition;
    }
}
