package com.motionindex.processing.pipeline;

/**
 * Step toggles and limits for one pipeline run. Every step is enabled by default.
 */
public class PipelineOptions {

    public static final int DEFAULT_TIMEOUT_SECONDS = 300;

    private boolean extractText = true;
    private boolean classifyDocument = true;
    private boolean storeDocument = true;
    private boolean indexDocument = true;
    private boolean deferIndexing;
    private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

    public static PipelineOptions defaults() {
        return new PipelineOptions();
    }

    public boolean isExtractText() {
        return extractText;
    }

    public void setExtractText(boolean extractText) {
        this.extractText = extractText;
    }

    public boolean isClassifyDocument() {
        return classifyDocument;
    }

    public void setClassifyDocument(boolean classifyDocument) {
        this.classifyDocument = classifyDocument;
    }

    public boolean isStoreDocument() {
        return storeDocument;
    }

    public void setStoreDocument(boolean storeDocument) {
        this.storeDocument = storeDocument;
    }

    public boolean isIndexDocument() {
        return indexDocument;
    }

    public void setIndexDocument(boolean indexDocument) {
        this.indexDocument = indexDocument;
    }

    /**
     * When set, the index step hands the document to the indexing queue instead of writing it.
     */
    public boolean isDeferIndexing() {
        return deferIndexing;
    }

    public void setDeferIndexing(boolean deferIndexing) {
        this.deferIndexing = deferIndexing;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }
}
