package com.motionindex.processing.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.motionindex.processing.classification.ClassificationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one pipeline run: per-step outcomes in execution order plus whatever each
 * step produced.
 */
public class PipelineResult {

    private final String documentId;
    private boolean success = true;
    private final List<StepOutcome> steps = new ArrayList<>();
    private String text;
    private int pageCount;
    private String language;
    private ClassificationResult classification;
    private String storageUrl;
    private String storagePath;
    private String indexId;
    private boolean indexQueued;
    private boolean timedOut;
    private String error;
    private long totalDurationMs;

    public PipelineResult(String documentId) {
        this.documentId = documentId;
    }

    void addStep(StepOutcome outcome) {
        steps.add(outcome);
    }

    /**
     * Marks the run failed. The first error is kept.
     */
    void fail(String error) {
        this.success = false;
        if (this.error == null) {
            this.error = error;
        }
    }

    public Optional<StepOutcome> findStep(StepType type) {
        return steps.stream().filter(s -> s.getStep() == type).findFirst();
    }

    public String getDocumentId() {
        return documentId;
    }

    public boolean isSuccess() {
        return success;
    }

    public List<StepOutcome> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    /**
     * Extracted text; left out of JSON responses, which carry only its length.
     */
    @JsonIgnore
    public String getText() {
        return text;
    }

    void setText(String text) {
        this.text = text;
    }

    public int getTextLength() {
        return text != null ? text.length() : 0;
    }

    public int getPageCount() {
        return pageCount;
    }

    void setPageCount(int pageCount) {
        this.pageCount = pageCount;
    }

    public String getLanguage() {
        return language;
    }

    void setLanguage(String language) {
        this.language = language;
    }

    public ClassificationResult getClassification() {
        return classification;
    }

    void setClassification(ClassificationResult classification) {
        this.classification = classification;
    }

    public String getStorageUrl() {
        return storageUrl;
    }

    void setStorageUrl(String storageUrl) {
        this.storageUrl = storageUrl;
    }

    public String getStoragePath() {
        return storagePath;
    }

    void setStoragePath(String storagePath) {
        this.storagePath = storagePath;
    }

    public String getIndexId() {
        return indexId;
    }

    void setIndexId(String indexId) {
        this.indexId = indexId;
    }

    /**
     * True when indexing was handed to the indexing queue rather than written inline.
     */
    public boolean isIndexQueued() {
        return indexQueued;
    }

    void setIndexQueued(boolean indexQueued) {
        this.indexQueued = indexQueued;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    void setTimedOut(boolean timedOut) {
        this.timedOut = timedOut;
    }

    public String getError() {
        return error;
    }

    public long getTotalDurationMs() {
        return totalDurationMs;
    }

    void setTotalDurationMs(long totalDurationMs) {
        this.totalDurationMs = totalDurationMs;
    }
}
