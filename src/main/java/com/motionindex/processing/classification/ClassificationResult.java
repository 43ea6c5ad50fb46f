package com.motionindex.processing.classification;

import java.util.ArrayList;
import java.util.List;

/**
 * Classification of one legal document as returned by a provider.
 */
public class ClassificationResult {

    public static final String UNCLASSIFIED_TYPE = "other";
    public static final String UNCLASSIFIED_CATEGORY = "unknown";

    private String documentType;
    private String legalCategory;
    private String subCategory;
    private String subject;
    private String summary;
    private double confidence;
    private List<String> keywords = new ArrayList<>();
    private List<String> tags = new ArrayList<>();
    private String provider;
    private long processingTimeMs;

    public ClassificationResult() {
    }

    public ClassificationResult(String documentType, String legalCategory, double confidence) {
        this.documentType = documentType;
        this.legalCategory = legalCategory;
        this.confidence = confidence;
    }

    /**
     * Result substituted when a batch job asks to skip AI classification.
     */
    public static ClassificationResult unclassified() {
        ClassificationResult result = new ClassificationResult(UNCLASSIFIED_TYPE, UNCLASSIFIED_CATEGORY, 0.0);
        result.setSummary("Document processed without AI classification");
        result.setProvider("none");
        return result;
    }

    public ClassificationResult copy() {
        ClassificationResult copy = new ClassificationResult(documentType, legalCategory, confidence);
        copy.subCategory = subCategory;
        copy.subject = subject;
        copy.summary = summary;
        copy.keywords = new ArrayList<>(keywords);
        copy.tags = new ArrayList<>(tags);
        copy.provider = provider;
        copy.processingTimeMs = processingTimeMs;
        return copy;
    }

    public String getDocumentType() {
        return documentType;
    }

    public void setDocumentType(String documentType) {
        this.documentType = documentType;
    }

    public String getLegalCategory() {
        return legalCategory;
    }

    public void setLegalCategory(String legalCategory) {
        this.legalCategory = legalCategory;
    }

    public String getSubCategory() {
        return subCategory;
    }

    public void setSubCategory(String subCategory) {
        this.subCategory = subCategory;
    }

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords != null ? keywords : new ArrayList<>();
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags != null ? tags : new ArrayList<>();
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public void setProcessingTimeMs(long processingTimeMs) {
        this.processingTimeMs = processingTimeMs;
    }
}
