package com.motionindex.processing.classification;

/**
 * One AI model that can classify legal documents. Implementations throw
 * {@link ClassificationException} with a category so the fallback chain can decide
 * whether to retry, fall back or fail.
 */
public interface ClassificationProvider {

    /**
     * Short stable name used in configuration ordering, logs and metrics.
     */
    String getName();

    ClassificationResult classify(String text, ClassificationMetadata metadata) throws ClassificationException;
}
