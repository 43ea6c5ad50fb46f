package com.motionindex.processing.classification;

/**
 * Classification capability used by the pipeline and the batch engine.
 */
public interface ClassificationService {

    ClassificationResult classify(String text, ClassificationMetadata metadata) throws ClassificationException;
}
