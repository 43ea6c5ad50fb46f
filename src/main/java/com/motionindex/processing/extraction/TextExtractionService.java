package com.motionindex.processing.extraction;

import java.io.InputStream;

/**
 * Extracts plain text from document content.
 * Failures are reported through {@link ExtractionResult#isSuccess()} rather than thrown,
 * so callers can treat them as per-document errors.
 */
public interface TextExtractionService {

    /**
     * @param content     document bytes; read fully but not closed
     * @param fileName    original filename, used to detect the format when the content type is vague
     * @param contentType MIME type, may be null
     */
    ExtractionResult extract(InputStream content, String fileName, String contentType);
}
