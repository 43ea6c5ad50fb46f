package com.motionindex.processing.pipeline;

import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;

/**
 * One document submitted for synchronous processing.
 * The content stream is read once by the pipeline and not closed by it.
 */
public class PipelineRequest {

    private final String documentId;
    private final String fileName;
    private final String contentType;
    private final long size;
    private final InputStream content;
    private final PipelineOptions options;
    private final Map<String, String> metadata;

    public PipelineRequest(String documentId, String fileName, String contentType, long size,
                           InputStream content, PipelineOptions options, Map<String, String> metadata) {
        this.documentId = documentId;
        this.fileName = fileName;
        this.contentType = contentType;
        this.size = size;
        this.content = content;
        this.options = options != null ? options : PipelineOptions.defaults();
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getFileName() {
        return fileName;
    }

    public String getContentType() {
        return contentType;
    }

    public long getSize() {
        return size;
    }

    public InputStream getContent() {
        return content;
    }

    public PipelineOptions getOptions() {
        return options;
    }

    /**
     * Free-form document attributes such as case name or author.
     */
    public Map<String, String> getMetadata() {
        return metadata;
    }
}
