package com.motionindex.shared.dto;

import com.motionindex.shared.model.BatchDocument;
import jakarta.validation.constraints.NotNull;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * DTO for starting a batch classification job.
 */
public class BatchRequest {

    @NotNull(message = "documents is required")
    private List<BatchDocument> documents;

    private Map<String, Object> options = new HashMap<>();

    public BatchRequest() {
    }

    public BatchRequest(List<BatchDocument> documents, Map<String, Object> options) {
        this.documents = documents;
        this.options = options;
    }

    public List<BatchDocument> getDocuments() {
        return documents;
    }

    public void setDocuments(List<BatchDocument> documents) {
        this.documents = documents;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    public void setOptions(Map<String, Object> options) {
        this.options = options;
    }
}
