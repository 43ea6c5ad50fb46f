package com.motionindex.api;

import com.motionindex.processing.pipeline.DocumentPipeline;
import com.motionindex.processing.pipeline.PipelineOptions;
import com.motionindex.processing.pipeline.PipelineRequest;
import com.motionindex.processing.pipeline.PipelineResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/documents")
@Tag(name = "Documents", description = "Synchronous single-document processing")
public class DocumentController {

    private static final Logger logger = LoggerFactory.getLogger(DocumentController.class);

    private final DocumentPipeline documentPipeline;

    public DocumentController(DocumentPipeline documentPipeline) {
        this.documentPipeline = documentPipeline;
    }

    @PostMapping(value = "/process", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Process one document",
               description = "Runs extraction, classification, storage and indexing and returns the per-step outcome")
    public PipelineResult process(
            @Parameter(description = "Document file (PDF or plain text)")
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "documentId", required = false) String documentId,
            @RequestParam(value = "extractText", defaultValue = "true") boolean extractText,
            @RequestParam(value = "classify", defaultValue = "true") boolean classify,
            @RequestParam(value = "store", defaultValue = "true") boolean store,
            @RequestParam(value = "index", defaultValue = "true") boolean index,
            @RequestParam(value = "deferIndexing", defaultValue = "false") boolean deferIndexing,
            @RequestParam(value = "timeoutSeconds", defaultValue = "300") int timeoutSeconds,
            @RequestParam(value = "caseName", required = false) String caseName,
            @RequestParam(value = "author", required = false) String author) throws IOException {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("File is empty");
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive");
        }

        logger.info("Received process request: filename={}, size={}, contentType={}",
                file.getOriginalFilename(), file.getSize(), file.getContentType());

        PipelineOptions options = new PipelineOptions();
        options.setExtractText(extractText);
        options.setClassifyDocument(classify);
        options.setStoreDocument(store);
        options.setIndexDocument(index);
        options.setDeferIndexing(deferIndexing);
        options.setTimeoutSeconds(timeoutSeconds);

        Map<String, String> metadata = new HashMap<>();
        if (caseName != null && !caseName.isBlank()) {
            metadata.put("case_name", caseName);
        }
        if (author != null && !author.isBlank()) {
            metadata.put("author", author);
        }

        try (InputStream content = file.getInputStream()) {
            PipelineRequest request = new PipelineRequest(documentId, file.getOriginalFilename(),
                    file.getContentType(), file.getSize(), content, options, metadata);
            return documentPipeline.process(request);
        }
    }
}
