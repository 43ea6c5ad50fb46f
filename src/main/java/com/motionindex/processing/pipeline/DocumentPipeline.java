package com.motionindex.processing.pipeline;

import com.motionindex.api.search.SearchDocument;
import com.motionindex.api.search.SearchIndexService;
import com.motionindex.api.storage.StoragePaths;
import com.motionindex.api.storage.StorageResult;
import com.motionindex.api.storage.StorageService;
import com.motionindex.observability.DatadogMetricsServiceInterface;
import com.motionindex.observability.TracingServiceInterface;
import com.motionindex.processing.classification.ClassificationMetadata;
import com.motionindex.processing.classification.ClassificationResult;
import com.motionindex.processing.classification.ClassificationService;
import com.motionindex.processing.extraction.ExtractionResult;
import com.motionindex.processing.extraction.TextExtractionService;
import com.motionindex.processing.indexing.IndexingQueueProcessor;
import com.motionindex.processing.queue.QueueFullException;
import com.motionindex.processing.queue.QueueManager;
import com.motionindex.processing.queue.WorkQueue;
import com.motionindex.util.Deadlines;
import com.motionindex.util.Strings;
import io.opentelemetry.api.trace.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Processes a single document synchronously: extract, classify, store, index.
 * <p>
 * Steps run in that fixed order, each only when enabled and when its input exists
 * (classify and index need extracted text). A failing step is recorded and later steps
 * still run, except that a storage failure ends the run. Index failures are reported on
 * the step but leave the overall result successful. One deadline covers the whole run;
 * the step that is in flight when it passes is abandoned and the run is marked timed out.
 */
@Service
public class DocumentPipeline {

    private static final Logger logger = LoggerFactory.getLogger(DocumentPipeline.class);

    private final TextExtractionService extractionService;
    private final ClassificationService classificationService;
    private final StorageService storageService;
    private final SearchIndexService searchIndexService;
    private final QueueManager queueManager;
    private final AsyncTaskExecutor callExecutor;
    private final DatadogMetricsServiceInterface metricsService;
    private final TracingServiceInterface tracingService;

    public DocumentPipeline(
            TextExtractionService extractionService,
            ClassificationService classificationService,
            StorageService storageService,
            SearchIndexService searchIndexService,
            QueueManager queueManager,
            @Qualifier("externalCallExecutor") AsyncTaskExecutor callExecutor,
            DatadogMetricsServiceInterface metricsService,
            TracingServiceInterface tracingService) {
        this.extractionService = extractionService;
        this.classificationService = classificationService;
        this.storageService = storageService;
        this.searchIndexService = searchIndexService;
        this.queueManager = queueManager;
        this.callExecutor = callExecutor;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    public PipelineResult process(PipelineRequest request) {
        String documentId = Strings.isBlank(request.getDocumentId())
                ? UUID.randomUUID().toString() : request.getDocumentId();
        PipelineOptions options = request.getOptions();
        PipelineResult result = new PipelineResult(documentId);
        long startTime = System.currentTimeMillis();
        Instant deadline = Instant.now().plusSeconds(Math.max(1, options.getTimeoutSeconds()));

        logger.info("Processing document {} ({}, {} bytes)", documentId,
                Strings.safe(request.getFileName()), request.getSize());

        byte[] content;
        try {
            content = request.getContent() != null ? request.getContent().readAllBytes() : new byte[0];
        } catch (IOException e) {
            logger.warn("Could not read content of document {}", documentId, e);
            result.fail("could not read document content: " + e.getMessage());
            result.setTotalDurationMs(System.currentTimeMillis() - startTime);
            return result;
        }

        runSteps(request, documentId, content, deadline, result);

        result.setTotalDurationMs(System.currentTimeMillis() - startTime);
        if (result.isSuccess()) {
            logger.info("Document {} processed in {}ms", documentId, result.getTotalDurationMs());
        } else {
            logger.warn("Document {} processed with errors in {}ms: {}", documentId,
                    result.getTotalDurationMs(), result.getError());
        }
        return result;
    }

    private void runSteps(PipelineRequest request, String documentId, byte[] content,
                          Instant deadline, PipelineResult result) {
        PipelineOptions options = request.getOptions();

        // Extract
        if (!options.isExtractText()) {
            record(result, StepOutcome.skipped(StepType.EXTRACT, "disabled"));
        } else {
            StepAttempt<ExtractionResult> extract = attempt(StepType.EXTRACT, documentId, deadline,
                    () -> extractionService.extract(new ByteArrayInputStream(content),
                            request.getFileName(), request.getContentType()));
            if (extract.timedOut) {
                timeOut(result, StepType.EXTRACT, extract);
                return;
            }
            if (extract.error != null || !extract.value.isSuccess()) {
                String error = extract.error != null
                        ? String.valueOf(extract.error.getMessage()) : extract.value.getError();
                record(result, StepOutcome.failed(StepType.EXTRACT, extract.durationMs, error));
                result.fail("text extraction failed: " + error);
            } else {
                ExtractionResult extraction = extract.value;
                result.setText(extraction.getText());
                result.setPageCount(extraction.getPageCount());
                result.setLanguage(extraction.getLanguage());
                record(result, StepOutcome.succeeded(StepType.EXTRACT, extract.durationMs));
            }
        }
        boolean hasText = !Strings.isBlank(result.getText());

        // Classify
        if (!options.isClassifyDocument()) {
            record(result, StepOutcome.skipped(StepType.CLASSIFY, "disabled"));
        } else if (!hasText) {
            record(result, StepOutcome.skipped(StepType.CLASSIFY, "no extracted text"));
        } else {
            ClassificationMetadata metadata = new ClassificationMetadata(documentId, request.getFileName(), null)
                    .withAttributes(request.getMetadata());
            String text = result.getText();
            StepAttempt<ClassificationResult> classify = attempt(StepType.CLASSIFY, documentId, deadline,
                    () -> classificationService.classify(text, metadata));
            if (classify.timedOut) {
                timeOut(result, StepType.CLASSIFY, classify);
                return;
            }
            if (classify.error != null) {
                record(result, StepOutcome.failed(StepType.CLASSIFY, classify.durationMs, classify.error.getMessage()));
                result.fail(classify.error.getMessage());
            } else {
                result.setClassification(classify.value);
                record(result, StepOutcome.succeeded(StepType.CLASSIFY, classify.durationMs));
            }
        }

        // Store
        if (!options.isStoreDocument()) {
            record(result, StepOutcome.skipped(StepType.STORE, "disabled"));
        } else {
            String path = StoragePaths.forDocument(documentId, request.getFileName());
            Map<String, String> storageMetadata = storageMetadata(documentId, request, result.getClassification());
            StepAttempt<StorageResult> store = attempt(StepType.STORE, documentId, deadline,
                    () -> storageService.upload(path, new ByteArrayInputStream(content),
                            request.getContentType(), storageMetadata));
            if (store.timedOut) {
                timeOut(result, StepType.STORE, store);
                return;
            }
            if (store.error != null) {
                record(result, StepOutcome.failed(StepType.STORE, store.durationMs, store.error.getMessage()));
                result.fail("storage failed: " + store.error.getMessage());
                return;
            }
            result.setStoragePath(store.value.getPath());
            result.setStorageUrl(store.value.getUrl());
            record(result, StepOutcome.succeeded(StepType.STORE, store.durationMs));
        }

        // Index
        if (!options.isIndexDocument()) {
            record(result, StepOutcome.skipped(StepType.INDEX, "disabled"));
        } else if (!hasText) {
            record(result, StepOutcome.skipped(StepType.INDEX, "no extracted text"));
        } else if (options.isDeferIndexing()) {
            enqueueForIndexing(toSearchDocument(documentId, request, result), result);
        } else {
            SearchDocument document = toSearchDocument(documentId, request, result);
            StepAttempt<String> index = attempt(StepType.INDEX, documentId, deadline,
                    () -> searchIndexService.indexDocument(document));
            if (index.timedOut) {
                timeOut(result, StepType.INDEX, index);
                return;
            }
            if (index.error != null) {
                // Recorded on the step only; the run stays successful.
                record(result, StepOutcome.failed(StepType.INDEX, index.durationMs, index.error.getMessage()));
            } else {
                result.setIndexId(index.value);
                record(result, StepOutcome.succeeded(StepType.INDEX, index.durationMs));
            }
        }
    }

    private void enqueueForIndexing(SearchDocument document, PipelineResult result) {
        long startTime = System.currentTimeMillis();
        try {
            WorkQueue<SearchDocument> queue = queueManager.getQueue(IndexingQueueProcessor.QUEUE_NAME, SearchDocument.class);
            queue.enqueue(document);
            result.setIndexQueued(true);
            record(result, StepOutcome.succeeded(StepType.INDEX, System.currentTimeMillis() - startTime));
        } catch (QueueFullException e) {
            logger.warn("Indexing queue full, document {} not queued", document.getId());
            record(result, StepOutcome.failed(StepType.INDEX, System.currentTimeMillis() - startTime, e.getMessage()));
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.warn("Indexing queue unavailable for document {}: {}", document.getId(), e.getMessage());
            record(result, StepOutcome.failed(StepType.INDEX, System.currentTimeMillis() - startTime, e.getMessage()));
        }
    }

    private <V> StepAttempt<V> attempt(StepType step, String documentId, Instant deadline, Callable<V> call) {
        StepAttempt<V> attempt = new StepAttempt<>();
        long startTime = System.currentTimeMillis();
        Span span = tracingService.spanBuilder("pipeline." + step.getValue())
                .setAttribute("document_id", documentId)
                .startSpan();
        try {
            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                throw new TimeoutException("deadline passed before step started");
            }
            attempt.value = Deadlines.await(callExecutor, remaining, call);
        } catch (TimeoutException e) {
            attempt.timedOut = true;
            attempt.error = e;
            tracingService.recordFailure(span, e);
        } catch (ExecutionException e) {
            attempt.error = Deadlines.unwrap(e);
            tracingService.recordFailure(span, attempt.error);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            attempt.error = e;
            tracingService.recordFailure(span, e);
        } finally {
            attempt.durationMs = System.currentTimeMillis() - startTime;
            span.end();
        }
        return attempt;
    }

    private void timeOut(PipelineResult result, StepType step, StepAttempt<?> attempt) {
        String error = step.getValue() + " step abandoned: processing deadline passed";
        record(result, StepOutcome.failed(step, attempt.durationMs, error));
        result.setTimedOut(true);
        result.fail("processing timed out during " + step.getValue() + " step");
        logger.warn("Document {} timed out during {} step", result.getDocumentId(), step.getValue());
    }

    private void record(PipelineResult result, StepOutcome outcome) {
        result.addStep(outcome);
        if (!outcome.isSkipped()) {
            metricsService.recordPipelineStep(outcome.getStep().getValue(), outcome.isSuccess(), outcome.getDurationMs());
        }
    }

    private static Map<String, String> storageMetadata(String documentId, PipelineRequest request,
                                                       ClassificationResult classification) {
        Map<String, String> metadata = new HashMap<>(request.getMetadata());
        metadata.put("document_id", documentId);
        metadata.put("original_filename", Strings.safe(request.getFileName(), ""));
        if (classification != null) {
            metadata.put("document_type", Strings.safe(classification.getDocumentType()));
            if (!classification.getTags().isEmpty()) {
                metadata.put("tags", String.join(",", classification.getTags()));
            }
        }
        return metadata;
    }

    private static SearchDocument toSearchDocument(String documentId, PipelineRequest request, PipelineResult result) {
        SearchDocument document = new SearchDocument(documentId, result.getText());
        document.setFileName(request.getFileName());
        document.setDocumentPath(result.getStoragePath());
        document.setStorageUrl(result.getStorageUrl());
        document.setMetadata(new HashMap<>(request.getMetadata()));
        ClassificationResult classification = result.getClassification();
        if (classification != null) {
            document.setDocumentType(classification.getDocumentType());
            document.setLegalCategory(classification.getLegalCategory());
            document.setConfidence(classification.getConfidence());
            document.setSummary(classification.getSummary());
            document.setTags(new ArrayList<>(classification.getTags()));
        }
        return document;
    }

    private static final class StepAttempt<V> {
        private V value;
        private Exception error;
        private boolean timedOut;
        private long durationMs;
    }
}
