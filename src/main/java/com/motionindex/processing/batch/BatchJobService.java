package com.motionindex.processing.batch;

import com.motionindex.api.search.BulkIndexResult;
import com.motionindex.api.search.SearchDocument;
import com.motionindex.api.search.SearchIndexService;
import com.motionindex.api.storage.StorageService;
import com.motionindex.observability.DatadogMetricsServiceInterface;
import com.motionindex.observability.TracingServiceInterface;
import com.motionindex.processing.classification.ClassificationException;
import com.motionindex.processing.classification.ClassificationMetadata;
import com.motionindex.processing.classification.ClassificationResult;
import com.motionindex.processing.classification.ClassificationService;
import com.motionindex.processing.extraction.ExtractionResult;
import com.motionindex.processing.extraction.TextExtractionService;
import com.motionindex.shared.exception.BatchValidationException;
import com.motionindex.shared.exception.CapacityExceededException;
import com.motionindex.shared.exception.JobNotFoundException;
import com.motionindex.shared.exception.JobNotReadyException;
import com.motionindex.shared.model.BatchDocument;
import com.motionindex.shared.model.BatchJob;
import com.motionindex.shared.model.DocumentResult;
import com.motionindex.shared.model.DocumentStatus;
import com.motionindex.shared.model.JobProgress;
import com.motionindex.shared.model.JobStatus;
import com.motionindex.shared.model.PendingDocument;
import com.motionindex.util.Deadlines;
import com.motionindex.util.Strings;
import io.opentelemetry.api.trace.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Runs batch classification jobs in the background.
 * <p>
 * Each job gets one task on the batch job executor. The task walks the documents in
 * input order, resolves text for each one (supplied, extracted from storage or synthesized
 * from the file name), classifies it and, when indexing was requested, parks it in the
 * job's pending set. After the loop the pending set is written with a single bulk index
 * call and the per-document results are reconciled with what the index reported.
 * <p>
 * Jobs live in memory only. The job table is guarded by a read/write lock and the pending
 * table by a separate lock; neither is held across an extraction, classification or index call.
 */
@Service
public class BatchJobService {

    private static final Logger logger = LoggerFactory.getLogger(BatchJobService.class);

    public static final String JOB_TYPE = "classification";
    public static final String OPTION_SKIP_AI = "skip_ai";
    public static final String OPTION_INDEX_DOCUMENT = "index_document";
    public static final String OPTION_UPDATE_INDEX = "update_index";

    static final String MDC_JOB_ID = "job_id";

    private final ClassificationService classificationService;
    private final TextExtractionService extractionService;
    private final StorageService storageService;
    private final SearchIndexService searchIndexService;
    private final BatchJobSettings settings;
    private final TaskExecutor jobExecutor;
    private final AsyncTaskExecutor callExecutor;
    private final DatadogMetricsServiceInterface metricsService;
    private final TracingServiceInterface tracingService;

    private final Map<String, BatchJob> jobs = new HashMap<>();
    private final ReentrantReadWriteLock jobsLock = new ReentrantReadWriteLock();

    private final Map<String, List<PendingDocument>> pendingByJob = new HashMap<>();
    private final ReentrantLock pendingLock = new ReentrantLock();

    public BatchJobService(
            ClassificationService classificationService,
            TextExtractionService extractionService,
            StorageService storageService,
            SearchIndexService searchIndexService,
            BatchJobSettings settings,
            @Qualifier("batchJobExecutor") TaskExecutor jobExecutor,
            @Qualifier("externalCallExecutor") AsyncTaskExecutor callExecutor,
            DatadogMetricsServiceInterface metricsService,
            TracingServiceInterface tracingService) {
        this.classificationService = classificationService;
        this.extractionService = extractionService;
        this.storageService = storageService;
        this.searchIndexService = searchIndexService;
        this.settings = settings;
        this.jobExecutor = jobExecutor;
        this.callExecutor = callExecutor;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        logger.info("BatchJobService initialized: maxDocuments={}, callTimeout={}s",
                settings.getMaxDocuments(), settings.getCallTimeout().toSeconds());
    }

    /**
     * Creates a job for the given documents and hands it to the job executor.
     *
     * @return a snapshot of the new job
     * @throws BatchValidationException   if the batch is empty
     * @throws BatchTooLargeException     if the batch exceeds the configured maximum
     * @throws CapacityExceededException  if the job executor is saturated
     */
    public BatchJob startBatch(List<BatchDocument> documents, Map<String, Object> options) {
        if (documents == null || documents.isEmpty()) {
            throw new BatchValidationException("batch must contain at least one document");
        }
        if (documents.size() > settings.getMaxDocuments()) {
            throw new BatchTooLargeException(documents.size(), settings.getMaxDocuments());
        }

        String jobId = UUID.randomUUID().toString();
        List<BatchDocument> batch = new ArrayList<>(documents);
        BatchJob job = new BatchJob(jobId, JOB_TYPE, batch.size(), options);

        jobsLock.writeLock().lock();
        try {
            jobs.put(jobId, job);
        } finally {
            jobsLock.writeLock().unlock();
        }

        try {
            jobExecutor.execute(() -> runJob(jobId, batch));
        } catch (TaskRejectedException e) {
            removeJob(jobId);
            logger.warn("Batch job executor rejected job {} ({} documents)", jobId, batch.size());
            throw new CapacityExceededException("batch job executor is saturated, retry later", 0, e);
        }
        markRunning(jobId);

        logger.info("Started batch job {} with {} documents, options={}", jobId, batch.size(), job.getOptions());
        return getJobStatus(jobId);
    }

    /**
     * @throws JobNotFoundException if no job has this ID
     */
    public BatchJob getJobStatus(String jobId) {
        jobsLock.readLock().lock();
        try {
            return requireJob(jobId).snapshot();
        } finally {
            jobsLock.readLock().unlock();
        }
    }

    /**
     * Returns the finished job with all its results. Available once the job is terminal
     * and its background task, including the bulk index write, has returned.
     *
     * @throws JobNotFoundException if no job has this ID
     * @throws JobNotReadyException if the job is still being worked on
     */
    public BatchJob getJobResults(String jobId) {
        jobsLock.readLock().lock();
        try {
            BatchJob job = requireJob(jobId);
            if (!job.getStatus().isTerminal() || !job.isFinished()) {
                throw new JobNotReadyException(jobId, job.getStatus().getValue());
            }
            return job.snapshot();
        } finally {
            jobsLock.readLock().unlock();
        }
    }

    /**
     * Cancels a queued or running job. The running task stops before its next document;
     * documents already processed keep their results. Cancelling a terminal job changes nothing.
     *
     * @throws JobNotFoundException if no job has this ID
     */
    public BatchJob cancelJob(String jobId) {
        jobsLock.writeLock().lock();
        try {
            BatchJob job = requireJob(jobId);
            if (job.getStatus().isTerminal()) {
                logger.debug("Job {} already {}, cancel ignored", jobId, job.getStatus());
                return job.snapshot();
            }
            job.setStatus(JobStatus.CANCELLED);
            job.setCompletedAt(Instant.now());
            logger.info("Job {} cancelled after {} of {} documents",
                    jobId, job.getProgress().getProcessed(), job.getProgress().getTotal());
            return job.snapshot();
        } finally {
            jobsLock.writeLock().unlock();
        }
    }

    /**
     * Snapshots of all known jobs, newest first.
     */
    public List<BatchJob> listJobs() {
        jobsLock.readLock().lock();
        try {
            return jobs.values().stream()
                    .sorted(Comparator.comparing(BatchJob::getCreatedAt).reversed())
                    .map(BatchJob::snapshot)
                    .collect(Collectors.toList());
        } finally {
            jobsLock.readLock().unlock();
        }
    }

    /**
     * Drops finished jobs that completed before the cutoff.
     *
     * @return number of jobs removed
     */
    public int removeTerminalJobsOlderThan(Instant cutoff) {
        int removed = 0;
        jobsLock.writeLock().lock();
        try {
            Iterator<BatchJob> it = jobs.values().iterator();
            while (it.hasNext()) {
                BatchJob job = it.next();
                if (job.getStatus().isTerminal() && job.isFinished()
                        && job.getCompletedAt() != null && job.getCompletedAt().isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            jobsLock.writeLock().unlock();
        }
        return removed;
    }

    void runJob(String jobId, List<BatchDocument> documents) {
        MDC.put(MDC_JOB_ID, jobId);
        long startTime = System.currentTimeMillis();
        try {
            BatchJob started = markRunning(jobId);
            if (started == null) {
                logger.info("Job {} was cancelled before it started", jobId);
                return;
            }

            boolean skipAi = started.isOptionEnabled(OPTION_SKIP_AI);
            boolean indexRequested = started.isOptionEnabled(OPTION_INDEX_DOCUMENT)
                    || started.isOptionEnabled(OPTION_UPDATE_INDEX);
            logger.info("Processing job {}: {} documents, skipAi={}, index={}",
                    jobId, documents.size(), skipAi, indexRequested);

            for (BatchDocument document : documents) {
                if (isCancelled(jobId)) {
                    logger.info("Job {} cancelled, stopping before the next document", jobId);
                    break;
                }
                String documentId = resolveDocumentId(document);
                ProcessedDocument processed;
                try {
                    processed = processDocument(document, documentId, skipAi);
                } catch (RuntimeException e) {
                    logger.error("Unexpected error processing document {} in job {}", documentId, jobId, e);
                    processed = new ProcessedDocument(DocumentResult.error(documentId, document.getDocumentPath(),
                            "unexpected error: " + e.getMessage()), null);
                }

                int position = recordResult(jobId, processed.result);
                metricsService.recordDocumentProcessed(processed.result.getStatus().getValue());
                if (indexRequested && position >= 0 && processed.result.getStatus() == DocumentStatus.SUCCESS) {
                    addPending(jobId, new PendingDocument(documentId, document, processed.text,
                            processed.result.getClassification(), position));
                }
            }

            if (indexRequested) {
                bulkIndexPending(jobId);
            }
            finalizeJob(jobId, startTime);
        } catch (RuntimeException e) {
            logger.error("Batch job {} failed unexpectedly", jobId, e);
            failJob(jobId, e.getMessage());
        } finally {
            markFinished(jobId);
            clearPending(jobId);
            MDC.remove(MDC_JOB_ID);
        }
    }

    private ProcessedDocument processDocument(BatchDocument document, String documentId, boolean skipAi) {
        String path = document.getDocumentPath();
        String text = document.getText();

        if (Strings.isBlank(text) && !Strings.isBlank(path)) {
            text = downloadAndExtract(documentId, document);
        }
        if (Strings.isBlank(text)) {
            text = FallbackText.generate(path, document.getDocumentId());
            if (!text.isEmpty()) {
                logger.debug("Using file name fallback text for document {}", documentId);
            }
        }
        if (Strings.isBlank(text)) {
            return new ProcessedDocument(
                    DocumentResult.skipped(documentId, path, "no text, document path or document ID supplied"), null);
        }

        ClassificationResult classification;
        if (skipAi) {
            classification = ClassificationResult.unclassified();
        } else {
            ClassificationMetadata metadata = new ClassificationMetadata(documentId, document.getFileName(), path);
            try {
                classification = classificationService.classify(settings.classificationText(text), metadata);
            } catch (ClassificationException e) {
                logger.warn("Classification failed for document {}: {}", documentId, e.getMessage());
                return new ProcessedDocument(DocumentResult.error(documentId, path, e.getMessage()), text);
            }
        }
        return new ProcessedDocument(DocumentResult.success(documentId, path, classification), text);
    }

    /**
     * Downloads the stored document and extracts its text under the call deadline.
     * Returns null when nothing usable came back; the caller then falls back to the file name.
     */
    private String downloadAndExtract(String documentId, BatchDocument document) {
        String path = document.getDocumentPath();
        try {
            ExtractionResult extraction = Deadlines.await(callExecutor, settings.getCallTimeout(), () -> {
                try (InputStream content = storageService.download(path)) {
                    return extractionService.extract(content, document.getFileName(), document.getContentType());
                }
            });
            if (extraction.hasText()) {
                return extraction.getText();
            }
            logger.warn("No text extracted from {} for document {}: {}", path, documentId,
                    Strings.safe(extraction.getError(), "empty document"));
        } catch (TimeoutException e) {
            logger.warn("Download and extraction of {} timed out after {}s", path, settings.getCallTimeout().toSeconds());
        } catch (ExecutionException e) {
            Exception cause = Deadlines.unwrap(e);
            logger.warn("Could not download {} for document {}: {}", path, documentId, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while extracting {}", path);
        }
        return null;
    }

    private void bulkIndexPending(String jobId) {
        List<PendingDocument> pending;
        pendingLock.lock();
        try {
            pending = pendingByJob.remove(jobId);
        } finally {
            pendingLock.unlock();
        }
        if (pending == null || pending.isEmpty()) {
            logger.debug("Job {} has no documents to index", jobId);
            return;
        }

        List<SearchDocument> batch = pending.stream()
                .map(p -> toSearchDocument(jobId, p))
                .collect(Collectors.toList());
        Duration timeout = settings.bulkIndexTimeout(batch.size());
        long startTime = System.currentTimeMillis();
        Span span = tracingService.spanBuilder("batch.bulk_index")
                .setAttribute("job_id", jobId)
                .setAttribute("document_count", batch.size())
                .startSpan();

        BulkIndexResult result = null;
        String failure = null;
        try {
            result = Deadlines.await(callExecutor, timeout, () -> searchIndexService.bulkIndex(batch));
            if (!result.isFullyAttributed()) {
                failure = "bulk index reported " + result.getFailedCount()
                        + " failures that could not be attributed to documents";
            }
        } catch (TimeoutException e) {
            failure = "bulk index timed out after " + timeout.toSeconds() + "s";
            tracingService.recordFailure(span, e);
        } catch (ExecutionException e) {
            Exception cause = Deadlines.unwrap(e);
            failure = "bulk index failed: " + cause.getMessage();
            tracingService.recordFailure(span, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = "bulk index interrupted";
            tracingService.recordFailure(span, e);
        } finally {
            span.end();
        }

        int[] counts = applyIndexOutcome(jobId, pending, result, failure);
        long durationMs = System.currentTimeMillis() - startTime;
        metricsService.recordBulkIndex(counts[0], counts[1], durationMs);
        if (failure != null) {
            logger.error("Bulk index for job {} failed for all {} documents: {}", jobId, pending.size(), failure);
        } else {
            logger.info("Bulk indexed job {}: {} indexed, {} failed ({}ms)", jobId, counts[0], counts[1], durationMs);
        }
    }

    /**
     * @return indexed and failed counts
     */
    private int[] applyIndexOutcome(String jobId, List<PendingDocument> pending, BulkIndexResult result, String failure) {
        int indexed = 0;
        int failed = 0;
        jobsLock.writeLock().lock();
        try {
            BatchJob job = jobs.get(jobId);
            if (job == null) {
                return new int[] {0, pending.size()};
            }
            JobProgress progress = job.getProgress();
            for (PendingDocument p : pending) {
                DocumentResult documentResult = job.getResultAt(p.getResultPosition());
                String documentError = failure != null ? failure : result.getFailures().get(p.getDocumentId());
                if (documentError != null) {
                    documentResult.markIndexFailed(documentError);
                    progress.recordIndexError();
                    failed++;
                } else {
                    String indexId = result.getIndexIds().get(p.getDocumentId());
                    documentResult.markIndexed(indexId != null ? indexId : p.getDocumentId());
                    progress.recordIndexed();
                    indexed++;
                }
            }
            job.touch();
        } finally {
            jobsLock.writeLock().unlock();
        }
        return new int[] {indexed, failed};
    }

    private SearchDocument toSearchDocument(String jobId, PendingDocument pending) {
        BatchDocument document = pending.getDocument();
        ClassificationResult classification = pending.getClassification();
        SearchDocument searchDocument = new SearchDocument(pending.getDocumentId(), pending.getText());
        searchDocument.setFileName(Strings.safe(document.getFileName(), pending.getDocumentId()));
        searchDocument.setDocumentPath(document.getDocumentPath());
        if (classification != null) {
            searchDocument.setDocumentType(classification.getDocumentType());
            searchDocument.setLegalCategory(classification.getLegalCategory());
            searchDocument.setConfidence(classification.getConfidence());
            searchDocument.setSummary(classification.getSummary());
            searchDocument.setTags(new ArrayList<>(classification.getTags()));
        }
        Map<String, String> metadata = new HashMap<>();
        metadata.put("batch_job_id", jobId);
        searchDocument.setMetadata(metadata);
        return searchDocument;
    }

    private void finalizeJob(String jobId, long startTime) {
        JobStatus finalStatus;
        JobProgress progress;
        jobsLock.writeLock().lock();
        try {
            BatchJob job = jobs.get(jobId);
            if (job == null) {
                return;
            }
            progress = job.getProgress();
            if (job.getStatus() != JobStatus.CANCELLED) {
                job.setStatus(terminalStatus(progress));
                job.setCompletedAt(Instant.now());
            }
            finalStatus = job.getStatus();
            progress = progress.copy();
        } finally {
            jobsLock.writeLock().unlock();
        }

        long durationMs = System.currentTimeMillis() - startTime;
        metricsService.recordJobCompleted(finalStatus.getValue(), durationMs);
        logger.info("Job {} finished with status {}: {} succeeded, {} failed, {} skipped of {} ({}ms)",
                jobId, finalStatus, progress.getSuccess(), progress.getError(), progress.getSkipped(),
                progress.getTotal(), durationMs);
    }

    static JobStatus terminalStatus(JobProgress progress) {
        if (progress.getSuccess() == progress.getTotal()) {
            return JobStatus.COMPLETED;
        }
        if (progress.getSuccess() == 0) {
            return JobStatus.FAILED;
        }
        return JobStatus.PARTIAL_SUCCESS;
    }

    private void failJob(String jobId, String error) {
        jobsLock.writeLock().lock();
        try {
            BatchJob job = jobs.get(jobId);
            if (job != null && !job.getStatus().isTerminal()) {
                job.setStatus(JobStatus.FAILED);
                job.setError(error);
                job.setCompletedAt(Instant.now());
            }
        } finally {
            jobsLock.writeLock().unlock();
        }
        metricsService.recordJobCompleted(JobStatus.FAILED.getValue(), 0);
    }

    /**
     * Moves a queued job to running; called once the executor has accepted the job and
     * again by its task. Returns a snapshot, or null when the job was cancelled (or
     * removed) before its task started.
     */
    private BatchJob markRunning(String jobId) {
        jobsLock.writeLock().lock();
        try {
            BatchJob job = jobs.get(jobId);
            if (job == null || job.getStatus().isTerminal()) {
                return null;
            }
            if (job.getStatus() == JobStatus.QUEUED) {
                job.setStatus(JobStatus.RUNNING);
            }
            return job.snapshot();
        } finally {
            jobsLock.writeLock().unlock();
        }
    }

    private boolean isCancelled(String jobId) {
        jobsLock.readLock().lock();
        try {
            BatchJob job = jobs.get(jobId);
            return job == null || job.getStatus() == JobStatus.CANCELLED;
        } finally {
            jobsLock.readLock().unlock();
        }
    }

    /**
     * Appends a document result and advances progress.
     *
     * @return the result's position in the job, or -1 if the job is gone
     */
    private int recordResult(String jobId, DocumentResult result) {
        jobsLock.writeLock().lock();
        try {
            BatchJob job = jobs.get(jobId);
            if (job == null) {
                return -1;
            }
            job.addResult(result);
            return job.getResults().size() - 1;
        } finally {
            jobsLock.writeLock().unlock();
        }
    }

    private void markFinished(String jobId) {
        jobsLock.writeLock().lock();
        try {
            BatchJob job = jobs.get(jobId);
            if (job != null) {
                job.setFinished(true);
            }
        } finally {
            jobsLock.writeLock().unlock();
        }
    }

    private void addPending(String jobId, PendingDocument document) {
        pendingLock.lock();
        try {
            pendingByJob.computeIfAbsent(jobId, id -> new ArrayList<>()).add(document);
        } finally {
            pendingLock.unlock();
        }
    }

    private void clearPending(String jobId) {
        pendingLock.lock();
        try {
            pendingByJob.remove(jobId);
        } finally {
            pendingLock.unlock();
        }
    }

    private void removeJob(String jobId) {
        jobsLock.writeLock().lock();
        try {
            jobs.remove(jobId);
        } finally {
            jobsLock.writeLock().unlock();
        }
    }

    private BatchJob requireJob(String jobId) {
        BatchJob job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    /**
     * Stable ID for a document: the supplied one, else a name-based UUID of its path so the
     * same file keeps the same index ID across batches, else a random UUID.
     */
    static String resolveDocumentId(BatchDocument document) {
        if (!Strings.isBlank(document.getDocumentId())) {
            return document.getDocumentId();
        }
        if (!Strings.isBlank(document.getDocumentPath())) {
            return UUID.nameUUIDFromBytes(document.getDocumentPath().getBytes(StandardCharsets.UTF_8)).toString();
        }
        return UUID.randomUUID().toString();
    }

    int pendingCount(String jobId) {
        pendingLock.lock();
        try {
            List<PendingDocument> pending = pendingByJob.get(jobId);
            return pending != null ? pending.size() : 0;
        } finally {
            pendingLock.unlock();
        }
    }

    private static final class ProcessedDocument {
        private final DocumentResult result;
        private final String text;

        private ProcessedDocument(DocumentResult result, String text) {
            this.result = result;
            this.text = text;
        }
    }
}
