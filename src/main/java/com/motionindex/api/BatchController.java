package com.motionindex.api;

import com.motionindex.processing.batch.BatchJobService;
import com.motionindex.shared.dto.BatchRequest;
import com.motionindex.shared.dto.JobResultsResponse;
import com.motionindex.shared.model.BatchJob;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;

@RestController
@RequestMapping("/api/batch")
@Tag(name = "Batch", description = "Asynchronous batch classification jobs")
public class BatchController {

    private static final Logger logger = LoggerFactory.getLogger(BatchController.class);

    private final BatchJobService batchJobService;

    public BatchController(BatchJobService batchJobService) {
        this.batchJobService = batchJobService;
    }

    @PostMapping("/classify")
    @Operation(summary = "Start a batch classification job",
               description = "Accepts up to the configured maximum of documents and returns the queued job. "
                       + "Options: skip_ai, index_document (alias update_index).")
    public ResponseEntity<BatchJob> startBatch(@Valid @RequestBody BatchRequest request) {
        logger.info("Received batch request: documents={}", request.getDocuments().size());
        BatchJob job = batchJobService.startBatch(request.getDocuments(), request.getOptions());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/batch/" + job.getId() + "/status"))
                .body(job);
    }

    @GetMapping("/{jobId}/status")
    @Operation(summary = "Get job status and progress")
    public BatchJob getStatus(@Parameter(description = "Batch job ID") @PathVariable String jobId) {
        return batchJobService.getJobStatus(jobId);
    }

    @GetMapping("/{jobId}/results")
    @Operation(summary = "Get the results of a finished job",
               description = "Returns 409 while the job is still queued or running")
    public JobResultsResponse getResults(@Parameter(description = "Batch job ID") @PathVariable String jobId) {
        return JobResultsResponse.from(batchJobService.getJobResults(jobId));
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Cancel a job", description = "Stops the job before its next document; no-op for finished jobs")
    public BatchJob cancel(@Parameter(description = "Batch job ID") @PathVariable String jobId) {
        return batchJobService.cancelJob(jobId);
    }

    @GetMapping
    @Operation(summary = "List jobs, newest first")
    public List<BatchJob> listJobs() {
        return batchJobService.listJobs();
    }
}
