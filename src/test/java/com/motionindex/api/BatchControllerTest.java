package com.motionindex.api;

import com.motionindex.processing.batch.BatchJobService;
import com.motionindex.processing.batch.BatchTooLargeException;
import com.motionindex.processing.classification.ClassificationResult;
import com.motionindex.processing.queue.QueueFullException;
import com.motionindex.shared.exception.BatchValidationException;
import com.motionindex.shared.exception.JobNotFoundException;
import com.motionindex.shared.exception.JobNotReadyException;
import com.motionindex.shared.model.BatchDocument;
import com.motionindex.shared.model.BatchJob;
import com.motionindex.shared.model.DocumentResult;
import com.motionindex.shared.model.JobStatus;
import com.motionindex.util.CorrelationIdFilter;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web slice test for the batch job endpoints and their error mapping.
 */
@WebMvcTest(BatchController.class)
class BatchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BatchJobService batchJobService;

    @Test
    void testStartBatchReturnsAccepted() throws Exception {
        // Given
        BatchJob job = new BatchJob("job-1", BatchJobService.JOB_TYPE, 2, Map.of("skip_ai", true));
        when(batchJobService.startBatch(anyList(), anyMap())).thenReturn(job);

        // When/Then
        mockMvc.perform(post("/api/batch/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"documents\":[{\"documentId\":\"a\",\"text\":\"MOTION IN LIMINE\"},"
                                + "{\"documentPath\":\"documents/b/order.pdf\"}],\"options\":{\"skip_ai\":true}}"))
                .andExpect(status().isAccepted())
                .andExpect(header().string("Location", "/api/batch/job-1/status"))
                .andExpect(header().exists(CorrelationIdFilter.REQUEST_ID_HEADER))
                .andExpect(jsonPath("$.id").value("job-1"))
                .andExpect(jsonPath("$.status").value("queued"))
                .andExpect(jsonPath("$.progress.total").value(2));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<BatchDocument>> documents = ArgumentCaptor.forClass(List.class);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> options = ArgumentCaptor.forClass(Map.class);
        verify(batchJobService).startBatch(documents.capture(), options.capture());
        assertThat(documents.getValue()).hasSize(2);
        assertThat(documents.getValue().get(0).getDocumentId()).isEqualTo("a");
        assertThat(documents.getValue().get(1).getDocumentPath()).isEqualTo("documents/b/order.pdf");
        assertThat(options.getValue()).containsEntry("skip_ai", true);
    }

    @Test
    void testMissingDocumentsIsValidationError() throws Exception {
        mockMvc.perform(post("/api/batch/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"options\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("ValidationError"))
                .andExpect(jsonPath("$.errors.documents").value("documents is required"));

        verifyNoInteractions(batchJobService);
    }

    @Test
    void testEmptyBatchIsRejected() throws Exception {
        when(batchJobService.startBatch(anyList(), any()))
                .thenThrow(new BatchValidationException("batch must contain at least one document"));

        mockMvc.perform(post("/api/batch/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"documents\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("batch must contain at least one document"));
    }

    @Test
    void testOversizedBatchIsPayloadTooLarge() throws Exception {
        when(batchJobService.startBatch(anyList(), any())).thenThrow(new BatchTooLargeException(1001, 1000));

        mockMvc.perform(post("/api/batch/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"documents\":[{\"text\":\"x\"}]}"))
                .andExpect(status().isPayloadTooLarge())
                .andExpect(jsonPath("$.error").value("BatchTooLarge"))
                .andExpect(jsonPath("$.limit").value(1000));
    }

    @Test
    void testSaturatedExecutorIsTooManyRequests() throws Exception {
        when(batchJobService.startBatch(anyList(), any())).thenThrow(new QueueFullException("batch", 50));

        mockMvc.perform(post("/api/batch/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"documents\":[{\"text\":\"x\"}]}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.queue").value("batch"));
    }

    @Test
    void testUnknownJobIsNotFound() throws Exception {
        when(batchJobService.getJobStatus("missing")).thenThrow(new JobNotFoundException("missing"));

        mockMvc.perform(get("/api/batch/missing/status").header(CorrelationIdFilter.REQUEST_ID_HEADER, "req-42"))
                .andExpect(status().isNotFound())
                .andExpect(header().string(CorrelationIdFilter.REQUEST_ID_HEADER, "req-42"))
                .andExpect(jsonPath("$.error").value("JobNotFound"))
                .andExpect(jsonPath("$.traceId").value("req-42"));
    }

    @Test
    void testResultsOfRunningJobConflict() throws Exception {
        when(batchJobService.getJobResults("job-2")).thenThrow(new JobNotReadyException("job-2", "running"));

        mockMvc.perform(get("/api/batch/job-2/results"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("running"));
    }

    @Test
    void testResultsOfFinishedJob() throws Exception {
        BatchJob job = new BatchJob("job-3", BatchJobService.JOB_TYPE, 2, null);
        job.addResult(DocumentResult.success("a", null, new ClassificationResult("order", "criminal", 0.8)));
        job.addResult(DocumentResult.error("b", "documents/b/brief.pdf", "text extraction failed"));
        job.setStatus(JobStatus.PARTIAL_SUCCESS);
        job.setCompletedAt(Instant.now());
        job.setFinished(true);
        when(batchJobService.getJobResults("job-3")).thenReturn(job.snapshot());

        mockMvc.perform(get("/api/batch/job-3/results"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobId").value("job-3"))
                .andExpect(jsonPath("$.status").value("partial_success"))
                .andExpect(jsonPath("$.successCount").value(1))
                .andExpect(jsonPath("$.errorCount").value(1))
                .andExpect(jsonPath("$.results", hasSize(2)))
                .andExpect(jsonPath("$.results[1].error").value("text extraction failed"));
    }

    @Test
    void testCancelAndList() throws Exception {
        BatchJob cancelled = new BatchJob("job-4", BatchJobService.JOB_TYPE, 1, null);
        cancelled.setStatus(JobStatus.CANCELLED);
        when(batchJobService.cancelJob("job-4")).thenReturn(cancelled);
        when(batchJobService.listJobs()).thenReturn(Arrays.asList(cancelled, new BatchJob("job-5", "classification", 3, null)));

        mockMvc.perform(delete("/api/batch/job-4"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("cancelled"));
        mockMvc.perform(get("/api/batch"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].id").value("job-4"));
    }

    @Test
    void testEmptyJobList() throws Exception {
        when(batchJobService.listJobs()).thenReturn(Collections.emptyList());

        mockMvc.perform(get("/api/batch"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }
}
