package com.motionindex.processing.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Scheduled removal of finished batch jobs from memory.
 * Only loads when batch.retention.enabled=true; otherwise jobs are kept for the process lifetime.
 */
@Service
@ConditionalOnProperty(name = "batch.retention.enabled", havingValue = "true")
public class JobRetentionTask {

    private static final Logger logger = LoggerFactory.getLogger(JobRetentionTask.class);

    private final BatchJobService batchJobService;
    private final long maxAgeMinutes;

    public JobRetentionTask(
            BatchJobService batchJobService,
            @Value("${batch.retention.max-age-minutes:1440}") long maxAgeMinutes) {
        this.batchJobService = batchJobService;
        this.maxAgeMinutes = maxAgeMinutes;
        logger.info("JobRetentionTask initialized: maxAgeMinutes={}", maxAgeMinutes);
    }

    @Scheduled(fixedDelayString = "${batch.retention.interval-ms:600000}")
    public void removeExpiredJobs() {
        Instant cutoff = Instant.now().minus(maxAgeMinutes, ChronoUnit.MINUTES);
        int removed = batchJobService.removeTerminalJobsOlderThan(cutoff);
        if (removed > 0) {
            logger.info("Removed {} finished batch jobs completed before {}", removed, cutoff);
        } else {
            logger.debug("No finished batch jobs older than {} minutes", maxAgeMinutes);
        }
    }
}
