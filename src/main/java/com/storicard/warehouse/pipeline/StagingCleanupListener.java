package com.storicard.warehouse.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionListener;

/**
 * Discards the staged object of a failed job so a later run does not load it again.
 */
@Slf4j
@RequiredArgsConstructor
public class StagingCleanupListener implements JobExecutionListener {

    private final DatasetPipeline pipeline;
    private final boolean enabled;

    @Override
    public void afterJob(JobExecution jobExecution) {
        if (!enabled || jobExecution.getStatus() != BatchStatus.FAILED) {
            return;
        }
        StagedBatch staged = StagingContext.get(jobExecution);
        if (staged.isStaged()) {
            log.warn("Job {} failed, discarding its staged batch", jobExecution.getJobInstance().getJobName());
            pipeline.discard(staged);
        }
    }
}
