package com.storicard.warehouse.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;

/**
 * Upsert-merges the batch staged by the previous step into the warehouse.
 */
@Slf4j
@RequiredArgsConstructor
public class MergeTasklet implements Tasklet {

    private final DatasetPipeline pipeline;

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        StagedBatch staged = StagingContext.get(StagingContext.of(chunkContext));
        if (!staged.isStaged()) {
            log.info("No staged batch for {}, nothing to merge", pipeline.name());
            return RepeatStatus.FINISHED;
        }
        pipeline.merge(staged.getColumns());
        return RepeatStatus.FINISHED;
    }
}
