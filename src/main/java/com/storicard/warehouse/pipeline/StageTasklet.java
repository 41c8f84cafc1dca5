package com.storicard.warehouse.pipeline;

import lombok.RequiredArgsConstructor;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;

/**
 * Extracts the dataset and writes it to the staging store.
 */
@RequiredArgsConstructor
public class StageTasklet implements Tasklet {

    private final DatasetPipeline pipeline;

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        StagedBatch staged = pipeline.stage();
        if (staged.isStaged()) {
            StagingContext.put(StagingContext.of(chunkContext), staged);
            contribution.incrementWriteCount(staged.getRowCount());
        }
        return RepeatStatus.FINISHED;
    }
}
