package com.storicard.warehouse.pipeline;

import lombok.RequiredArgsConstructor;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;

@RequiredArgsConstructor
public class CleanupTasklet implements Tasklet {

    private final DatasetPipeline pipeline;

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        pipeline.cleanup();
        return RepeatStatus.FINISHED;
    }
}
