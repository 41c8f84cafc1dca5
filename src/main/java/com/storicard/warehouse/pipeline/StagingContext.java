package com.storicard.warehouse.pipeline;

import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.item.ExecutionContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the staged batch in the job execution context so the merge step and the failure
 * listener can find it.
 */
final class StagingContext {

    static final String BUCKET = "staged.bucket";
    static final String KEY = "staged.key";
    static final String COLUMNS = "staged.columns";
    static final String ROW_COUNT = "staged.rowCount";

    private StagingContext() {
    }

    static ExecutionContext of(ChunkContext chunkContext) {
        return chunkContext.getStepContext().getStepExecution().getJobExecution().getExecutionContext();
    }

    static void put(ExecutionContext context, StagedBatch staged) {
        context.putString(BUCKET, staged.getBucket());
        context.putString(KEY, staged.getKey());
        context.put(COLUMNS, new ArrayList<>(staged.getColumns()));
        context.putInt(ROW_COUNT, staged.getRowCount());
    }

    static StagedBatch get(ExecutionContext context) {
        if (!context.containsKey(KEY)) {
            return StagedBatch.nothingStaged();
        }
        return new StagedBatch(
            context.getString(BUCKET),
            context.getString(KEY),
            columns(context.get(COLUMNS)),
            context.getInt(ROW_COUNT));
    }

    private static List<String> columns(Object stored) {
        if (!(stored instanceof List<?>)) {
            throw new IllegalStateException("Staged columns missing from the job execution context");
        }
        List<String> columns = new ArrayList<>();
        for (Object column : (List<?>) stored) {
            columns.add((String) column);
        }
        return List.copyOf(columns);
    }

    static StagedBatch get(JobExecution jobExecution) {
        return get(jobExecution.getExecutionContext());
    }
}
