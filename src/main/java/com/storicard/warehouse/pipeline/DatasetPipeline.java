package com.storicard.warehouse.pipeline;

import com.storicard.warehouse.config.DatasetProperties;
import com.storicard.warehouse.merge.MergeDirective;
import com.storicard.warehouse.merge.WarehouseMergeService;
import com.storicard.warehouse.model.Batch;
import com.storicard.warehouse.staging.BatchSerializer;
import com.storicard.warehouse.staging.StagingStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Moves one dataset from its source into the warehouse: extract and stage, merge, clean up.
 * Subclasses only know how to extract and shape their data.
 */
@Slf4j
public abstract class DatasetPipeline {

    private static final DateTimeFormatter KEY_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'").withZone(ZoneOffset.UTC);

    private final String name;
    private final DatasetProperties dataset;
    private final StagingStore stagingStore;
    private final BatchSerializer serializer;
    private final WarehouseMergeService mergeService;
    private final Clock clock;

    protected DatasetPipeline(String name,
                              DatasetProperties dataset,
                              StagingStore stagingStore,
                              BatchSerializer serializer,
                              WarehouseMergeService mergeService,
                              Clock clock) {
        this.name = name;
        this.dataset = dataset;
        this.stagingStore = stagingStore;
        this.serializer = serializer;
        this.mergeService = mergeService;
        this.clock = clock;
    }

    public String name() {
        return name;
    }

    public DatasetProperties dataset() {
        return dataset;
    }

    /**
     * Reads the source and shapes it for the warehouse.
     */
    protected abstract Batch extract();

    public StagedBatch stage() {
        Batch batch = extract();
        if (!batch.hasColumns()) {
            log.warn("Nothing extracted for {}, skipping staging", name);
            return StagedBatch.nothingStaged();
        }
        String key = dataset.getKeyPrefix() + KEY_TIMESTAMP.format(clock.instant()) + dataset.getFormat().extension();
        stagingStore.put(dataset.getBucket(), key, serializer.serialize(batch));
        log.info("Staged {} row(s) of {} at s3://{}/{}", batch.rowCount(), name, dataset.getBucket(), key);
        return new StagedBatch(dataset.getBucket(), key, batch.columns(), batch.rowCount());
    }

    public void merge(List<String> columns) {
        mergeService.merge(directive(), columns);
    }

    /**
     * Removes every staged object of this dataset, including leftovers of earlier runs.
     */
    public int cleanup() {
        int deleted = stagingStore.deleteAll(dataset.getBucket(), dataset.getKeyPrefix());
        log.info("Removed {} staged object(s) of {} from s3://{}/{}", deleted, name, dataset.getBucket(),
            dataset.getKeyPrefix());
        return deleted;
    }

    public void discard(StagedBatch staged) {
        stagingStore.delete(staged.getBucket(), staged.getKey());
        log.info("Discarded staged object s3://{}/{} of {}", staged.getBucket(), staged.getKey(), name);
    }

    public MergeDirective directive() {
        return MergeDirective.builder()
            .schema(dataset.getSchema())
            .table(dataset.getTable())
            .primaryKey(dataset.getPrimaryKey())
            .stagedDataLocator(dataset.locator())
            .loadOptions(dataset.getLoadOptions())
            .insertOnly(dataset.isInsertOnly())
            .build();
    }
}
