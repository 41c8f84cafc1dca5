package com.storicard.warehouse.pipeline;

import com.storicard.warehouse.config.DatasetProperties;
import com.storicard.warehouse.merge.WarehouseMergeService;
import com.storicard.warehouse.model.Batch;
import com.storicard.warehouse.source.TransactionSourceReader;
import com.storicard.warehouse.staging.BatchSerializer;
import com.storicard.warehouse.staging.StagingStore;
import com.storicard.warehouse.transform.TransactionNormalizer;

import java.time.Clock;

/**
 * Card transactions from the relational source database.
 */
public class TransactionsPipeline extends DatasetPipeline {

    public static final String NAME = "transactions";

    private final TransactionSourceReader reader;
    private final TransactionNormalizer normalizer;

    public TransactionsPipeline(DatasetProperties dataset,
                                TransactionSourceReader reader,
                                TransactionNormalizer normalizer,
                                StagingStore stagingStore,
                                BatchSerializer serializer,
                                WarehouseMergeService mergeService,
                                Clock clock) {
        super(NAME, dataset, stagingStore, serializer, mergeService, clock);
        this.reader = reader;
        this.normalizer = normalizer;
    }

    @Override
    protected Batch extract() {
        return normalizer.normalize(reader.read());
    }
}
