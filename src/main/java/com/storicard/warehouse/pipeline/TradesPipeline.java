package com.storicard.warehouse.pipeline;

import com.storicard.warehouse.config.DatasetProperties;
import com.storicard.warehouse.merge.WarehouseMergeService;
import com.storicard.warehouse.model.Batch;
import com.storicard.warehouse.source.TradeSourceReader;
import com.storicard.warehouse.staging.BatchSerializer;
import com.storicard.warehouse.staging.StagingStore;
import com.storicard.warehouse.transform.TradeDocumentFlattener;

import java.time.Clock;

/**
 * Trades from the document store.
 */
public class TradesPipeline extends DatasetPipeline {

    public static final String NAME = "trades";

    private final TradeSourceReader reader;
    private final TradeDocumentFlattener flattener;

    public TradesPipeline(DatasetProperties dataset,
                          TradeSourceReader reader,
                          TradeDocumentFlattener flattener,
                          StagingStore stagingStore,
                          BatchSerializer serializer,
                          WarehouseMergeService mergeService,
                          Clock clock) {
        super(NAME, dataset, stagingStore, serializer, mergeService, clock);
        this.reader = reader;
        this.flattener = flattener;
    }

    @Override
    protected Batch extract() {
        return flattener.flatten(reader.read());
    }
}
