package com.storicard.warehouse.config;

import com.storicard.warehouse.merge.LoadMode;
import com.storicard.warehouse.merge.MergeEngine;
import com.storicard.warehouse.merge.PostgresCopyLoader;
import com.storicard.warehouse.merge.RedshiftCopyLoader;
import com.storicard.warehouse.merge.StagedDataLoader;
import com.storicard.warehouse.merge.WarehouseMergeService;
import com.storicard.warehouse.pipeline.TradesPipeline;
import com.storicard.warehouse.pipeline.TransactionsPipeline;
import com.storicard.warehouse.staging.StagingFormat;
import com.storicard.warehouse.staging.StagingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Configuration
public class MergeConfig {

    @Bean
    public StagedDataLoader stagedDataLoader(PipelineProperties properties, StagingStore stagingStore) {
        LoadMode mode = properties.getWarehouse().getLoadMode();
        log.info("Warehouse load mode: {}", mode);
        if (mode == LoadMode.POSTGRES) {
            requireCopyableFormats(properties.getDatasets());
            return new PostgresCopyLoader(stagingStore);
        }
        PipelineProperties.Aws aws = properties.getAws();
        return new RedshiftCopyLoader(aws.getIamRole(), aws.getAccessKeyId(), aws.getSecretAccessKey());
    }

    /**
     * PostgreSQL {@code COPY FROM STDIN} reads text and CSV only, so no dataset may stage JSON lines.
     */
    static void requireCopyableFormats(PipelineProperties.Datasets datasets) {
        Map<String, DatasetProperties> byName = new LinkedHashMap<>();
        byName.put(TransactionsPipeline.NAME, datasets.getTransactions());
        byName.put(TradesPipeline.NAME, datasets.getTrades());
        byName.forEach((name, dataset) -> {
            if (dataset.getFormat() != StagingFormat.CSV) {
                throw new IllegalStateException("Dataset " + name + " stages " + dataset.getFormat()
                    + ", which load mode " + LoadMode.POSTGRES + " cannot COPY; set pipeline.datasets."
                    + name + ".format to " + StagingFormat.CSV);
            }
        });
    }

    @Bean
    public MergeEngine mergeEngine(StagedDataLoader stagedDataLoader) {
        return new MergeEngine(stagedDataLoader);
    }

    @Bean
    public WarehouseMergeService warehouseMergeService(
            @Qualifier("warehouseJdbcTemplate") JdbcTemplate warehouseJdbcTemplate,
            @Qualifier("warehouseTransactionTemplate") TransactionTemplate warehouseTransactionTemplate,
            MergeEngine mergeEngine) {
        return new WarehouseMergeService(warehouseJdbcTemplate, warehouseTransactionTemplate, mergeEngine);
    }
}
