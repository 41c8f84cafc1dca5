package com.storicard.warehouse.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storicard.warehouse.merge.WarehouseMergeService;
import com.storicard.warehouse.pipeline.TradesPipeline;
import com.storicard.warehouse.pipeline.TransactionsPipeline;
import com.storicard.warehouse.source.TradeSourceReader;
import com.storicard.warehouse.source.TransactionSourceReader;
import com.storicard.warehouse.staging.BatchSerializers;
import com.storicard.warehouse.staging.StagingStore;
import com.storicard.warehouse.transform.TradeDocumentFlattener;
import com.storicard.warehouse.transform.TransactionNormalizer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * Wires each dataset's reader, transformer and staging format into its pipeline.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TransactionSourceReader transactionSourceReader(
            @Qualifier("sourceJdbcTemplate") JdbcTemplate sourceJdbcTemplate, PipelineProperties properties) {
        PipelineProperties.Source source = properties.getSource();
        return new TransactionSourceReader(sourceJdbcTemplate, source.getTransactionsSchema(),
            source.getTransactionsTable());
    }

    @Bean
    public TradeSourceReader tradeSourceReader(MongoOperations mongoOperations, PipelineProperties properties) {
        return new TradeSourceReader(mongoOperations, properties.getSource().getTradesCollection());
    }

    @Bean
    public TransactionsPipeline transactionsPipeline(PipelineProperties properties,
                                                     TransactionSourceReader transactionSourceReader,
                                                     StagingStore stagingStore,
                                                     WarehouseMergeService warehouseMergeService,
                                                     ObjectMapper objectMapper,
                                                     Clock clock) {
        DatasetProperties dataset = properties.getDatasets().getTransactions();
        return new TransactionsPipeline(dataset, transactionSourceReader, new TransactionNormalizer(),
            stagingStore, BatchSerializers.forFormat(dataset.getFormat(), dataset.isCsvHeader(), objectMapper),
            warehouseMergeService, clock);
    }

    @Bean
    public TradesPipeline tradesPipeline(PipelineProperties properties,
                                         TradeSourceReader tradeSourceReader,
                                         StagingStore stagingStore,
                                         WarehouseMergeService warehouseMergeService,
                                         ObjectMapper objectMapper,
                                         Clock clock) {
        DatasetProperties dataset = properties.getDatasets().getTrades();
        return new TradesPipeline(dataset, tradeSourceReader, new TradeDocumentFlattener(),
            stagingStore, BatchSerializers.forFormat(dataset.getFormat(), dataset.isCsvHeader(), objectMapper),
            warehouseMergeService, clock);
    }
}
