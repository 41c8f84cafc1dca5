package com.storicard.warehouse.config;

import com.storicard.warehouse.pipeline.CleanupTasklet;
import com.storicard.warehouse.pipeline.DatasetPipeline;
import com.storicard.warehouse.pipeline.MergeTasklet;
import com.storicard.warehouse.pipeline.PipelineRunner;
import com.storicard.warehouse.pipeline.StageTasklet;
import com.storicard.warehouse.pipeline.StagingCleanupListener;
import com.storicard.warehouse.pipeline.TradesPipeline;
import com.storicard.warehouse.pipeline.TransactionsPipeline;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.EnableBatchProcessing;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One job per dataset: stage, merge, clean up. Job metadata goes to the primary datasource.
 */
@Configuration
@EnableBatchProcessing
public class BatchJobConfig {

    @Bean
    public Job transactionsJob(JobRepository jobRepository,
                               @Qualifier("transactionManager") PlatformTransactionManager transactionManager,
                               TransactionsPipeline transactionsPipeline,
                               PipelineProperties properties) {
        return datasetJob(transactionsPipeline, jobRepository, transactionManager, properties.isCleanupOnFailure());
    }

    @Bean
    public Job tradesJob(JobRepository jobRepository,
                         @Qualifier("transactionManager") PlatformTransactionManager transactionManager,
                         TradesPipeline tradesPipeline,
                         PipelineProperties properties) {
        return datasetJob(tradesPipeline, jobRepository, transactionManager, properties.isCleanupOnFailure());
    }

    @Bean
    @ConditionalOnProperty(prefix = "pipeline.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
    public PipelineRunner pipelineRunner(JobLauncher jobLauncher,
                                         @Qualifier("transactionsJob") Job transactionsJob,
                                         @Qualifier("tradesJob") Job tradesJob,
                                         PipelineProperties properties,
                                         Clock clock) {
        Map<String, Job> jobs = new LinkedHashMap<>();
        jobs.put(TransactionsPipeline.NAME, transactionsJob);
        jobs.put(TradesPipeline.NAME, tradesJob);
        return new PipelineRunner(jobLauncher, jobs, properties.getDatasetsToRun(), clock);
    }

    static Job datasetJob(DatasetPipeline pipeline,
                          JobRepository jobRepository,
                          PlatformTransactionManager transactionManager,
                          boolean cleanupOnFailure) {
        String name = pipeline.name();
        return new JobBuilder(name + "Job", jobRepository)
            .listener(new StagingCleanupListener(pipeline, cleanupOnFailure))
            .start(step(name + "StageStep", new StageTasklet(pipeline), jobRepository, transactionManager))
            .next(step(name + "MergeStep", new MergeTasklet(pipeline), jobRepository, transactionManager))
            .next(step(name + "CleanupStep", new CleanupTasklet(pipeline), jobRepository, transactionManager))
            .build();
    }

    private static Step step(String name, Tasklet tasklet, JobRepository jobRepository,
                             PlatformTransactionManager transactionManager) {
        return new StepBuilder(name, jobRepository)
            .tasklet(tasklet, transactionManager)
            .build();
    }
}
