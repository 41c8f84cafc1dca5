package com.storicard.warehouse.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionException;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Runs the dataset jobs named on the command line ({@code transactions}, {@code trades}), or the
 * configured default list, one after another. A failed dataset does not stop the next one; the
 * process exit code reports whether every job completed.
 */
@Slf4j
public class PipelineRunner implements ApplicationRunner, ExitCodeGenerator {

    private final JobLauncher jobLauncher;
    private final Map<String, Job> jobsByDataset;
    private final List<String> defaultDatasets;
    private final Clock clock;

    private int exitCode;

    public PipelineRunner(JobLauncher jobLauncher,
                          Map<String, Job> jobsByDataset,
                          List<String> defaultDatasets,
                          Clock clock) {
        this.jobLauncher = jobLauncher;
        this.jobsByDataset = Map.copyOf(jobsByDataset);
        this.defaultDatasets = List.copyOf(defaultDatasets);
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> datasets = args.getNonOptionArgs().isEmpty() ? defaultDatasets : args.getNonOptionArgs();
        for (String dataset : datasets) {
            if (!jobsByDataset.containsKey(dataset)) {
                throw new IllegalArgumentException("Unknown dataset '" + dataset + "', expected one of "
                    + jobsByDataset.keySet());
            }
        }
        log.info("Loading datasets {}", datasets);
        for (String dataset : datasets) {
            launch(dataset, jobsByDataset.get(dataset));
        }
    }

    private void launch(String dataset, Job job) {
        JobParameters parameters = new JobParametersBuilder()
            .addLong("run.timestamp", clock.millis())
            .toJobParameters();
        try {
            JobExecution execution = jobLauncher.run(job, parameters);
            if (execution.getStatus() != BatchStatus.COMPLETED) {
                exitCode = 1;
                log.error("Dataset {} finished with status {}: {}", dataset, execution.getStatus(),
                    execution.getExitStatus().getExitDescription());
            } else {
                log.info("Dataset {} loaded", dataset);
            }
        } catch (JobExecutionException e) {
            exitCode = 1;
            log.error("Dataset {} could not be launched", dataset, e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
