package com.storicard.warehouse.config;

import com.storicard.warehouse.merge.LoadMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for every pipeline stage, bound once at startup from {@code pipeline.*} and handed to
 * the beans that need them. Datasource connection settings live under
 * {@code pipeline.source.datasource} and {@code pipeline.warehouse.datasource}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /** Datasets run when none are named on the command line, in order. */
    @NotEmpty
    private List<String> datasetsToRun = new ArrayList<>(List.of("transactions", "trades"));

    /** Delete the staged object of a job that failed. */
    private boolean cleanupOnFailure = true;

    @Valid
    private final Aws aws = new Aws();

    @Valid
    private final Mongo mongo = new Mongo();

    @Valid
    private final Source source = new Source();

    @Valid
    private final Warehouse warehouse = new Warehouse();

    @Valid
    private final Datasets datasets = new Datasets();

    @Data
    public static class Aws {

        private String accessKeyId;

        private String secretAccessKey;

        @NotBlank
        private String region = "us-east-1";

        /** Alternative S3 endpoint, for S3-compatible stores. */
        private String endpoint;

        /** Role the warehouse assumes to read the staging bucket; replaces access keys in COPY. */
        private String iamRole;
    }

    @Data
    public static class Mongo {

        private String username;

        private String password;

        @NotBlank
        private String authenticationDatabase = "admin";
    }

    @Data
    public static class Source {

        @NotBlank
        private String transactionsSchema = "public";

        @NotBlank
        private String transactionsTable = "transactions";

        @NotBlank
        private String tradesCollection = "trades";
    }

    @Data
    public static class Warehouse {

        @NotNull
        private LoadMode loadMode = LoadMode.REDSHIFT;
    }

    @Data
    public static class Datasets {

        @Valid
        private final DatasetProperties transactions = new DatasetProperties();

        @Valid
        private final DatasetProperties trades = new DatasetProperties();
    }
}
