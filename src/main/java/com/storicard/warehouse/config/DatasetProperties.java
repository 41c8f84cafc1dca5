package com.storicard.warehouse.config;

import com.storicard.warehouse.staging.StagingFormat;
import com.storicard.warehouse.staging.StagingLocator;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Where one dataset is staged and which warehouse table it is merged into.
 */
@Data
public class DatasetProperties {

    /** Staging bucket, e.g. {@code storicard-trades}. */
    @NotBlank
    private String bucket;

    /**
     * Prefix of this dataset's staged object keys. The warehouse loads, and cleanup deletes,
     * every object under it.
     */
    @NotNull
    private String keyPrefix = "";

    @NotNull
    private StagingFormat format = StagingFormat.CSV;

    /** Write a header row when staging CSV. */
    private boolean csvHeader = true;

    @NotBlank
    private String schema = "public";

    @NotBlank
    private String table;

    @NotBlank
    private String primaryKey;

    /** Appended verbatim to the bulk-load statement. */
    @NotNull
    private String loadOptions = "";

    private boolean insertOnly;

    public String locator() {
        return StagingLocator.of(bucket, keyPrefix).toString();
    }
}
