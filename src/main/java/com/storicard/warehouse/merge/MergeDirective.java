package com.storicard.warehouse.merge;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything that determines one merge: target table, key, where the staged data lives and how
 * to read it. Carries no state between merges.
 */
@Value
@Builder(toBuilder = true)
public class MergeDirective {

    @NonNull
    String schema;

    @NonNull
    String table;

    @NonNull
    String primaryKey;

    /**
     * Location of the staged batch, e.g. {@code s3://storicard-trades/trades_}.
     */
    @NonNull
    String stagedDataLocator;

    /**
     * Appended verbatim to the bulk-load statement, e.g. {@code JSON AS 'auto'}.
     */
    @Builder.Default
    String loadOptions = "";

    /**
     * Skip the update step; only keys absent from the target are inserted.
     */
    boolean insertOnly;

    public String qualifiedTable() {
        return schema + "." + table;
    }

    public String tempTable() {
        return table + "_temp";
    }
}
