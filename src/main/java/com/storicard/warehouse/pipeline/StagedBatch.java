package com.storicard.warehouse.pipeline;

import lombok.Value;

import java.util.List;

/**
 * What the stage step hands to the merge step: where the batch was written and its columns.
 */
@Value
public class StagedBatch {

    String bucket;
    String key;
    List<String> columns;
    int rowCount;

    public static StagedBatch nothingStaged() {
        return new StagedBatch(null, null, List.of(), 0);
    }

    public boolean isStaged() {
        return key != null;
    }
}
