package com.storicard.warehouse.exception;

import lombok.Getter;

/**
 * A merge transaction was rolled back. The cause is the failure of the step that aborted it.
 */
@Getter
public class MergeAbortedException extends WarehouseLoadException {

    private final String targetTable;

    public MergeAbortedException(String targetTable, Throwable cause) {
        super("Merge into " + targetTable + " aborted: " + cause.getMessage(), cause);
        this.targetTable = targetTable;
    }
}
