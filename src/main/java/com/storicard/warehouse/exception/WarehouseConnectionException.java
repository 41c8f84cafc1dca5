package com.storicard.warehouse.exception;

/**
 * A warehouse connection could not be obtained or was lost in the middle of a merge.
 */
public class WarehouseConnectionException extends WarehouseLoadException {

    public WarehouseConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
