package com.storicard.warehouse.exception;

/**
 * Base type for every failure raised while moving a dataset into the warehouse.
 * All subclasses are unchecked and propagate to the caller that owns the transaction.
 */
public class WarehouseLoadException extends RuntimeException {

    public WarehouseLoadException(String message) {
        super(message);
    }

    public WarehouseLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
