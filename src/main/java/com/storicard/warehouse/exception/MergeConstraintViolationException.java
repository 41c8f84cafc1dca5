package com.storicard.warehouse.exception;

/**
 * The insert step of a merge violated a constraint of the target table, usually a duplicate key.
 */
public class MergeConstraintViolationException extends WarehouseLoadException {

    public MergeConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
