package com.storicard.warehouse.exception;

/**
 * Staged data does not match the declared columns or load format.
 */
public class LoadFormatException extends WarehouseLoadException {

    public LoadFormatException(String message) {
        super(message);
    }

    public LoadFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
