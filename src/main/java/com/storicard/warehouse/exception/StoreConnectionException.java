package com.storicard.warehouse.exception;

/**
 * The staging object store could not be reached or refused the request.
 */
public class StoreConnectionException extends WarehouseLoadException {

    public StoreConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
