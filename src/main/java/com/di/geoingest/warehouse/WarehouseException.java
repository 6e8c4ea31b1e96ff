package com.di.geoingest.warehouse;

/**
 * A warehouse call failed. Fatal to a bulk load, per-chunk in streaming inserts.
 */
public class WarehouseException extends RuntimeException {

    public WarehouseException(String message) {
        super(message);
    }

    public WarehouseException(String message, Throwable cause) {
        super(message, cause);
    }
}
