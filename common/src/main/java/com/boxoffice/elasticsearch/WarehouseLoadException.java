package com.boxoffice.elasticsearch;

/**
 * A full-replace load did not complete. The previous data behind the alias is untouched.
 */
public class WarehouseLoadException extends RuntimeException {

    public WarehouseLoadException(String message) {
        super(message);
    }

    public WarehouseLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
