package com.tracemap.store;

public class StoreQueryException extends RuntimeException {

    public StoreQueryException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreQueryException(String message) {
        super(message);
    }
}
