package com.tracemap.exception;

public class InvalidViewportException extends IllegalArgumentException {

    public InvalidViewportException(String message) {
        super(message);
    }
}
