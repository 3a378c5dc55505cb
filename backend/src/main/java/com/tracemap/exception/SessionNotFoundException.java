package com.tracemap.exception;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("Map session not found or expired: " + sessionId);
    }
}
