package com.tracemap.exception;

public class SessionLimitExceededException extends RuntimeException {

    public SessionLimitExceededException(int maxLive) {
        super("Map session limit of " + maxLive + " reached, try again later");
    }
}
