package com.tennis.features.api.exception;

public class ReplayInProgressException extends RuntimeException {

    public ReplayInProgressException() {
        super("A replay is already running");
    }
}
