package com.tennis.features.api.exception;

/**
 * No replay has been published yet, so live features cannot be computed.
 */
public class SnapshotUnavailableException extends RuntimeException {

    public SnapshotUnavailableException() {
        super("No tracker snapshot available; run a replay first");
    }
}
