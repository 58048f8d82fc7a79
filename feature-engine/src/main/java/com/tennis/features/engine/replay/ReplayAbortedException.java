package com.tennis.features.engine.replay;

/**
 * A replay stopped part way through. No rows or state from the failed pass are published.
 */
public class ReplayAbortedException extends RuntimeException {

    private final String matchId;
    private final long processedBeforeFailure;

    public ReplayAbortedException(String message, String matchId, long processedBeforeFailure) {
        super(message);
        this.matchId = matchId;
        this.processedBeforeFailure = processedBeforeFailure;
    }

    public ReplayAbortedException(String message, String matchId, long processedBeforeFailure, Throwable cause) {
        super(message, cause);
        this.matchId = matchId;
        this.processedBeforeFailure = processedBeforeFailure;
    }

    public String getMatchId() { return matchId; }
    public long getProcessedBeforeFailure() { return processedBeforeFailure; }
}
