package com.tennis.features.api.dto;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Summary of a replay that completed and was published.
 *
 * {@code lateMatches} counts matches that arrived dated on or before the live snapshot
 * during an incremental request; a non-zero value means the run was escalated to a full rebuild.
 */
public record ReplayReport(
        Mode mode,
        int processed,
        int dropped,
        int duplicates,
        int lateMatches,
        int ratedPlayers,
        LocalDate firstDate,
        LocalDate lastDate,
        long durationMs,
        Instant completedAt
) {

    public enum Mode { FULL, INCREMENTAL }
}
