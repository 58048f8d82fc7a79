package com.tennis.features.engine.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A validated, strongly typed match, built once when the stream is prepared.
 * p1/p2 are the canonical (min, max) ordering of the two player ids.
 */
public record Match(
        String matchId,
        LocalDate date,
        Surface surface,
        int winnerId,
        int loserId,
        int setsPlayed
) {

    public Match {
        Objects.requireNonNull(matchId, "matchId");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(surface, "surface");
        if (winnerId == loserId) {
            throw new IllegalArgumentException("Match " + matchId + " has the same winner and loser: " + winnerId);
        }
    }

    public int p1Id() {
        return Math.min(winnerId, loserId);
    }

    public int p2Id() {
        return Math.max(winnerId, loserId);
    }

    /**
     * 1 when the canonical p1 won, 0 otherwise.
     */
    public int label() {
        return p1Id() == winnerId ? 1 : 0;
    }

    /**
     * Number of sets in a score string: whitespace-delimited groups ("6-3 4-6 7-6(5)" = 3).
     */
    public static int countSets(String score) {
        if (score == null || score.isBlank()) return 0;
        return score.trim().split("\\s+").length;
    }
}
