package com.tennis.features.engine.model;

/**
 * Match record as handed over by upstream ingestion, before validation.
 * Every field may be missing or malformed.
 */
public record RawMatch(
        String matchId,
        String date,
        String tourneyName,
        String surface,
        Integer winnerId,
        Integer loserId,
        String score
) {
}
