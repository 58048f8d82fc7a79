package com.tennis.features.engine.model;

/**
 * One side of a feature vector, as seen strictly before the match.
 */
public record PlayerFeatures(
        int playerId,
        int rank,
        double elo,
        double overallElo,
        double eloMomentum,
        double winPerc,
        double surfaceWinPerc,
        double formLast10,
        double rollingWinPerc20,
        double rollingWinPerc50,
        double avgOpponentRankLast10,
        int matchesLast7Days,
        int matchesLast14Days,
        int setsLast7Days,
        int setsLast14Days,
        int restDays,
        int h2hWins,
        Handedness hand,
        Integer heightCm
) {
}
