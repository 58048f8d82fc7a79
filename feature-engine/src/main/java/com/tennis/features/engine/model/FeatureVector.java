package com.tennis.features.engine.model;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Symmetric p1/p2 feature vector for one match.
 *
 * All differences are derived as p1 minus p2, so {@link #mirror()} negates them
 * exactly while surface-independent context (id, date, surface) stays put.
 */
public record FeatureVector(
        String matchId,
        LocalDate date,
        Surface surface,
        PlayerFeatures p1,
        PlayerFeatures p2
) {

    public FeatureVector {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(surface, "surface");
        Objects.requireNonNull(p1, "p1");
        Objects.requireNonNull(p2, "p2");
    }

    public FeatureVector mirror() {
        return new FeatureVector(matchId, date, surface, p2, p1);
    }

    // ============ DERIVED DIFFERENCES ============

    public int rankDiff() {
        return p1.rank() - p2.rank();
    }

    public double eloDiff() {
        return p1.elo() - p2.elo();
    }

    public double overallEloDiff() {
        return p1.overallElo() - p2.overallElo();
    }

    public double eloMomentumDiff() {
        return p1.eloMomentum() - p2.eloMomentum();
    }

    public int fatigueDiff7Days() {
        return p1.matchesLast7Days() - p2.matchesLast7Days();
    }

    public int fatigueDiff14Days() {
        return p1.matchesLast14Days() - p2.matchesLast14Days();
    }

    public int fatigueSetsDiff7Days() {
        return p1.setsLast7Days() - p2.setsLast7Days();
    }

    public int fatigueSetsDiff14Days() {
        return p1.setsLast14Days() - p2.setsLast14Days();
    }

    /**
     * Flatten to the column layout of the feature table consumed by model training.
     */
    public Map<String, Object> toColumns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("match_id", matchId);
        columns.put("match_date", date.toString());
        columns.put("surface", surface.getLabel());
        columns.put("p1_id", p1.playerId());
        columns.put("p2_id", p2.playerId());
        columns.put("p1_rank", p1.rank());
        columns.put("p2_rank", p2.rank());
        columns.put("rank_diff", rankDiff());
        columns.put("p1_elo", p1.elo());
        columns.put("p2_elo", p2.elo());
        columns.put("elo_diff", eloDiff());
        columns.put("p1_overall_elo", p1.overallElo());
        columns.put("p2_overall_elo", p2.overallElo());
        columns.put("overall_elo_diff", overallEloDiff());
        columns.put("p1_elo_momentum", p1.eloMomentum());
        columns.put("p2_elo_momentum", p2.eloMomentum());
        columns.put("elo_momentum_diff", eloMomentumDiff());
        columns.put("p1_win_perc", p1.winPerc());
        columns.put("p2_win_perc", p2.winPerc());
        columns.put("p1_surface_win_perc", p1.surfaceWinPerc());
        columns.put("p2_surface_win_perc", p2.surfaceWinPerc());
        columns.put("p1_form_last_10", p1.formLast10());
        columns.put("p2_form_last_10", p2.formLast10());
        columns.put("p1_rolling_win_perc_20", p1.rollingWinPerc20());
        columns.put("p2_rolling_win_perc_20", p2.rollingWinPerc20());
        columns.put("p1_rolling_win_perc_50", p1.rollingWinPerc50());
        columns.put("p2_rolling_win_perc_50", p2.rollingWinPerc50());
        columns.put("p1_avg_opponent_rank_last_10", p1.avgOpponentRankLast10());
        columns.put("p2_avg_opponent_rank_last_10", p2.avgOpponentRankLast10());
        columns.put("p1_matches_last_7_days", p1.matchesLast7Days());
        columns.put("p2_matches_last_7_days", p2.matchesLast7Days());
        columns.put("p1_matches_last_14_days", p1.matchesLast14Days());
        columns.put("p2_matches_last_14_days", p2.matchesLast14Days());
        columns.put("fatigue_diff_7_days", fatigueDiff7Days());
        columns.put("fatigue_diff_14_days", fatigueDiff14Days());
        columns.put("p1_sets_played_last_7_days", p1.setsLast7Days());
        columns.put("p2_sets_played_last_7_days", p2.setsLast7Days());
        columns.put("p1_sets_played_last_14_days", p1.setsLast14Days());
        columns.put("p2_sets_played_last_14_days", p2.setsLast14Days());
        columns.put("fatigue_sets_diff_7_days", fatigueSetsDiff7Days());
        columns.put("fatigue_sets_diff_14_days", fatigueSetsDiff14Days());
        columns.put("p1_rest_days", p1.restDays());
        columns.put("p2_rest_days", p2.restDays());
        columns.put("h2h_p1_wins", p1.h2hWins());
        columns.put("h2h_p2_wins", p2.h2hWins());
        columns.put("p1_hand", p1.hand().name());
        columns.put("p2_hand", p2.hand().name());
        columns.put("p1_height", p1.heightCm());
        columns.put("p2_height", p2.heightCm());
        return columns;
    }
}
