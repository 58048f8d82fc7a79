package com.tennis.features.engine.rating;

import com.tennis.features.engine.config.EngineConfig;
import com.tennis.features.engine.model.Surface;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-player, per-surface Elo ratings with the logistic update rule.
 *
 * Surfaces never contribute to each other. A surface-blind overall rating is
 * kept alongside, updated by the same rule on every match. Reads return a
 * default without creating an entry.
 */
public class EloRatingTracker {

    private final double kFactor;
    private final double ratingDiffFactor;
    private final double initialRating;
    private final int momentumWindow;

    private final Map<RatingKey, RatingEntry> surfaceRatings;
    private final Map<Integer, RatingEntry> overallRatings;

    public EloRatingTracker(EngineConfig config) {
        this.kFactor = config.getKFactor();
        this.ratingDiffFactor = config.getRatingDiffFactor();
        this.initialRating = config.getInitialRating();
        this.momentumWindow = config.getMomentumWindow();
        this.surfaceRatings = new HashMap<>();
        this.overallRatings = new HashMap<>();
    }

    private EloRatingTracker(EloRatingTracker source) {
        this.kFactor = source.kFactor;
        this.ratingDiffFactor = source.ratingDiffFactor;
        this.initialRating = source.initialRating;
        this.momentumWindow = source.momentumWindow;
        this.surfaceRatings = new HashMap<>(source.surfaceRatings.size());
        source.surfaceRatings.forEach((key, entry) -> surfaceRatings.put(key, entry.copy()));
        this.overallRatings = new HashMap<>(source.overallRatings.size());
        source.overallRatings.forEach((key, entry) -> overallRatings.put(key, entry.copy()));
    }

    // ============ QUERIES ============

    public double rating(int playerId, Surface surface) {
        RatingEntry entry = surfaceRatings.get(new RatingKey(playerId, surface));
        return entry != null ? entry.getRating() : initialRating;
    }

    public double overallRating(int playerId) {
        RatingEntry entry = overallRatings.get(playerId);
        return entry != null ? entry.getRating() : initialRating;
    }

    /**
     * Rating change over the player's last few matches on this surface.
     */
    public double momentum(int playerId, Surface surface) {
        RatingEntry entry = surfaceRatings.get(new RatingKey(playerId, surface));
        return entry != null ? entry.getMomentum() : 0.0;
    }

    /**
     * Probability that a player rated {@code rating} beats one rated {@code opponentRating}.
     */
    public double expectedScore(double rating, double opponentRating) {
        return 1.0 / (1.0 + Math.pow(10.0, (opponentRating - rating) / ratingDiffFactor));
    }

    public int playerCount() {
        return overallRatings.size();
    }

    // ============ UPDATES ============

    public void update(int winnerId, int loserId, Surface surface) {
        RatingEntry winner = surfaceRatings.computeIfAbsent(
                new RatingKey(winnerId, surface), key -> newEntry());
        RatingEntry loser = surfaceRatings.computeIfAbsent(
                new RatingKey(loserId, surface), key -> newEntry());
        exchange(winner, loser);

        exchange(overallRatings.computeIfAbsent(winnerId, key -> newEntry()),
                overallRatings.computeIfAbsent(loserId, key -> newEntry()));
    }

    private void exchange(RatingEntry winner, RatingEntry loser) {
        double expected = expectedScore(winner.getRating(), loser.getRating());
        double points = kFactor * (1.0 - expected);
        winner.apply(points);
        loser.apply(-points);
    }

    private RatingEntry newEntry() {
        return new RatingEntry(initialRating, momentumWindow);
    }

    public EloRatingTracker copy() {
        return new EloRatingTracker(this);
    }

    private record RatingKey(int playerId, Surface surface) {}
}
