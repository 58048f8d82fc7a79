package com.tennis.features.engine.rating;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Current Elo value of one (player, surface) partition plus a bounded
 * history of its most recent pre-match ratings, oldest first.
 */
public class RatingEntry {

    private double rating;
    private final Deque<Double> preMatchRatings;
    private final int historySize;

    public RatingEntry(double initialRating, int historySize) {
        this.rating = initialRating;
        this.historySize = historySize;
        this.preMatchRatings = new ArrayDeque<>(historySize);
    }

    private RatingEntry(RatingEntry source) {
        this.rating = source.rating;
        this.historySize = source.historySize;
        this.preMatchRatings = new ArrayDeque<>(source.preMatchRatings);
    }

    /**
     * Record the pre-match rating and move to the post-match value.
     */
    void apply(double pointsChange) {
        preMatchRatings.addLast(rating);
        if (preMatchRatings.size() > historySize) {
            preMatchRatings.removeFirst();
        }
        rating += pointsChange;
    }

    /**
     * Rating change across the retained history; 0 before the first match.
     */
    public double getMomentum() {
        Double oldest = preMatchRatings.peekFirst();
        return oldest == null ? 0.0 : rating - oldest;
    }

    public double getRating() {
        return rating;
    }

    public int getHistoryLength() {
        return preMatchRatings.size();
    }

    RatingEntry copy() {
        return new RatingEntry(this);
    }
}
