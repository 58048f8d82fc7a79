package com.tennis.features.engine.config;

/**
 * Immutable tuning of the trackers and the feature assembler.
 * Defaults match the values the historical feature table was built with.
 */
public final class EngineConfig {

    public static final double DEFAULT_K_FACTOR = 32.0;
    public static final double DEFAULT_RATING_DIFF_FACTOR = 400.0;
    public static final double DEFAULT_INITIAL_RATING = 1500.0;
    public static final int DEFAULT_MOMENTUM_WINDOW = 5;
    public static final int DEFAULT_PLAYER_RANK = 500;
    public static final int DEFAULT_FORM_WINDOW = 10;
    public static final int DEFAULT_REST_DAYS = 30;

    private final double kFactor;
    private final double ratingDiffFactor;
    private final double initialRating;
    private final int momentumWindow;
    private final int defaultRank;
    private final int formWindow;
    private final int shortRollingWindow;
    private final int longRollingWindow;
    private final int shortFatigueDays;
    private final int longFatigueDays;
    private final int defaultRestDays;
    private final boolean sameDayIsolation;
    private final int progressLogInterval;

    private EngineConfig(Builder b) {
        if (b.kFactor <= 0) throw new IllegalArgumentException("kFactor must be positive");
        if (b.ratingDiffFactor <= 0) throw new IllegalArgumentException("ratingDiffFactor must be positive");
        if (b.momentumWindow < 1) throw new IllegalArgumentException("momentumWindow must be at least 1");
        if (b.formWindow < 1 || b.shortRollingWindow < 1 || b.longRollingWindow < 1) {
            throw new IllegalArgumentException("count windows must be at least 1");
        }
        if (b.shortFatigueDays < 0 || b.longFatigueDays < 0) {
            throw new IllegalArgumentException("fatigue windows must not be negative");
        }
        if (b.progressLogInterval < 1) throw new IllegalArgumentException("progressLogInterval must be at least 1");
        this.kFactor = b.kFactor;
        this.ratingDiffFactor = b.ratingDiffFactor;
        this.initialRating = b.initialRating;
        this.momentumWindow = b.momentumWindow;
        this.defaultRank = b.defaultRank;
        this.formWindow = b.formWindow;
        this.shortRollingWindow = b.shortRollingWindow;
        this.longRollingWindow = b.longRollingWindow;
        this.shortFatigueDays = b.shortFatigueDays;
        this.longFatigueDays = b.longFatigueDays;
        this.defaultRestDays = b.defaultRestDays;
        this.sameDayIsolation = b.sameDayIsolation;
        this.progressLogInterval = b.progressLogInterval;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Longest count-based window any query needs from the outcome history.
     */
    public int maxCountWindow() {
        return Math.max(formWindow, Math.max(shortRollingWindow, longRollingWindow));
    }

    /**
     * Longest day-based window any query needs from the outcome history.
     */
    public int maxDayWindow() {
        return Math.max(shortFatigueDays, longFatigueDays);
    }

    // ============ BUILDER PATTERN ============

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double kFactor = DEFAULT_K_FACTOR;
        private double ratingDiffFactor = DEFAULT_RATING_DIFF_FACTOR;
        private double initialRating = DEFAULT_INITIAL_RATING;
        private int momentumWindow = DEFAULT_MOMENTUM_WINDOW;
        private int defaultRank = DEFAULT_PLAYER_RANK;
        private int formWindow = DEFAULT_FORM_WINDOW;
        private int shortRollingWindow = 20;
        private int longRollingWindow = 50;
        private int shortFatigueDays = 7;
        private int longFatigueDays = 14;
        private int defaultRestDays = DEFAULT_REST_DAYS;
        private boolean sameDayIsolation = true;
        private int progressLogInterval = 10_000;

        public Builder kFactor(double kFactor) { this.kFactor = kFactor; return this; }
        public Builder ratingDiffFactor(double factor) { this.ratingDiffFactor = factor; return this; }
        public Builder initialRating(double rating) { this.initialRating = rating; return this; }
        public Builder momentumWindow(int window) { this.momentumWindow = window; return this; }
        public Builder defaultRank(int rank) { this.defaultRank = rank; return this; }
        public Builder formWindow(int window) { this.formWindow = window; return this; }
        public Builder shortRollingWindow(int window) { this.shortRollingWindow = window; return this; }
        public Builder longRollingWindow(int window) { this.longRollingWindow = window; return this; }
        public Builder shortFatigueDays(int days) { this.shortFatigueDays = days; return this; }
        public Builder longFatigueDays(int days) { this.longFatigueDays = days; return this; }
        public Builder defaultRestDays(int days) { this.defaultRestDays = days; return this; }
        public Builder sameDayIsolation(boolean isolate) { this.sameDayIsolation = isolate; return this; }
        public Builder progressLogInterval(int interval) { this.progressLogInterval = interval; return this; }

        public EngineConfig build() { return new EngineConfig(this); }
    }

    // ============ GETTERS ============

    public double getKFactor() { return kFactor; }
    public double getRatingDiffFactor() { return ratingDiffFactor; }
    public double getInitialRating() { return initialRating; }
    public int getMomentumWindow() { return momentumWindow; }
    public int getDefaultRank() { return defaultRank; }
    public int getFormWindow() { return formWindow; }
    public int getShortRollingWindow() { return shortRollingWindow; }
    public int getLongRollingWindow() { return longRollingWindow; }
    public int getShortFatigueDays() { return shortFatigueDays; }
    public int getLongFatigueDays() { return longFatigueDays; }
    public int getDefaultRestDays() { return defaultRestDays; }
    public boolean isSameDayIsolation() { return sameDayIsolation; }
    public int getProgressLogInterval() { return progressLogInterval; }
}
