package com.tennis.features.api.config;

import com.tennis.features.engine.config.EngineConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds {@code tennis.features.*}. Engine defaults apply to anything left unset.
 */
@ConfigurationProperties(prefix = "tennis.features")
public class FeatureEngineProperties {

    private double eloKFactor = EngineConfig.DEFAULT_K_FACTOR;
    private double initialRating = EngineConfig.DEFAULT_INITIAL_RATING;
    private int momentumWindow = EngineConfig.DEFAULT_MOMENTUM_WINDOW;
    private int defaultRank = EngineConfig.DEFAULT_PLAYER_RANK;
    private int formWindow = EngineConfig.DEFAULT_FORM_WINDOW;
    private int defaultRestDays = EngineConfig.DEFAULT_REST_DAYS;
    private boolean sameDayIsolation = true;
    private int progressLogInterval = 10_000;

    private Replay replay = new Replay();

    public EngineConfig toEngineConfig() {
        return EngineConfig.builder()
                .kFactor(eloKFactor)
                .initialRating(initialRating)
                .momentumWindow(momentumWindow)
                .defaultRank(defaultRank)
                .formWindow(formWindow)
                .defaultRestDays(defaultRestDays)
                .sameDayIsolation(sameDayIsolation)
                .progressLogInterval(progressLogInterval)
                .build();
    }

    public double getEloKFactor() { return eloKFactor; }
    public void setEloKFactor(double eloKFactor) { this.eloKFactor = eloKFactor; }

    public double getInitialRating() { return initialRating; }
    public void setInitialRating(double initialRating) { this.initialRating = initialRating; }

    public int getMomentumWindow() { return momentumWindow; }
    public void setMomentumWindow(int momentumWindow) { this.momentumWindow = momentumWindow; }

    public int getDefaultRank() { return defaultRank; }
    public void setDefaultRank(int defaultRank) { this.defaultRank = defaultRank; }

    public int getFormWindow() { return formWindow; }
    public void setFormWindow(int formWindow) { this.formWindow = formWindow; }

    public int getDefaultRestDays() { return defaultRestDays; }
    public void setDefaultRestDays(int defaultRestDays) { this.defaultRestDays = defaultRestDays; }

    public boolean isSameDayIsolation() { return sameDayIsolation; }
    public void setSameDayIsolation(boolean sameDayIsolation) { this.sameDayIsolation = sameDayIsolation; }

    public int getProgressLogInterval() { return progressLogInterval; }
    public void setProgressLogInterval(int progressLogInterval) { this.progressLogInterval = progressLogInterval; }

    public Replay getReplay() { return replay; }
    public void setReplay(Replay replay) { this.replay = replay; }

    public static class Replay {

        private boolean onStartup = false;
        private String cron = "-";
        private String featureCollection = "match_features";
        private int batchSize = 5_000;

        public boolean isOnStartup() { return onStartup; }
        public void setOnStartup(boolean onStartup) { this.onStartup = onStartup; }

        public String getCron() { return cron; }
        public void setCron(String cron) { this.cron = cron; }

        public String getFeatureCollection() { return featureCollection; }
        public void setFeatureCollection(String featureCollection) { this.featureCollection = featureCollection; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    }
}
