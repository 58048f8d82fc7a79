package com.tennis.features.engine.rating;

import com.tennis.features.engine.config.EngineConfig;
import com.tennis.features.engine.model.Surface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EloRatingTrackerTest {

    private EloRatingTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new EloRatingTracker(EngineConfig.defaults());
    }

    @Test
    @DisplayName("Unknown players read the initial rating without being stored")
    void unknownPlayerReadsDefaultWithoutWriting() {
        assertThat(tracker.rating(42, Surface.HARD)).isEqualTo(1500.0);
        assertThat(tracker.overallRating(42)).isEqualTo(1500.0);
        assertThat(tracker.momentum(42, Surface.CLAY)).isEqualTo(0.0);
        assertThat(tracker.playerCount()).isZero();
    }

    @Test
    @DisplayName("Evenly rated players exchange K/2 points")
    void evenRatingsExchangeHalfK() {
        tracker.update(1, 2, Surface.HARD);

        assertThat(tracker.rating(1, Surface.HARD)).isEqualTo(1516.0);
        assertThat(tracker.rating(2, Surface.HARD)).isEqualTo(1484.0);
        assertThat(tracker.overallRating(1)).isEqualTo(1516.0);
        assertThat(tracker.overallRating(2)).isEqualTo(1484.0);
    }

    @Test
    @DisplayName("A result on one surface leaves the other surfaces untouched")
    void surfacesAreIndependent() {
        tracker.update(1, 2, Surface.HARD);

        assertThat(tracker.rating(1, Surface.CLAY)).isEqualTo(1500.0);
        assertThat(tracker.rating(1, Surface.GRASS)).isEqualTo(1500.0);
        assertThat(tracker.rating(1, Surface.UNKNOWN)).isEqualTo(1500.0);
    }

    @Test
    void favouriteGainsLessThanUnderdog() {
        tracker.update(1, 2, Surface.HARD);
        tracker.update(1, 3, Surface.HARD);
        double favouriteGain = tracker.rating(1, Surface.HARD) - 1516.0;

        tracker.update(4, 1, Surface.HARD);
        double underdogGain = tracker.rating(4, Surface.HARD) - 1500.0;

        assertThat(favouriteGain).isLessThan(16.0);
        assertThat(underdogGain).isGreaterThan(16.0);
    }

    @Test
    @DisplayName("Every exchange is zero-sum")
    void ratingsAreZeroSum() {
        tracker.update(1, 2, Surface.CLAY);
        tracker.update(2, 3, Surface.CLAY);
        tracker.update(3, 1, Surface.CLAY);
        tracker.update(1, 3, Surface.CLAY);

        double total = tracker.rating(1, Surface.CLAY) + tracker.rating(2, Surface.CLAY) + tracker.rating(3, Surface.CLAY);
        assertThat(total).isCloseTo(4500.0, within(1e-9));
    }

    @Test
    void expectedScoreIsLogistic() {
        assertThat(tracker.expectedScore(1500, 1500)).isEqualTo(0.5);
        assertThat(tracker.expectedScore(1900, 1500)).isCloseTo(10.0 / 11.0, within(1e-12));
    }

    @Test
    @DisplayName("Momentum spans the retained pre-match ratings")
    void momentumUsesOldestRetainedRating() {
        tracker.update(1, 2, Surface.HARD);
        assertThat(tracker.momentum(1, Surface.HARD)).isEqualTo(16.0);

        for (int opponent = 10; opponent < 16; opponent++) {
            tracker.update(1, opponent, Surface.HARD);
        }
        // seven matches played, only the last five pre-match ratings are kept
        double current = tracker.rating(1, Surface.HARD);
        assertThat(tracker.momentum(1, Surface.HARD)).isLessThan(current - 1500.0);
        assertThat(tracker.momentum(1, Surface.HARD)).isGreaterThan(0.0);
    }

    @Test
    void copyIsIndependent() {
        tracker.update(1, 2, Surface.HARD);
        EloRatingTracker copy = tracker.copy();

        copy.update(2, 1, Surface.HARD);

        assertThat(tracker.rating(1, Surface.HARD)).isEqualTo(1516.0);
        assertThat(copy.rating(1, Surface.HARD)).isLessThan(1516.0);
    }
}
