package com.tennis.features.engine.form;

import com.tennis.features.engine.config.EngineConfig;
import com.tennis.features.engine.model.Surface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PlayerFormTrackerTest {

    private static final LocalDate JAN_1 = LocalDate.of(2023, 1, 1);

    private PlayerFormTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new PlayerFormTracker(EngineConfig.defaults());
    }

    @Test
    @DisplayName("A player without history gets the documented defaults")
    void defaultsWithoutHistory() {
        assertThat(tracker.winPerc(7)).isEqualTo(0.0);
        assertThat(tracker.surfaceWinPerc(7, Surface.GRASS)).isEqualTo(0.0);
        assertThat(tracker.formLastN(7, 10)).isEqualTo(0.0);
        assertThat(tracker.matchesInWindow(7, JAN_1, 7)).isZero();
        assertThat(tracker.setsInWindow(7, JAN_1, 14)).isZero();
        assertThat(tracker.restDays(7, JAN_1)).isEqualTo(30);
        assertThat(tracker.matchesPlayed(7)).isZero();
        assertThat(tracker.avgOpponentRank(7, 10)).isEqualTo(500.0);
    }

    @Test
    void winRatesCountCareerAndSurface() {
        tracker.update(1, 2, Surface.HARD, JAN_1, 2, 500, 500);
        tracker.update(3, 1, Surface.CLAY, JAN_1.plusDays(1), 3, 500, 500);
        tracker.update(1, 4, Surface.HARD, JAN_1.plusDays(2), 2, 500, 500);

        assertThat(tracker.winPerc(1)).isCloseTo(2.0 / 3.0, within(1e-12));
        assertThat(tracker.surfaceWinPerc(1, Surface.HARD)).isEqualTo(1.0);
        assertThat(tracker.surfaceWinPerc(1, Surface.CLAY)).isEqualTo(0.0);
        assertThat(tracker.winPerc(2)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Recent form looks at the newest results only")
    void formLastNUsesNewestResults() {
        for (int i = 0; i < 10; i++) {
            tracker.update(9, 1, Surface.HARD, JAN_1.plusDays(i), 2, 500, 500);
        }
        tracker.update(1, 9, Surface.HARD, JAN_1.plusDays(10), 2, 500, 500);
        tracker.update(1, 9, Surface.HARD, JAN_1.plusDays(11), 2, 500, 500);

        assertThat(tracker.formLastN(1, 10)).isCloseTo(0.2, within(1e-12));
        assertThat(tracker.rollingWinPerc(1, 20)).isCloseTo(2.0 / 12.0, within(1e-12));
        assertThat(tracker.formLastN(1, 2)).isEqualTo(1.0);
    }

    @Test
    void windowLargerThanRetainedHistoryIsRejected() {
        assertThatThrownBy(() -> tracker.formLastN(1, 51))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tracker.matchesInWindow(1, JAN_1, 15))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Day windows include the boundary day and exclude the query day")
    void dayWindowBoundaries() {
        tracker.update(1, 2, Surface.HARD, JAN_1, 3, 500, 500);

        assertThat(tracker.matchesInWindow(1, JAN_1, 7)).isZero();
        assertThat(tracker.matchesInWindow(1, JAN_1.plusDays(7), 7)).isEqualTo(1);
        assertThat(tracker.matchesInWindow(1, JAN_1.plusDays(8), 7)).isZero();
        assertThat(tracker.matchesInWindow(1, JAN_1.plusDays(8), 14)).isEqualTo(1);
    }

    @Test
    void setsAreSummedInsideTheWindow() {
        tracker.update(1, 2, Surface.HARD, JAN_1, 3, 500, 500);
        tracker.update(1, 3, Surface.HARD, JAN_1.plusDays(5), 5, 500, 500);
        tracker.update(4, 1, Surface.HARD, JAN_1.plusDays(10), 2, 500, 500);

        LocalDate query = JAN_1.plusDays(12);
        assertThat(tracker.setsInWindow(1, query, 7)).isEqualTo(7);
        assertThat(tracker.setsInWindow(1, query, 14)).isEqualTo(10);
        assertThat(tracker.matchesInWindow(1, query, 14)).isEqualTo(3);
    }

    @Test
    void restDaysCountsFromLastEarlierMatch() {
        tracker.update(1, 2, Surface.HARD, JAN_1, 2, 500, 500);

        assertThat(tracker.restDays(1, JAN_1.plusDays(4))).isEqualTo(4);
        assertThat(tracker.restDays(1, JAN_1)).isEqualTo(30);
    }

    @Test
    @DisplayName("Old outcomes are pruned without affecting queries")
    void pruningKeepsEveryReachableOutcome() {
        for (int i = 0; i < 200; i++) {
            tracker.update(1, 100 + i, Surface.HARD, JAN_1.plusDays(i), 2, 500, 500);
        }

        assertThat(tracker.matchesPlayed(1)).isEqualTo(200);
        assertThat(tracker.winPerc(1)).isEqualTo(1.0);
        assertThat(tracker.rollingWinPerc(1, 50)).isEqualTo(1.0);
        assertThat(tracker.matchesInWindow(1, JAN_1.plusDays(200), 14)).isEqualTo(14);
    }

    @Test
    void outcomesMustNotGoBackInTime() {
        tracker.update(1, 2, Surface.HARD, JAN_1.plusDays(3), 2, 500, 500);

        assertThatThrownBy(() -> tracker.update(1, 3, Surface.HARD, JAN_1, 2, 500, 500))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Average opponent rank covers only the newest outcomes")
    void averageOpponentRankOverRecentMatches() {
        tracker.update(1, 2, Surface.HARD, JAN_1, 2, 40, 100);
        tracker.update(3, 1, Surface.HARD, JAN_1.plusDays(1), 2, 10, 40);
        tracker.update(1, 4, Surface.CLAY, JAN_1.plusDays(2), 3, 40, 250);

        assertThat(tracker.avgOpponentRank(1, 10)).isCloseTo((100 + 10 + 250) / 3.0, within(1e-9));
        assertThat(tracker.avgOpponentRank(1, 2)).isCloseTo(130.0, within(1e-9));
        assertThat(tracker.avgOpponentRank(2, 10)).isEqualTo(40.0);
    }
}
