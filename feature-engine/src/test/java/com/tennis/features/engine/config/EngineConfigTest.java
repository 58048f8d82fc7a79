package com.tennis.features.engine.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    @Test
    void defaultsMatchHistoricalTable() {
        EngineConfig config = EngineConfig.defaults();

        assertThat(config.getKFactor()).isEqualTo(32.0);
        assertThat(config.getRatingDiffFactor()).isEqualTo(400.0);
        assertThat(config.getInitialRating()).isEqualTo(1500.0);
        assertThat(config.getDefaultRank()).isEqualTo(500);
        assertThat(config.getDefaultRestDays()).isEqualTo(30);
        assertThat(config.isSameDayIsolation()).isTrue();
        assertThat(config.maxCountWindow()).isEqualTo(50);
        assertThat(config.maxDayWindow()).isEqualTo(14);
    }

    @Test
    void rejectsNonPositiveKFactor() {
        assertThatThrownBy(() -> EngineConfig.builder().kFactor(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
