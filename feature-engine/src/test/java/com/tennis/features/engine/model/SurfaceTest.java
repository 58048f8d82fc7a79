package com.tennis.features.engine.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SurfaceTest {

    @Test
    @DisplayName("An explicit tag beats the tournament name")
    void tagTakesPrecedence() {
        assertThat(Surface.resolve("Clay", "Wimbledon")).isEqualTo(Surface.CLAY);
        assertThat(Surface.resolve(" grass ", null)).isEqualTo(Surface.GRASS);
    }

    @Test
    void bracketedMarkerBeatsKeywords() {
        assertThat(Surface.resolve(null, "Madrid (Hard)")).isEqualTo(Surface.HARD);
        assertThat(Surface.resolve("", "Umag (Clay)")).isEqualTo(Surface.CLAY);
    }

    @Test
    void keywordsResolveKnownEvents() {
        assertThat(Surface.fromTourneyName("Wimbledon")).isEqualTo(Surface.GRASS);
        assertThat(Surface.fromTourneyName("Halle Open")).isEqualTo(Surface.GRASS);
        assertThat(Surface.fromTourneyName("Roland Garros")).isEqualTo(Surface.CLAY);
        assertThat(Surface.fromTourneyName("Monte Carlo Masters")).isEqualTo(Surface.CLAY);
        assertThat(Surface.fromTourneyName("Australian Open")).isEqualTo(Surface.HARD);
    }

    @Test
    @DisplayName("An unmodelled tag stays UNKNOWN whatever the tournament is called")
    void unrecognisedTagIsUnknown() {
        assertThat(Surface.resolve("Carpet", "Paris Masters")).isEqualTo(Surface.UNKNOWN);
        assertThat(Surface.resolve("Carpet", "Wimbledon")).isEqualTo(Surface.UNKNOWN);
        assertThat(Surface.resolve("Carpet", null)).isEqualTo(Surface.UNKNOWN);
    }

    @Test
    void missingMetadataIsUnknown() {
        assertThat(Surface.resolve(null, null)).isEqualTo(Surface.UNKNOWN);
        assertThat(Surface.resolve("carpet", "  ")).isEqualTo(Surface.UNKNOWN);
        assertThat(Surface.fromTag("carpet")).isNull();
    }
}
