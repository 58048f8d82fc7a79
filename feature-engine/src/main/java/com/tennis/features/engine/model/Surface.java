package com.tennis.features.engine.model;

import java.util.List;
import java.util.Locale;

/**
 * Court category partitioning ratings and form statistics.
 * UNKNOWN is an independent partition, never folded into HARD.
 */
public enum Surface {

    HARD,
    CLAY,
    GRASS,
    UNKNOWN;

    private static final List<String> GRASS_KEYWORDS = List.of(
            "wimbledon", "queens club", "halle", "'s-hertogenbosch", "newport"
    );

    private static final List<String> CLAY_KEYWORDS = List.of(
            "roland garros", "french open", "monte carlo", "madrid", "rome"
    );

    /**
     * Parse an explicit surface tag ("Hard", "clay", ...).
     * Returns null when the tag is blank or not a known surface.
     */
    public static Surface fromTag(String tag) {
        if (tag == null || tag.isBlank()) return null;
        return switch (tag.trim().toLowerCase(Locale.ROOT)) {
            case "hard" -> HARD;
            case "clay" -> CLAY;
            case "grass" -> GRASS;
            case "unknown" -> UNKNOWN;
            default -> null;
        };
    }

    /**
     * Derive the surface from tournament metadata.
     * A present tag always wins, and one we don't model ("Carpet") is UNKNOWN.
     * Only a blank tag falls back to the tournament name heuristics.
     */
    public static Surface resolve(String tag, String tourneyName) {
        if (tag == null || tag.isBlank()) {
            return fromTourneyName(tourneyName);
        }
        Surface tagged = fromTag(tag);
        return tagged != null ? tagged : UNKNOWN;
    }

    public static Surface fromTourneyName(String tourneyName) {
        if (tourneyName == null || tourneyName.isBlank()) return UNKNOWN;

        String name = tourneyName.toLowerCase(Locale.ROOT);

        // Bracketed markers beat keywords, e.g. "Umag (Clay)"
        if (name.contains("(clay)")) return CLAY;
        if (name.contains("(grass)")) return GRASS;
        if (name.contains("(hard)")) return HARD;

        for (String keyword : GRASS_KEYWORDS) {
            if (name.contains(keyword)) return GRASS;
        }
        for (String keyword : CLAY_KEYWORDS) {
            if (name.contains(keyword)) return CLAY;
        }
        return HARD;
    }

    public String getLabel() {
        return switch (this) {
            case HARD -> "Hard";
            case CLAY -> "Clay";
            case GRASS -> "Grass";
            case UNKNOWN -> "Unknown";
        };
    }
}
