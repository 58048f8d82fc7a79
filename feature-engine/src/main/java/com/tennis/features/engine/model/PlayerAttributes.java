package com.tennis.features.engine.model;

/**
 * Static player attributes from the players file. Height is null when not published.
 */
public record PlayerAttributes(Handedness hand, Integer heightCm) {

    public static final PlayerAttributes UNKNOWN = new PlayerAttributes(Handedness.U, null);

    public PlayerAttributes {
        if (hand == null) hand = Handedness.U;
    }
}
