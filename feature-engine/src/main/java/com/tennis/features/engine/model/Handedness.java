package com.tennis.features.engine.model;

/**
 * Playing hand as published in the player attribute files.
 */
public enum Handedness {

    R,
    L,
    A,
    U;

    public static Handedness fromCode(String code) {
        if (code == null || code.isBlank()) return U;
        return switch (code.trim().toUpperCase()) {
            case "R" -> R;
            case "L" -> L;
            case "A" -> A;
            default -> U;
        };
    }
}
