package com.tennis.features.engine.h2h;

/**
 * Head-to-head wins relative to the order the players were asked in.
 */
public record H2HRecord(int winsOfA, int winsOfB) {

    public static final H2HRecord NONE = new H2HRecord(0, 0);

    public int total() {
        return winsOfA + winsOfB;
    }
}
