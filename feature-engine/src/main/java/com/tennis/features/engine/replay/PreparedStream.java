package com.tennis.features.engine.replay;

import com.tennis.features.engine.model.Match;

import java.util.List;

/**
 * Validated matches sorted by date, plus what was left out and why.
 */
public record PreparedStream(List<Match> matches, int dropped, int duplicates) {

    public int size() {
        return matches.size();
    }
}
