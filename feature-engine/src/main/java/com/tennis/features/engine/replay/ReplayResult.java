package com.tennis.features.engine.replay;

import com.tennis.features.engine.model.FeatureRow;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of a completed pass: the emitted rows in stream order and the final tracker state.
 */
public record ReplayResult(
        List<FeatureRow> rows,
        TrackerSnapshot snapshot,
        LocalDate firstDate,
        LocalDate lastDate,
        Duration elapsed
) {

    public int processed() {
        return rows.size();
    }
}
