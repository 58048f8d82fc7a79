package com.tennis.features.engine.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A feature vector tagged with its ground-truth label (1 if p1 won).
 */
public record FeatureRow(FeatureVector features, int winner) {

    public Map<String, Object> toColumns() {
        Map<String, Object> columns = new LinkedHashMap<>(features.toColumns());
        columns.put("winner", winner);
        return columns;
    }
}
