package com.tennis.features.engine.h2h;

import java.util.HashMap;
import java.util.Map;

/**
 * Pairwise win tally keyed by the unordered player pair.
 */
public class HeadToHeadTracker {

    private final Map<PairKey, H2HEntry> entries;

    public HeadToHeadTracker() {
        this.entries = new HashMap<>();
    }

    private HeadToHeadTracker(HeadToHeadTracker source) {
        this.entries = new HashMap<>(source.entries.size());
        source.entries.forEach((key, entry) -> entries.put(key, entry.copy()));
    }

    /**
     * Wins of {@code a} and {@code b} against each other, (0, 0) if they never met.
     */
    public H2HRecord get(int a, int b) {
        H2HEntry entry = entries.get(PairKey.of(a, b));
        if (entry == null) return H2HRecord.NONE;
        return a <= b
                ? new H2HRecord(entry.getWinsForMin(), entry.getWinsForMax())
                : new H2HRecord(entry.getWinsForMax(), entry.getWinsForMin());
    }

    public void update(int winnerId, int loserId) {
        if (winnerId == loserId) {
            throw new IllegalArgumentException("Player " + winnerId + " cannot play themselves");
        }
        entries.computeIfAbsent(PairKey.of(winnerId, loserId), key -> new H2HEntry())
                .recordWin(winnerId < loserId);
    }

    public int pairCount() {
        return entries.size();
    }

    public HeadToHeadTracker copy() {
        return new HeadToHeadTracker(this);
    }

    private record PairKey(int minId, int maxId) {
        static PairKey of(int a, int b) {
            return new PairKey(Math.min(a, b), Math.max(a, b));
        }
    }
}
