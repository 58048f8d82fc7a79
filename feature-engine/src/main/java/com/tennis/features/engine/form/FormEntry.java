package com.tennis.features.engine.form;

import com.tennis.features.engine.model.Surface;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

/**
 * Accumulated results of one player: career counters, per-surface counters and
 * an ordered outcome history (oldest first) for count and day windows.
 */
public class FormEntry {

    private int matchesPlayed;
    private int wins;
    private final Map<Surface, Integer> surfaceMatches;
    private final Map<Surface, Integer> surfaceWins;
    private final Deque<Outcome> history;

    public FormEntry() {
        this.surfaceMatches = new EnumMap<>(Surface.class);
        this.surfaceWins = new EnumMap<>(Surface.class);
        this.history = new ArrayDeque<>();
    }

    private FormEntry(FormEntry source) {
        this.matchesPlayed = source.matchesPlayed;
        this.wins = source.wins;
        this.surfaceMatches = new EnumMap<>(source.surfaceMatches);
        this.surfaceWins = new EnumMap<>(source.surfaceWins);
        this.history = new ArrayDeque<>(source.history);
    }

    void record(LocalDate date, Surface surface, boolean won, int setsPlayed, int opponentRank) {
        Outcome last = history.peekLast();
        if (last != null && date.isBefore(last.date())) {
            throw new IllegalStateException("Outcome dated " + date + " recorded after " + last.date());
        }
        matchesPlayed++;
        surfaceMatches.merge(surface, 1, Integer::sum);
        if (won) {
            wins++;
            surfaceWins.merge(surface, 1, Integer::sum);
        }
        history.addLast(new Outcome(date, won, setsPlayed, opponentRank));
    }

    /**
     * Drop outcomes that no count window and no day window can reach any more.
     */
    void prune(int keepCount, int keepDays) {
        Outcome newest = history.peekLast();
        if (newest == null) return;
        while (history.size() > keepCount) {
            Outcome oldest = history.peekFirst();
            if (ChronoUnit.DAYS.between(oldest.date(), newest.date()) <= keepDays) break;
            history.removeFirst();
        }
    }

    public int getMatchesPlayed() { return matchesPlayed; }
    public int getWins() { return wins; }

    public int getSurfaceMatches(Surface surface) {
        return surfaceMatches.getOrDefault(surface, 0);
    }

    public int getSurfaceWins(Surface surface) {
        return surfaceWins.getOrDefault(surface, 0);
    }

    Deque<Outcome> getHistory() {
        return history;
    }

    FormEntry copy() {
        return new FormEntry(this);
    }

    /**
     * One result; {@code opponentRank} is the opponent's rank as known before the match.
     */
    record Outcome(LocalDate date, boolean won, int setsPlayed, int opponentRank) {}
}
