package com.tennis.features.engine.form;

import com.tennis.features.engine.config.EngineConfig;
import com.tennis.features.engine.model.Surface;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Per-player win rates, short-term form and fatigue windows.
 *
 * Window queries only count outcomes dated strictly before the query date.
 * Every query defaults to 0 for a player without prior matches and never
 * creates an entry.
 */
public class PlayerFormTracker {

    private final int keepCount;
    private final int keepDays;
    private final int defaultRestDays;
    private final int defaultRank;
    private final Map<Integer, FormEntry> entries;

    public PlayerFormTracker(EngineConfig config) {
        this.keepCount = config.maxCountWindow();
        this.keepDays = config.maxDayWindow();
        this.defaultRestDays = config.getDefaultRestDays();
        this.defaultRank = config.getDefaultRank();
        this.entries = new HashMap<>();
    }

    private PlayerFormTracker(PlayerFormTracker source) {
        this.keepCount = source.keepCount;
        this.keepDays = source.keepDays;
        this.defaultRestDays = source.defaultRestDays;
        this.defaultRank = source.defaultRank;
        this.entries = new HashMap<>(source.entries.size());
        source.entries.forEach((playerId, entry) -> entries.put(playerId, entry.copy()));
    }

    // ============ QUERIES ============

    public double winPerc(int playerId) {
        FormEntry entry = entries.get(playerId);
        if (entry == null || entry.getMatchesPlayed() == 0) return 0.0;
        return (double) entry.getWins() / entry.getMatchesPlayed();
    }

    public double surfaceWinPerc(int playerId, Surface surface) {
        FormEntry entry = entries.get(playerId);
        if (entry == null) return 0.0;
        int played = entry.getSurfaceMatches(surface);
        return played > 0 ? (double) entry.getSurfaceWins(surface) / played : 0.0;
    }

    /**
     * Win rate over the player's last {@code n} matches (fewer if not yet played).
     */
    public double formLastN(int playerId, int n) {
        if (n > keepCount) {
            throw new IllegalArgumentException("Window of " + n + " exceeds retained history of " + keepCount);
        }
        FormEntry entry = entries.get(playerId);
        if (entry == null || entry.getHistory().isEmpty()) return 0.0;

        int counted = 0;
        int won = 0;
        Iterator<FormEntry.Outcome> newestFirst = entry.getHistory().descendingIterator();
        while (newestFirst.hasNext() && counted < n) {
            if (newestFirst.next().won()) won++;
            counted++;
        }
        return (double) won / counted;
    }

    /**
     * Rolling win rate over the last {@code n} matches; same count rule as {@link #formLastN}.
     */
    public double rollingWinPerc(int playerId, int n) {
        return formLastN(playerId, n);
    }

    /**
     * Mean pre-match rank of the opponents in the last {@code n} matches, or the default rank.
     */
    public double avgOpponentRank(int playerId, int n) {
        if (n > keepCount) {
            throw new IllegalArgumentException("Window of " + n + " exceeds retained history of " + keepCount);
        }
        FormEntry entry = entries.get(playerId);
        if (entry == null || entry.getHistory().isEmpty()) return defaultRank;

        int counted = 0;
        long rankSum = 0;
        Iterator<FormEntry.Outcome> newestFirst = entry.getHistory().descendingIterator();
        while (newestFirst.hasNext() && counted < n) {
            rankSum += newestFirst.next().opponentRank();
            counted++;
        }
        return (double) rankSum / counted;
    }

    /**
     * Matches played in the trailing window: {@code date - outcome.date <= days}.
     */
    public int matchesInWindow(int playerId, LocalDate date, int days) {
        return window(playerId, date, days).size();
    }

    /**
     * Sets played in the trailing window, a finer fatigue measure than match count.
     */
    public int setsInWindow(int playerId, LocalDate date, int days) {
        int sets = 0;
        for (FormEntry.Outcome outcome : window(playerId, date, days)) {
            sets += outcome.setsPlayed();
        }
        return sets;
    }

    /**
     * Days since the player's last match before {@code date}.
     */
    public int restDays(int playerId, LocalDate date) {
        FormEntry entry = entries.get(playerId);
        if (entry == null) return defaultRestDays;
        Iterator<FormEntry.Outcome> newestFirst = entry.getHistory().descendingIterator();
        while (newestFirst.hasNext()) {
            FormEntry.Outcome outcome = newestFirst.next();
            if (outcome.date().isBefore(date)) {
                return (int) ChronoUnit.DAYS.between(outcome.date(), date);
            }
        }
        return defaultRestDays;
    }

    public int matchesPlayed(int playerId) {
        FormEntry entry = entries.get(playerId);
        return entry != null ? entry.getMatchesPlayed() : 0;
    }

    private List<FormEntry.Outcome> window(int playerId, LocalDate date, int days) {
        if (days > keepDays) {
            throw new IllegalArgumentException("Window of " + days + " days exceeds retained history of " + keepDays);
        }
        FormEntry entry = entries.get(playerId);
        if (entry == null) return List.of();

        List<FormEntry.Outcome> inWindow = new ArrayList<>();
        Iterator<FormEntry.Outcome> newestFirst = entry.getHistory().descendingIterator();
        while (newestFirst.hasNext()) {
            FormEntry.Outcome outcome = newestFirst.next();
            if (!outcome.date().isBefore(date)) continue;
            if (ChronoUnit.DAYS.between(outcome.date(), date) > days) break;
            inWindow.add(outcome);
        }
        return inWindow;
    }

    // ============ UPDATES ============

    public void update(int winnerId, int loserId, Surface surface, LocalDate date, int setsPlayed,
                       int winnerRank, int loserRank) {
        record(winnerId, surface, date, true, setsPlayed, loserRank);
        record(loserId, surface, date, false, setsPlayed, winnerRank);
    }

    private void record(int playerId, Surface surface, LocalDate date, boolean won, int setsPlayed, int opponentRank) {
        FormEntry entry = entries.computeIfAbsent(playerId, key -> new FormEntry());
        entry.record(date, surface, won, setsPlayed, opponentRank);
        entry.prune(keepCount, keepDays);
    }

    public PlayerFormTracker copy() {
        return new PlayerFormTracker(this);
    }
}
