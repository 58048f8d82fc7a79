package com.tennis.features.engine.ranking;

import com.tennis.features.engine.model.RankingRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time rank resolution over an immutable ranking history.
 *
 * Rows are partitioned per player and sorted by date once, so each lookup is a
 * binary search. A ranking published on the match day itself is not used.
 */
public final class RankingLookup {

    private static final Logger log = LoggerFactory.getLogger(RankingLookup.class);

    private final Map<Integer, PlayerRankings> byPlayer;
    private final int defaultRank;
    private final int rowCount;

    private RankingLookup(Map<Integer, PlayerRankings> byPlayer, int defaultRank, int rowCount) {
        this.byPlayer = byPlayer;
        this.defaultRank = defaultRank;
        this.rowCount = rowCount;
    }

    public static RankingLookup empty(int defaultRank) {
        return new RankingLookup(Map.of(), defaultRank, 0);
    }

    /**
     * Build from rows in any order. Rows with a null date are skipped.
     */
    public static RankingLookup of(Collection<RankingRow> rows, int defaultRank) {
        Map<Integer, List<RankingRow>> grouped = new HashMap<>();
        int skipped = 0;
        for (RankingRow row : rows) {
            if (row == null || row.date() == null) {
                skipped++;
                continue;
            }
            grouped.computeIfAbsent(row.playerId(), key -> new ArrayList<>()).add(row);
        }

        Map<Integer, PlayerRankings> byPlayer = new HashMap<>(grouped.size());
        int kept = 0;
        for (Map.Entry<Integer, List<RankingRow>> entry : grouped.entrySet()) {
            List<RankingRow> playerRows = entry.getValue();
            playerRows.sort(Comparator.comparing(RankingRow::date));

            long[] days = new long[playerRows.size()];
            int[] ranks = new int[playerRows.size()];
            for (int i = 0; i < playerRows.size(); i++) {
                days[i] = playerRows.get(i).date().toEpochDay();
                ranks[i] = playerRows.get(i).rank();
            }
            byPlayer.put(entry.getKey(), new PlayerRankings(days, ranks));
            kept += playerRows.size();
        }

        if (skipped > 0) {
            log.warn("Skipped {} ranking rows without a date", skipped);
        }
        log.info("Loaded {} ranking rows for {} players", kept, byPlayer.size());
        return new RankingLookup(Map.copyOf(byPlayer), defaultRank, kept);
    }

    /**
     * Rank from the latest row strictly before {@code date}, or the default rank.
     */
    public int mostRecentRank(int playerId, LocalDate date) {
        PlayerRankings rankings = byPlayer.get(playerId);
        if (rankings == null) return defaultRank;

        int index = rankings.lastIndexBefore(date.toEpochDay());
        return index >= 0 ? rankings.ranks[index] : defaultRank;
    }

    public int getDefaultRank() { return defaultRank; }
    public int getRowCount() { return rowCount; }
    public int getPlayerCount() { return byPlayer.size(); }

    private record PlayerRankings(long[] days, int[] ranks) {

        /**
         * Index of the last row with day < target, or -1.
         */
        int lastIndexBefore(long target) {
            int lo = 0;
            int hi = days.length;
            while (lo < hi) {
                int mid = (lo + hi) >>> 1;
                if (days[mid] < target) {
                    lo = mid + 1;
                } else {
                    hi = mid;
                }
            }
            return lo - 1;
        }
    }
}
