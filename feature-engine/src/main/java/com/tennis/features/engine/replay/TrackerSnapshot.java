package com.tennis.features.engine.replay;

import com.tennis.features.engine.config.EngineConfig;
import com.tennis.features.engine.form.PlayerFormTracker;
import com.tennis.features.engine.h2h.HeadToHeadTracker;
import com.tennis.features.engine.model.Match;
import com.tennis.features.engine.model.PlayerAttributes;
import com.tennis.features.engine.ranking.RankingLookup;
import com.tennis.features.engine.rating.EloRatingTracker;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

/**
 * Tracker state after a prefix of the match stream has been applied.
 *
 * {@link #apply(Match)} is the only mutation. Once frozen the snapshot is safe to
 * share between concurrent readers; refreshing goes through {@link #copy()}.
 */
public class TrackerSnapshot {

    private final EngineConfig config;
    private final EloRatingTracker elo;
    private final PlayerFormTracker form;
    private final HeadToHeadTracker headToHead;
    private final RankingLookup rankings;
    private final Map<Integer, PlayerAttributes> players;

    private LocalDate lastAppliedDate;
    private long appliedCount;
    private volatile boolean frozen;

    public TrackerSnapshot(EngineConfig config, RankingLookup rankings, Map<Integer, PlayerAttributes> players) {
        this(config,
                new EloRatingTracker(config),
                new PlayerFormTracker(config),
                new HeadToHeadTracker(),
                rankings,
                Map.copyOf(players),
                null,
                0);
    }

    private TrackerSnapshot(EngineConfig config,
                            EloRatingTracker elo,
                            PlayerFormTracker form,
                            HeadToHeadTracker headToHead,
                            RankingLookup rankings,
                            Map<Integer, PlayerAttributes> players,
                            LocalDate lastAppliedDate,
                            long appliedCount) {
        this.config = Objects.requireNonNull(config, "config");
        this.elo = elo;
        this.form = form;
        this.headToHead = headToHead;
        this.rankings = Objects.requireNonNull(rankings, "rankings");
        this.players = players;
        this.lastAppliedDate = lastAppliedDate;
        this.appliedCount = appliedCount;
    }

    /**
     * Fold a finished match into Elo, form and head-to-head.
     */
    public void apply(Match match) {
        if (frozen) {
            throw new IllegalStateException("Snapshot is frozen; copy it before applying " + match.matchId());
        }
        if (lastAppliedDate != null && match.date().isBefore(lastAppliedDate)) {
            throw new IllegalStateException("Match " + match.matchId() + " dated " + match.date()
                    + " is earlier than last applied date " + lastAppliedDate);
        }
        int winnerRank = rankings.mostRecentRank(match.winnerId(), match.date());
        int loserRank = rankings.mostRecentRank(match.loserId(), match.date());
        elo.update(match.winnerId(), match.loserId(), match.surface());
        form.update(match.winnerId(), match.loserId(), match.surface(), match.date(), match.setsPlayed(),
                winnerRank, loserRank);
        headToHead.update(match.winnerId(), match.loserId());
        lastAppliedDate = match.date();
        appliedCount++;
    }

    public TrackerSnapshot freeze() {
        frozen = true;
        return this;
    }

    /**
     * Unfrozen deep copy. The ranking lookup and player attributes are immutable and shared.
     */
    public TrackerSnapshot copy() {
        return new TrackerSnapshot(config, elo.copy(), form.copy(), headToHead.copy(),
                rankings, players, lastAppliedDate, appliedCount);
    }

    /**
     * Unfrozen deep copy that reads ranks and player attributes from newer reference data.
     */
    public TrackerSnapshot copy(RankingLookup newRankings, Map<Integer, PlayerAttributes> newPlayers) {
        return new TrackerSnapshot(config, elo.copy(), form.copy(), headToHead.copy(),
                newRankings, Map.copyOf(newPlayers), lastAppliedDate, appliedCount);
    }

    public PlayerAttributes attributes(int playerId) {
        return players.getOrDefault(playerId, PlayerAttributes.UNKNOWN);
    }

    public EngineConfig getConfig() { return config; }
    public EloRatingTracker getElo() { return elo; }
    public PlayerFormTracker getForm() { return form; }
    public HeadToHeadTracker getHeadToHead() { return headToHead; }
    public RankingLookup getRankings() { return rankings; }
    public LocalDate getLastAppliedDate() { return lastAppliedDate; }
    public long getAppliedCount() { return appliedCount; }
    public boolean isFrozen() { return frozen; }
}
