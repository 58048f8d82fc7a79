package com.tennis.features.engine.replay;

import com.tennis.features.engine.config.EngineConfig;
import com.tennis.features.engine.feature.FeatureAssembler;
import com.tennis.features.engine.model.FeatureRow;
import com.tennis.features.engine.model.FeatureVector;
import com.tennis.features.engine.model.Match;
import com.tennis.features.engine.model.PlayerAttributes;
import com.tennis.features.engine.ranking.RankingLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Walks the match stream in date order: assemble features, emit the labelled row,
 * then fold the result into the trackers.
 *
 * With same-day isolation every match of a calendar date is assembled before any
 * of them is applied, so a row never sees a result from its own day.
 */
public class ChronologicalOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ChronologicalOrchestrator.class);

    private final EngineConfig config;
    private final FeatureAssembler assembler;

    public ChronologicalOrchestrator(EngineConfig config, FeatureAssembler assembler) {
        this.config = config;
        this.assembler = assembler;
    }

    /**
     * Full replay from empty trackers.
     */
    public ReplayResult replay(List<Match> matches, RankingLookup rankings, Map<Integer, PlayerAttributes> players) {
        log.info("Starting full replay of {} matches", matches.size());
        return run(new TrackerSnapshot(config, rankings, players), matches);
    }

    /**
     * Continue from an existing unfrozen snapshot. Every match must be dated after
     * the snapshot's last applied date.
     */
    public ReplayResult extend(TrackerSnapshot base, List<Match> newer) {
        if (base.isFrozen()) {
            throw new IllegalArgumentException("Cannot extend a frozen snapshot; pass a copy");
        }
        LocalDate last = base.getLastAppliedDate();
        if (last != null) {
            for (Match match : newer) {
                if (!match.date().isAfter(last)) {
                    throw new IllegalArgumentException("Match " + match.matchId() + " dated " + match.date()
                            + " is not after the snapshot's last applied date " + last);
                }
            }
        }
        log.info("Extending snapshot (last applied {}) with {} matches", last, newer.size());
        return run(base, newer);
    }

    private ReplayResult run(TrackerSnapshot state, List<Match> matches) {
        long started = System.nanoTime();
        List<FeatureRow> rows = new ArrayList<>(matches.size());
        List<Match> pending = new ArrayList<>();
        LocalDate previousDate = null;
        Match current = null;

        try {
            for (Match match : matches) {
                current = match;
                if (previousDate != null && match.date().isBefore(previousDate)) {
                    throw new ReplayAbortedException("Match stream out of order: " + match.matchId()
                            + " dated " + match.date() + " follows " + previousDate,
                            match.matchId(), rows.size());
                }

                if (!config.isSameDayIsolation() || !match.date().equals(previousDate)) {
                    applyAll(state, pending, rows.size());
                }

                rows.add(emit(state, match));
                pending.add(match);
                if (!config.isSameDayIsolation()) {
                    applyAll(state, pending, rows.size());
                }

                previousDate = match.date();
                if (rows.size() % config.getProgressLogInterval() == 0) {
                    log.info("Processed {} of {} matches (at {})", rows.size(), matches.size(), previousDate);
                }
            }
            applyAll(state, pending, rows.size());
        } catch (ReplayAbortedException e) {
            log.error("Replay aborted after {} matches: {}", e.getProcessedBeforeFailure(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            String matchId = current != null ? current.matchId() : null;
            log.error("Replay aborted at match {} after {} matches", matchId, rows.size(), e);
            throw new ReplayAbortedException("Replay failed at match " + matchId + ": " + e.getMessage(),
                    matchId, rows.size(), e);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        LocalDate firstDate = matches.isEmpty() ? null : matches.get(0).date();
        log.info("Replay complete: {} matches in {} ms, {} rated players",
                rows.size(), elapsed.toMillis(), state.getElo().playerCount());
        return new ReplayResult(List.copyOf(rows), state, firstDate, previousDate, elapsed);
    }

    private FeatureRow emit(TrackerSnapshot state, Match match) {
        FeatureVector features = assembler.build(state, match.p1Id(), match.p2Id(),
                match.surface(), match.date(), match.matchId());
        if (log.isDebugEnabled()) {
            log.debug("Match {} {} vs {} on {}: elo diff {}", match.matchId(), match.p1Id(), match.p2Id(),
                    match.date(), features.eloDiff());
        }
        return new FeatureRow(features, match.label());
    }

    private void applyAll(TrackerSnapshot state, List<Match> pending, int processed) {
        for (Match match : pending) {
            try {
                state.apply(match);
            } catch (RuntimeException e) {
                throw new ReplayAbortedException("Failed to apply match " + match.matchId() + ": " + e.getMessage(),
                        match.matchId(), processed, e);
            }
        }
        pending.clear();
    }
}
