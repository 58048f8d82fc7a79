package com.tennis.features.api.service;

import com.tennis.features.api.dto.ReplayReport;
import com.tennis.features.api.exception.ReplayInProgressException;
import com.tennis.features.api.exception.SnapshotUnavailableException;
import com.tennis.features.engine.live.LiveQueryAdapter;
import com.tennis.features.engine.model.Match;
import com.tennis.features.engine.replay.ChronologicalOrchestrator;
import com.tennis.features.engine.replay.MatchStreamPreparer;
import com.tennis.features.engine.replay.PreparedStream;
import com.tennis.features.engine.replay.ReplayResult;
import com.tennis.features.engine.replay.TrackerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs replays one at a time and publishes their results.
 *
 * Nothing is published unless the whole pass and the feature table write succeed;
 * on failure the previous snapshot and table stay in place.
 */
@Service
public class ReplayService {

    private static final Logger log = LoggerFactory.getLogger(ReplayService.class);

    private final MatchStreamLoader loader;
    private final MatchStreamPreparer preparer;
    private final ChronologicalOrchestrator orchestrator;
    private final FeatureTableWriter writer;
    private final LiveQueryAdapter liveAdapter;

    private final ReentrantLock replayLock = new ReentrantLock();
    private volatile ReplayReport lastReport;

    public ReplayService(
            MatchStreamLoader loader,
            MatchStreamPreparer preparer,
            ChronologicalOrchestrator orchestrator,
            FeatureTableWriter writer,
            LiveQueryAdapter liveAdapter
    ) {
        this.loader = loader;
        this.preparer = preparer;
        this.orchestrator = orchestrator;
        this.writer = writer;
        this.liveAdapter = liveAdapter;
    }

    // ============ PUBLIC API ============

    /**
     * Rebuild every tracker from the first match, rewrite the feature table and
     * swap in the new snapshot.
     */
    public ReplayReport fullReplay() {
        if (!replayLock.tryLock()) {
            throw new ReplayInProgressException();
        }
        try {
            log.info("Full replay requested");
            return rebuild(preparer.prepare(loader.loadMatches()), 0);
        } finally {
            replayLock.unlock();
        }
    }

    /**
     * Apply only matches dated after the live snapshot, on a copy of it.
     *
     * If the source now holds a different number of matches up to the snapshot's last
     * date than the snapshot applied, history changed underneath it and the request is
     * escalated to a full rebuild.
     */
    public ReplayReport incrementalReplay() {
        if (!replayLock.tryLock()) {
            throw new ReplayInProgressException();
        }
        try {
            TrackerSnapshot current = liveAdapter.currentSnapshot()
                    .orElseThrow(SnapshotUnavailableException::new);
            LocalDate since = current.getLastAppliedDate();

            PreparedStream stream = preparer.prepare(loader.loadMatches());
            List<Match> newer = stream.matches().stream()
                    .filter(m -> since == null || m.date().isAfter(since))
                    .toList();

            long covered = stream.matches().size() - newer.size();
            long late = covered - current.getAppliedCount();
            if (late > 0) {
                log.warn("{} matches arrived dated on or before {}; escalating to a full replay", late, since);
                return rebuild(stream, (int) late);
            }
            if (late < 0) {
                log.warn("{} previously applied matches are no longer in the source; escalating to a full replay",
                        -late);
                return rebuild(stream, 0);
            }
            log.info("Incremental replay: {} matches after {}", newer.size(), since);

            if (newer.isEmpty()) {
                ReplayReport report = new ReplayReport(ReplayReport.Mode.INCREMENTAL, 0,
                        stream.dropped(), stream.duplicates(), 0, current.getElo().playerCount(),
                        null, since, 0, Instant.now());
                lastReport = report;
                return report;
            }

            TrackerSnapshot base = current.copy(loader.loadRankings(), loader.loadPlayers());
            ReplayResult result = orchestrator.extend(base, newer);

            writer.upsert(result.rows());
            liveAdapter.install(result.snapshot());
            return publish(ReplayReport.Mode.INCREMENTAL, result, stream, 0);
        } finally {
            replayLock.unlock();
        }
    }

    public boolean isRunning() {
        return replayLock.isLocked();
    }

    public Optional<ReplayReport> getLastReport() {
        return Optional.ofNullable(lastReport);
    }

    // ============ HELPERS ============

    /** Caller holds the replay lock. */
    private ReplayReport rebuild(PreparedStream stream, int lateMatches) {
        ReplayResult result = orchestrator.replay(stream.matches(), loader.loadRankings(), loader.loadPlayers());

        writer.replaceAll(result.rows());
        liveAdapter.install(result.snapshot());
        return publish(ReplayReport.Mode.FULL, result, stream, lateMatches);
    }

    private ReplayReport publish(ReplayReport.Mode mode, ReplayResult result, PreparedStream stream,
                                 int lateMatches) {
        ReplayReport report = new ReplayReport(
                mode,
                result.processed(),
                stream.dropped(),
                stream.duplicates(),
                lateMatches,
                result.snapshot().getElo().playerCount(),
                result.firstDate(),
                result.lastDate(),
                result.elapsed().toMillis(),
                Instant.now());
        lastReport = report;
        log.info("{} replay published: {} matches, {} dropped, {} duplicates, last date {}",
                mode, report.processed(), report.dropped(), report.duplicates(), report.lastDate());
        return report;
    }
}
