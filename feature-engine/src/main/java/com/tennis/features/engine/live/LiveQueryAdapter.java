package com.tennis.features.engine.live;

import com.tennis.features.engine.feature.FeatureAssembler;
import com.tennis.features.engine.model.FeatureVector;
import com.tennis.features.engine.model.Surface;
import com.tennis.features.engine.replay.TrackerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Feature vectors for upcoming matches, answered from the latest frozen snapshot.
 *
 * Readers take the snapshot once per call; {@link #install(TrackerSnapshot)} swaps
 * in a new one without blocking them.
 */
public class LiveQueryAdapter {

    private static final Logger log = LoggerFactory.getLogger(LiveQueryAdapter.class);

    private final FeatureAssembler assembler;
    private final AtomicReference<TrackerSnapshot> current = new AtomicReference<>();

    public LiveQueryAdapter(FeatureAssembler assembler) {
        this.assembler = assembler;
    }

    public FeatureVector features(int p1Id, int p2Id, Surface surface, LocalDate date, String matchId) {
        TrackerSnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new IllegalStateException("No tracker snapshot installed yet");
        }
        LocalDate last = snapshot.getLastAppliedDate();
        if (last != null && !date.isAfter(last)) {
            throw new IllegalArgumentException("Query date " + date
                    + " must be after the snapshot's last applied date " + last);
        }
        return assembler.build(snapshot, p1Id, p2Id, surface, date, matchId);
    }

    /**
     * Freeze and publish a snapshot, replacing the previous one.
     */
    public void install(TrackerSnapshot snapshot) {
        TrackerSnapshot previous = current.getAndSet(snapshot.freeze());
        log.info("Installed snapshot with {} matches (last applied {}), replacing {}",
                snapshot.getAppliedCount(), snapshot.getLastAppliedDate(),
                previous != null ? previous.getLastAppliedDate() : "none");
    }

    public Optional<TrackerSnapshot> currentSnapshot() {
        return Optional.ofNullable(current.get());
    }
}
