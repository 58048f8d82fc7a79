package com.tennis.features.api.service;

import com.tennis.features.api.exception.ResourceNotFoundException;
import com.tennis.features.api.exception.SnapshotUnavailableException;
import com.tennis.features.engine.live.LiveQueryAdapter;
import com.tennis.features.engine.model.FeatureVector;
import com.tennis.features.engine.model.Surface;
import com.tennis.features.engine.replay.TrackerSnapshot;
import org.bson.Document;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Service
public class LiveFeatureService {

    private final LiveQueryAdapter liveAdapter;
    private final FeatureTableWriter featureTable;

    public LiveFeatureService(LiveQueryAdapter liveAdapter, FeatureTableWriter featureTable) {
        this.liveAdapter = liveAdapter;
        this.featureTable = featureTable;
    }

    /**
     * Feature columns for an upcoming match, in the same layout as the feature table (minus the label).
     */
    public Map<String, Object> liveFeatures(int p1Id, int p2Id, String surfaceTag, LocalDate date, String matchId) {
        Surface surface = Surface.fromTag(surfaceTag);
        if (surface == null) {
            throw new IllegalArgumentException("Unknown surface: " + surfaceTag);
        }
        if (liveAdapter.currentSnapshot().isEmpty()) {
            throw new SnapshotUnavailableException();
        }
        FeatureVector features = liveAdapter.features(p1Id, p2Id, surface, date, matchId);
        return features.toColumns();
    }

    public Map<String, Object> storedRow(String matchId) {
        Document doc = featureTable.findByMatchId(matchId)
                .orElseThrow(() -> new ResourceNotFoundException("Feature row", matchId));
        Map<String, Object> row = new LinkedHashMap<>(doc);
        row.remove("_id");
        return row;
    }

    public Map<String, Object> snapshotStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        Optional<TrackerSnapshot> snapshot = liveAdapter.currentSnapshot();
        status.put("snapshotInstalled", snapshot.isPresent());
        snapshot.ifPresent(s -> {
            status.put("lastAppliedDate", s.getLastAppliedDate());
            status.put("appliedMatches", s.getAppliedCount());
            status.put("ratedPlayers", s.getElo().playerCount());
            status.put("rankingRows", s.getRankings().getRowCount());
        });
        return status;
    }
}
