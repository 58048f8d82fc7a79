package com.tennis.features.engine.feature;

import com.tennis.features.engine.config.EngineConfig;
import com.tennis.features.engine.form.PlayerFormTracker;
import com.tennis.features.engine.h2h.H2HRecord;
import com.tennis.features.engine.model.FeatureVector;
import com.tennis.features.engine.model.PlayerAttributes;
import com.tennis.features.engine.model.PlayerFeatures;
import com.tennis.features.engine.model.Surface;
import com.tennis.features.engine.rating.EloRatingTracker;
import com.tennis.features.engine.replay.TrackerSnapshot;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Builds the p1/p2 feature vector for a match from tracker state.
 *
 * Only query methods are called, so the same instance serves the historical
 * replay and live requests and gives identical output for identical state.
 */
public class FeatureAssembler {

    public FeatureVector build(TrackerSnapshot state, int p1Id, int p2Id, Surface surface,
                               LocalDate date, String matchId) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(surface, "surface");
        Objects.requireNonNull(date, "date");
        if (p1Id == p2Id) {
            throw new IllegalArgumentException("p1 and p2 must be different players: " + p1Id);
        }

        H2HRecord h2h = state.getHeadToHead().get(p1Id, p2Id);
        PlayerFeatures p1 = side(state, p1Id, surface, date, h2h.winsOfA());
        PlayerFeatures p2 = side(state, p2Id, surface, date, h2h.winsOfB());
        return new FeatureVector(matchId, date, surface, p1, p2);
    }

    private PlayerFeatures side(TrackerSnapshot state, int playerId, Surface surface,
                                LocalDate date, int h2hWins) {
        EngineConfig config = state.getConfig();
        EloRatingTracker elo = state.getElo();
        PlayerFormTracker form = state.getForm();
        PlayerAttributes attributes = state.attributes(playerId);

        return new PlayerFeatures(
                playerId,
                state.getRankings().mostRecentRank(playerId, date),
                elo.rating(playerId, surface),
                elo.overallRating(playerId),
                elo.momentum(playerId, surface),
                form.winPerc(playerId),
                form.surfaceWinPerc(playerId, surface),
                form.formLastN(playerId, config.getFormWindow()),
                form.rollingWinPerc(playerId, config.getShortRollingWindow()),
                form.rollingWinPerc(playerId, config.getLongRollingWindow()),
                form.avgOpponentRank(playerId, config.getFormWindow()),
                form.matchesInWindow(playerId, date, config.getShortFatigueDays()),
                form.matchesInWindow(playerId, date, config.getLongFatigueDays()),
                form.setsInWindow(playerId, date, config.getShortFatigueDays()),
                form.setsInWindow(playerId, date, config.getLongFatigueDays()),
                form.restDays(playerId, date),
                h2hWins,
                attributes.hand(),
                attributes.heightCm());
    }
}
