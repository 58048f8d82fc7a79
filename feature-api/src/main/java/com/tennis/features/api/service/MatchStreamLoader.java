package com.tennis.features.api.service;

import com.tennis.features.api.model.readonly.MatchDocument;
import com.tennis.features.api.model.readonly.PlayerDocument;
import com.tennis.features.api.model.readonly.RankingDocument;
import com.tennis.features.api.repository.readonly.MatchReadRepository;
import com.tennis.features.api.repository.readonly.PlayerReadRepository;
import com.tennis.features.api.repository.readonly.RankingReadRepository;
import com.tennis.features.engine.config.EngineConfig;
import com.tennis.features.engine.model.Handedness;
import com.tennis.features.engine.model.PlayerAttributes;
import com.tennis.features.engine.model.RankingRow;
import com.tennis.features.engine.model.RawMatch;
import com.tennis.features.engine.ranking.RankingLookup;
import com.tennis.features.engine.replay.MatchStreamPreparer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the upstream collections and converts them into engine inputs.
 */
@Service
public class MatchStreamLoader {

    private static final Logger log = LoggerFactory.getLogger(MatchStreamLoader.class);

    private final MatchReadRepository matchRepository;
    private final RankingReadRepository rankingRepository;
    private final PlayerReadRepository playerRepository;
    private final EngineConfig engineConfig;

    public MatchStreamLoader(
            MatchReadRepository matchRepository,
            RankingReadRepository rankingRepository,
            PlayerReadRepository playerRepository,
            EngineConfig engineConfig
    ) {
        this.matchRepository = matchRepository;
        this.rankingRepository = rankingRepository;
        this.playerRepository = playerRepository;
        this.engineConfig = engineConfig;
    }

    public List<RawMatch> loadMatches() {
        List<MatchDocument> documents = matchRepository.findAll();
        log.info("Loaded {} match documents", documents.size());

        List<RawMatch> raw = new ArrayList<>(documents.size());
        for (MatchDocument doc : documents) {
            raw.add(new RawMatch(
                    doc.getMatchId(),
                    doc.getTourneyDate(),
                    doc.getTourneyName(),
                    doc.getSurface(),
                    doc.getWinnerId(),
                    doc.getLoserId(),
                    doc.getScore()));
        }
        return raw;
    }

    public RankingLookup loadRankings() {
        List<RankingDocument> documents = rankingRepository.findAll();
        List<RankingRow> rows = new ArrayList<>(documents.size());
        int skipped = 0;
        for (RankingDocument doc : documents) {
            LocalDate date = MatchStreamPreparer.parseDate(doc.getRankingDate());
            if (date == null || doc.getPlayerId() == null || doc.getRank() == null) {
                skipped++;
                continue;
            }
            rows.add(new RankingRow(date, doc.getPlayerId(), doc.getRank()));
        }
        if (skipped > 0) {
            log.warn("Skipped {} incomplete ranking documents", skipped);
        }
        return RankingLookup.of(rows, engineConfig.getDefaultRank());
    }

    /**
     * Handedness and height per player. Players with neither attribute are left out
     * and resolve to {@link PlayerAttributes#UNKNOWN}.
     */
    public Map<Integer, PlayerAttributes> loadPlayers() {
        Map<Integer, PlayerAttributes> players = new HashMap<>();
        for (PlayerDocument doc : playerRepository.findAll()) {
            if (doc.getPlayerId() == null || (doc.getHand() == null && doc.getHeight() == null)) {
                continue;
            }
            players.put(doc.getPlayerId(),
                    new PlayerAttributes(Handedness.fromCode(doc.getHand()), doc.getHeight()));
        }
        log.info("Loaded attributes for {} players", players.size());
        return players;
    }
}
