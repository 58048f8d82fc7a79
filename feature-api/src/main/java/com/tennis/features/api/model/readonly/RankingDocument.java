package com.tennis.features.api.model.readonly;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Read-only model for published ranking rows.
 */
@Document(collection = "rankings")
public class RankingDocument {

    @Id
    private String id;

    private String rankingDate;
    private Integer playerId;
    private Integer rank;

    public RankingDocument() {
    }

    public RankingDocument(String rankingDate, Integer playerId, Integer rank) {
        this.rankingDate = rankingDate;
        this.playerId = playerId;
        this.rank = rank;
    }

    public String getId() { return id; }
    public String getRankingDate() { return rankingDate; }
    public Integer getPlayerId() { return playerId; }
    public Integer getRank() { return rank; }
}
