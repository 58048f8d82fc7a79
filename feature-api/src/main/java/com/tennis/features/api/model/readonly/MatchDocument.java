package com.tennis.features.api.model.readonly;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Read-only model for finished matches written by the ingestion service.
 * This service cannot write to this collection.
 */
@Document(collection = "matches")
public class MatchDocument {

    @Id
    private String id;

    private String matchId;
    private String tourneyDate;
    private String tourneyName;
    private String surface;
    private Integer winnerId;
    private Integer loserId;
    private String score;

    public MatchDocument() {
    }

    public MatchDocument(String matchId, String tourneyDate, String tourneyName, String surface,
                         Integer winnerId, Integer loserId, String score) {
        this.matchId = matchId;
        this.tourneyDate = tourneyDate;
        this.tourneyName = tourneyName;
        this.surface = surface;
        this.winnerId = winnerId;
        this.loserId = loserId;
        this.score = score;
    }

    // Getters only (read-only)
    public String getId() { return id; }
    public String getMatchId() { return matchId; }
    public String getTourneyDate() { return tourneyDate; }
    public String getTourneyName() { return tourneyName; }
    public String getSurface() { return surface; }
    public Integer getWinnerId() { return winnerId; }
    public Integer getLoserId() { return loserId; }
    public String getScore() { return score; }
}
