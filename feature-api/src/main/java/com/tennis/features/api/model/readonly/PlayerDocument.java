package com.tennis.features.api.model.readonly;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Read-only model for player attributes.
 */
@Document(collection = "players")
public class PlayerDocument {

    @Id
    private String id;

    private Integer playerId;
    private String playerName;
    private String hand;
    private Integer height;

    public PlayerDocument() {
    }

    public PlayerDocument(Integer playerId, String playerName, String hand, Integer height) {
        this.playerId = playerId;
        this.playerName = playerName;
        this.hand = hand;
        this.height = height;
    }

    public String getId() { return id; }
    public Integer getPlayerId() { return playerId; }
    public String getPlayerName() { return playerName; }
    public String getHand() { return hand; }
    public Integer getHeight() { return height; }
}
