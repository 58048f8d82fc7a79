package com.tennis.features.engine.model;

import java.time.LocalDate;

public record RankingRow(LocalDate date, int playerId, int rank) {
}
