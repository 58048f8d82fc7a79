package com.tennis.features.api.controller;

import com.tennis.features.api.repository.readonly.MatchReadRepository;
import com.tennis.features.api.repository.readonly.RankingReadRepository;
import com.tennis.features.api.service.FeatureTableWriter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Health", description = "API health and status")
public class HealthController {

    private final MatchReadRepository matchRepository;
    private final RankingReadRepository rankingRepository;
    private final FeatureTableWriter featureTable;

    public HealthController(
            MatchReadRepository matchRepository,
            RankingReadRepository rankingRepository,
            FeatureTableWriter featureTable
    ) {
        this.matchRepository = matchRepository;
        this.rankingRepository = rankingRepository;
        this.featureTable = featureTable;
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check API and database connectivity")
    public Map<String, Object> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("timestamp", Instant.now());

        // Read access to upstream data
        try {
            health.put("matchCount", matchRepository.count());
            health.put("rankingCount", rankingRepository.count());
            health.put("upstreamDataAccess", "OK");
        } catch (Exception e) {
            health.put("upstreamDataAccess", "ERROR: " + e.getMessage());
        }

        try {
            health.put("featureRowCount", featureTable.count());
            health.put("featureTableAccess", "OK");
        } catch (Exception e) {
            health.put("featureTableAccess", "ERROR: " + e.getMessage());
        }

        return health;
    }
}
