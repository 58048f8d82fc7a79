package com.tennis.features.api.controller;

import com.tennis.features.api.service.LiveFeatureService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

@RestController
@RequestMapping("/api/features")
@Tag(name = "Features", description = "Point-in-time match features")
public class FeatureController {

    private final LiveFeatureService liveFeatureService;

    public FeatureController(LiveFeatureService liveFeatureService) {
        this.liveFeatureService = liveFeatureService;
    }

    @GetMapping("/live")
    @Operation(summary = "Features for an upcoming match",
            description = "Assemble the feature vector from the latest replay snapshot. The date defaults to today (UTC) and must be after the snapshot's last match date.")
    public Map<String, Object> liveFeatures(
            @RequestParam int p1Id,
            @RequestParam int p2Id,
            @RequestParam String surface,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String matchId
    ) {
        LocalDate matchDate = date != null ? date : LocalDate.now(ZoneOffset.UTC);
        return liveFeatureService.liveFeatures(p1Id, p2Id, surface, matchDate, matchId);
    }

    @GetMapping("/{matchId}")
    @Operation(summary = "Stored feature row", description = "Row of the feature table for a historical match")
    public Map<String, Object> storedRow(@PathVariable String matchId) {
        return liveFeatureService.storedRow(matchId);
    }
}
