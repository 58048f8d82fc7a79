package com.tennis.features.api.controller;

import com.tennis.features.api.dto.ReplayReport;
import com.tennis.features.api.service.LiveFeatureService;
import com.tennis.features.api.service.ReplayService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/replay")
@Tag(name = "Replay", description = "Rebuild trackers and the feature table")
public class ReplayController {

    private final ReplayService replayService;
    private final LiveFeatureService liveFeatureService;

    public ReplayController(ReplayService replayService, LiveFeatureService liveFeatureService) {
        this.replayService = replayService;
        this.liveFeatureService = liveFeatureService;
    }

    @PostMapping
    @Operation(summary = "Full replay", description = "Replay the whole match history, rewrite the feature table and publish a new snapshot")
    public ReplayReport fullReplay() {
        return replayService.fullReplay();
    }

    @PostMapping("/incremental")
    @Operation(summary = "Incremental replay", description = "Apply matches dated after the current snapshot")
    public ReplayReport incrementalReplay() {
        return replayService.incrementalReplay();
    }

    @GetMapping("/status")
    @Operation(summary = "Replay status", description = "Current snapshot and the last published replay")
    public Map<String, Object> status() {
        Map<String, Object> status = liveFeatureService.snapshotStatus();
        status.put("running", replayService.isRunning());
        replayService.getLastReport().ifPresent(report -> status.put("lastReport", report));
        return status;
    }
}
