package com.tennis.features.api.controller;

import com.tennis.features.api.dto.ReplayReport;
import com.tennis.features.api.exception.ReplayInProgressException;
import com.tennis.features.api.service.LiveFeatureService;
import com.tennis.features.api.service.ReplayService;
import com.tennis.features.engine.replay.ReplayAbortedException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReplayController.class)
class ReplayControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReplayService replayService;

    @MockBean
    private LiveFeatureService liveFeatureService;

    private static ReplayReport report(ReplayReport.Mode mode, int processed) {
        return new ReplayReport(mode, processed, 2, 1, 0, 40,
                LocalDate.of(2000, 1, 3), LocalDate.of(2024, 5, 1), 1234, Instant.parse("2024-05-02T04:30:00Z"));
    }

    @Test
    void fullReplayReturnsReport() throws Exception {
        when(replayService.fullReplay()).thenReturn(report(ReplayReport.Mode.FULL, 950));

        mockMvc.perform(post("/api/replay"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("FULL"))
                .andExpect(jsonPath("$.processed").value(950))
                .andExpect(jsonPath("$.dropped").value(2))
                .andExpect(jsonPath("$.lastDate").value("2024-05-01"));
    }

    @Test
    void concurrentReplayIsConflict() throws Exception {
        when(replayService.incrementalReplay()).thenThrow(new ReplayInProgressException());

        mockMvc.perform(post("/api/replay/incremental"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONFLICT"));
    }

    @Test
    void abortedReplayIsServerError() throws Exception {
        when(replayService.fullReplay()).thenThrow(new ReplayAbortedException("out of order", "m9", 8));

        mockMvc.perform(post("/api/replay"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("REPLAY_ABORTED"));
    }

    @Test
    void statusCombinesSnapshotAndLastReport() throws Exception {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("snapshotInstalled", true);
        snapshot.put("appliedMatches", 950);
        when(liveFeatureService.snapshotStatus()).thenReturn(snapshot);
        when(replayService.isRunning()).thenReturn(false);
        when(replayService.getLastReport()).thenReturn(Optional.of(report(ReplayReport.Mode.INCREMENTAL, 4)));

        mockMvc.perform(get("/api/replay/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.snapshotInstalled").value(true))
                .andExpect(jsonPath("$.running").value(false))
                .andExpect(jsonPath("$.lastReport.mode").value("INCREMENTAL"));
    }
}
