package com.tennis.features.api.config;

import com.tennis.features.api.dto.ReplayReport;
import com.tennis.features.api.service.ReplayService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ReplayScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReplayScheduler.class);

    private final ReplayService replayService;
    private final FeatureEngineProperties properties;

    public ReplayScheduler(ReplayService replayService, FeatureEngineProperties properties) {
        this.replayService = replayService;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void replayOnStartup() {
        if (!properties.getReplay().isOnStartup()) {
            log.info("Startup replay disabled; live queries unavailable until a replay runs");
            return;
        }
        runFullReplay("startup");
    }

    // "-" disables the trigger
    @Scheduled(cron = "${tennis.features.replay.cron:-}")
    public void scheduledReplay() {
        runFullReplay("scheduled");
    }

    private void runFullReplay(String trigger) {
        try {
            ReplayReport report = replayService.fullReplay();
            log.info("{} replay finished: {} matches up to {}", trigger, report.processed(), report.lastDate());
        } catch (Exception e) {
            log.warn("{} replay failed: {}", trigger, e.getMessage());
        }
    }
}
