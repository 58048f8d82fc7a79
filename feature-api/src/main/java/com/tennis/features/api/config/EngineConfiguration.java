package com.tennis.features.api.config;

import com.tennis.features.engine.config.EngineConfig;
import com.tennis.features.engine.feature.FeatureAssembler;
import com.tennis.features.engine.live.LiveQueryAdapter;
import com.tennis.features.engine.replay.ChronologicalOrchestrator;
import com.tennis.features.engine.replay.MatchStreamPreparer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free engine into the application context.
 */
@Configuration
public class EngineConfiguration {

    @Bean
    public EngineConfig engineConfig(FeatureEngineProperties properties) {
        return properties.toEngineConfig();
    }

    @Bean
    public FeatureAssembler featureAssembler() {
        return new FeatureAssembler();
    }

    @Bean
    public ChronologicalOrchestrator chronologicalOrchestrator(EngineConfig engineConfig, FeatureAssembler assembler) {
        return new ChronologicalOrchestrator(engineConfig, assembler);
    }

    @Bean
    public MatchStreamPreparer matchStreamPreparer() {
        return new MatchStreamPreparer();
    }

    @Bean
    public LiveQueryAdapter liveQueryAdapter(FeatureAssembler assembler) {
        return new LiveQueryAdapter(assembler);
    }
}
