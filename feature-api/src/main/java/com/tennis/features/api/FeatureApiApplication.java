package com.tennis.features.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;
import com.tennis.features.api.config.FeatureEngineProperties;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(FeatureEngineProperties.class)
public class FeatureApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeatureApiApplication.class, args);
    }
}
