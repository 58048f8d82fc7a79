package com.tennis.features.api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI document for the feature service. Tag order here is the order in Swagger UI.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI featureApiDocument(
            @Value("${server.port:8083}") int port,
            FeatureEngineProperties properties
    ) {
        String description = String.format(
                "Point-in-time match features and surface Elo ratings (K=%.0f, start %.0f). "
                        + "Historical rows are stored in '%s'; live requests use the latest published snapshot.",
                properties.getEloKFactor(), properties.getInitialRating(),
                properties.getReplay().getFeatureCollection());

        return new OpenAPI()
                .info(new Info()
                        .title("Tennis Feature API")
                        .version("1.0.0")
                        .description(description))
                .tags(List.of(
                        new Tag().name("Features").description("Point-in-time match features"),
                        new Tag().name("Replay").description("Rebuild trackers and the feature table"),
                        new Tag().name("Health").description("API health and status")))
                .servers(List.of(new Server().url("http://localhost:" + port).description("Local")));
    }
}
