package com.graphmem.core.service.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI metadata. Tag names match the {@code @Tag} annotations on the controllers.
 */
@Configuration
public class OpenApiConfig {

    @Value("${spring.application.name:graph-memory-service}")
    private String applicationName;

    @Value("${server.port:8080}")
    private int serverPort;

    @Bean
    public OpenAPI graphMemoryServiceOpenAPI(SimulationConfig simulationConfig, MemoryConfig memoryConfig) {
        String description = "Conversation memory kept as a property graph. Chat turns become "
                + "ShortTermMessage chains (TTL " + memoryConfig.getShortTerm().getTtlMinutes() + " min) that "
                + "keep working on a fallback cache while the graph store is down. Consolidation turns "
                + "them into Knowledge nodes. Simulations run up to " + simulationConfig.getMaxTurnLimit()
                + " turns in the background and are committed by an operator.";

        return new OpenAPI()
                .info(new Info()
                        .title("Graph Memory Service API")
                        .description(description)
                        .version("1.0.0"))
                .tags(List.of(
                        new Tag().name("Chat").description("Live conversation recorded into short-term memory"),
                        new Tag().name("Memory").description("Short-term history, consolidation and store health"),
                        new Tag().name("Graph").description("Export and confirmed reset of the memory graph"),
                        new Tag().name("Simulation").description("Polled dialogue jobs and their one-time commit")))
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description(applicationName + " (local)")));
    }
}
