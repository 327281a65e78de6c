package com.graphmem.core.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.neo4j.Neo4jAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Graph Memory Service Application - Entry point for the Spring Boot application.
 *
 * Keeps conversational memory as a graph:
 * - Records chat messages as short-term memory, falling back to an in-memory cache during store outages
 * - Consolidates short-term memory into knowledge nodes on operator request
 * - Runs multi-agent dialogue simulations whose results are committed on demand
 *
 * The Neo4j driver is managed by the graph store itself, so Boot's Neo4j auto-configuration is excluded.
 */
@SpringBootApplication(exclude = Neo4jAutoConfiguration.class)
@EnableScheduling
@ConfigurationPropertiesScan("com.graphmem.core.service.config")
public class GraphMemoryServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GraphMemoryServiceApplication.class, args);
    }
}
