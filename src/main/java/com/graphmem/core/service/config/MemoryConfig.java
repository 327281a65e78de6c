package com.graphmem.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Overall configuration of the graph memory layer.
 *
 * Contains the graph store connection, short-term TTL and degraded-mode tuning.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "graphmem")
public class MemoryConfig {

    /**
     * Neo4j connection settings.
     */
    private Neo4j neo4j = new Neo4j();

    /**
     * Short-term memory settings.
     */
    private ShortTerm shortTerm = new ShortTerm();

    /**
     * Store health and reconciliation settings.
     */
    private Store store = new Store();

    @Getter
    @Setter
    public static class Neo4j {

        /**
         * Use Neo4j as the graph store. When disabled an in-memory store is used.
         */
        private boolean enabled = false;

        private String uri = "bolt://localhost:7687";

        private String username = "neo4j";

        private String password = "neo4j";
    }

    @Getter
    @Setter
    public static class ShortTerm {

        /**
         * Time-to-live for short-term messages in minutes.
         */
        private long ttlMinutes = 60;
    }

    @Getter
    @Setter
    public static class Store {

        /**
         * Interval between connectivity probes while degraded.
         */
        private long probeIntervalMs = 5000;

        /**
         * Minimum gap between store attempts from request paths while degraded.
         */
        private long retryBackoffMs = 2000;
    }
}
