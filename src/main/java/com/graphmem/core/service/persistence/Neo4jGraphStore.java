package com.graphmem.core.service.persistence;

import com.graphmem.core.service.config.MemoryConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * GraphStore backed by a Neo4j database through the official Java driver.
 *
 * Routing URIs ({@code neo4j://}) are rewritten to direct {@code bolt://}
 * connections because single-instance deployments expose no routing table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "graphmem.neo4j", name = "enabled", havingValue = "true")
public class Neo4jGraphStore implements GraphStore {

    private static final int CONNECTION_TIMEOUT_SECONDS = 5;
    private static final int ACQUISITION_TIMEOUT_SECONDS = 10;
    private static final int MAX_RETRY_SECONDS = 2;

    private final MemoryConfig memoryConfig;

    private Driver driver;

    @PostConstruct
    void init() {
        var neo4j = memoryConfig.getNeo4j();
        String uri = normalizeUri(neo4j.getUri());
        driver = GraphDatabase.driver(uri,
                AuthTokens.basic(neo4j.getUsername(), neo4j.getPassword()),
                driverConfig());
        log.info("Neo4j graph store initialized for {} (reachable: {})", uri, probe());
    }

    @PreDestroy
    void cleanup() {
        if (driver != null) {
            driver.close();
            log.info("Neo4j driver closed");
        }
    }

    // ==================== GraphStore Interface ====================

    @Override
    public List<Map<String, Object>> write(MemoryQuery query, Map<String, Object> params) {
        try (Session session = driver.session()) {
            return session.executeWrite(tx -> tx.run(query.cypher(), params).list(Record::asMap));
        } catch (RuntimeException e) {
            throw storeFailure(query, e);
        }
    }

    @Override
    public List<Map<String, Object>> read(MemoryQuery query, Map<String, Object> params) {
        try (Session session = driver.session()) {
            return session.executeRead(tx -> tx.run(query.cypher(), params).list(Record::asMap));
        } catch (RuntimeException e) {
            throw storeFailure(query, e);
        }
    }

    @Override
    public List<List<Map<String, Object>>> writeAll(List<BoundQuery> statements) {
        try (Session session = driver.session()) {
            return session.executeWrite(tx -> {
                List<List<Map<String, Object>>> results = new ArrayList<>();
                for (BoundQuery statement : statements) {
                    results.add(tx.run(statement.query().cypher(), statement.params()).list(Record::asMap));
                }
                return results;
            });
        } catch (RuntimeException e) {
            throw new GraphStoreException("Transaction of " + statements.size()
                    + " statements failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean probe() {
        try {
            driver.verifyConnectivity();
            return true;
        } catch (RuntimeException e) {
            log.debug("Neo4j probe failed: {}", e.getMessage());
            return false;
        }
    }

    // ==================== Helpers ====================

    /**
     * Returns a bolt URI suitable for direct connections.
     */
    static String normalizeUri(String uri) {
        if (uri.startsWith("neo4j+ssc://")) {
            return "bolt+ssc://" + uri.substring("neo4j+ssc://".length());
        }
        if (uri.startsWith("neo4j+s://")) {
            return "bolt+s://" + uri.substring("neo4j+s://".length());
        }
        if (uri.startsWith("neo4j://")) {
            return "bolt://" + uri.substring("neo4j://".length());
        }
        return uri;
    }

    private static Config driverConfig() {
        return Config.builder()
                .withConnectionTimeout(CONNECTION_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .withConnectionAcquisitionTimeout(ACQUISITION_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .withMaxTransactionRetryTime(MAX_RETRY_SECONDS, TimeUnit.SECONDS)
                .build();
    }

    private GraphStoreException storeFailure(MemoryQuery query, RuntimeException e) {
        return new GraphStoreException("Neo4j " + query.name() + " failed: " + e.getMessage(), e);
    }
}
