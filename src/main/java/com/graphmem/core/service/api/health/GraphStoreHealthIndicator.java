package com.graphmem.core.service.api.health;

import com.graphmem.core.service.memory.GraphMemoryService;
import com.graphmem.core.service.model.MemoryHealth;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the graph store connection.
 *
 * Reports DEGRADED while messages are served from the fallback cache.
 */
@Component
@RequiredArgsConstructor
public class GraphStoreHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED", "Graph store unreachable, fallback cache active");

    private final GraphMemoryService memoryService;

    @Override
    public Health health() {
        MemoryHealth health = memoryService.health();

        Health.Builder builder = health.storeReachable()
                ? Health.up()
                : Health.status(DEGRADED);

        return builder
                .withDetail("storeReachable", health.storeReachable())
                .withDetail("fallbackActive", health.fallbackActive())
                .withDetail("fallbackSize", health.fallbackSize())
                .build();
    }
}
