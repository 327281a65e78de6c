package com.graphmem.core.service.memory;

import com.graphmem.core.service.config.MemoryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Two-state connection model of the graph store.
 *
 * {@code HEALTHY -> DEGRADED} on any probe failure or store exception,
 * {@code DEGRADED -> HEALTHY} on the next successful probe or operation.
 * While degraded, request paths only retry the store once the backoff has
 * elapsed since the previous attempt.
 */
@Slf4j
@Component
public class StoreConnectionMonitor {

    private final AtomicReference<ConnectionHealth> state = new AtomicReference<>(ConnectionHealth.HEALTHY);
    private final AtomicLong lastAttemptMs = new AtomicLong();
    private final Clock clock;
    private final long retryBackoffMs;

    public StoreConnectionMonitor(MemoryConfig memoryConfig, Clock clock) {
        this.clock = clock;
        this.retryBackoffMs = memoryConfig.getStore().getRetryBackoffMs();
    }

    public ConnectionHealth state() {
        return state.get();
    }

    public boolean isHealthy() {
        return state.get() == ConnectionHealth.HEALTHY;
    }

    /**
     * Whether a best-effort operation should try the store now.
     * Always true while healthy; while degraded at most once per backoff window.
     */
    public boolean shouldAttemptStore() {
        if (isHealthy()) {
            return true;
        }
        long now = clock.millis();
        long last = lastAttemptMs.get();
        return now - last >= retryBackoffMs && lastAttemptMs.compareAndSet(last, now);
    }

    /**
     * Records a store failure.
     *
     * @return true if this call moved the connection to DEGRADED
     */
    public boolean markDegraded(Throwable cause) {
        lastAttemptMs.set(clock.millis());
        boolean transitioned = state.compareAndSet(ConnectionHealth.HEALTHY, ConnectionHealth.DEGRADED);
        if (transitioned) {
            log.warn("Graph store unreachable, switching to fallback cache: {}", cause.getMessage());
        }
        return transitioned;
    }

    /**
     * Records a successful store interaction.
     *
     * @return true if this call moved the connection back to HEALTHY
     */
    public boolean markHealthy() {
        boolean transitioned = state.compareAndSet(ConnectionHealth.DEGRADED, ConnectionHealth.HEALTHY);
        if (transitioned) {
            log.info("Graph store reachable again, reconciling fallback cache");
        }
        return transitioned;
    }
}
