package com.graphmem.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for simulation jobs.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "graphmem.simulation")
public class SimulationConfig {

    /**
     * Maximum run time of a job in seconds (0 = no timeout).
     */
    private long timeoutSeconds = 0;

    /**
     * Upper bound accepted for a job's turn limit.
     */
    private int maxTurnLimit = 50;

    /**
     * Threads kept warm for simulation runs. Jobs beyond this number still
     * start at once on additional threads.
     */
    private int workerThreads = 4;

    /**
     * Idle time after which a thread above {@code workerThreads} is released.
     */
    private int idleThreadKeepAliveSeconds = 60;

    /**
     * Attach a graph-delta snapshot to every progress record.
     */
    private boolean deltaSnapshotsEnabled = true;

    /**
     * Interval of the stalled job sweep in milliseconds.
     */
    private long sweepIntervalMs = 1000;
}
