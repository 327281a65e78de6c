package com.graphmem.core.service.memory;

/**
 * Health of the graph store connection as seen by the memory service.
 */
public enum ConnectionHealth {

    /** Store reachable; writes go to the store. */
    HEALTHY,

    /** Store unreachable; best-effort writes go to the fallback cache. */
    DEGRADED
}
