package com.graphmem.core.service.model;

/**
 * Connection health of the memory layer.
 */
public record MemoryHealth(boolean storeReachable, boolean fallbackActive, int fallbackSize) {
}
