package com.graphmem.core.service.model;

/**
 * Serialized relationship between two node identifiers.
 */
public record GraphEdge(String source, String target, String type) {
}
