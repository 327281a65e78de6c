package com.graphmem.core.service.model;

import java.time.Instant;

/**
 * A conversation scope grouping messages and derived knowledge.
 */
public record ChatSession(String id, Instant createdAt) {
}
