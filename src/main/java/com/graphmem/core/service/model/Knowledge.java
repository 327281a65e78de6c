package com.graphmem.core.service.model;

import java.time.Instant;
import java.util.List;

/**
 * Durable knowledge node produced by consolidation.
 *
 * {@code sourceMessageIds} lists every short-term message linked to it
 * through CONTRIBUTED_TO; it is never empty.
 */
public record Knowledge(
        String id,
        String sessionId,
        String summary,
        String note,
        Instant createdAt,
        List<String> sourceMessageIds
) {

    public Knowledge {
        sourceMessageIds = List.copyOf(sourceMessageIds);
    }
}
