package com.graphmem.core.service.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Time-bounded raw exchange record. Immutable once written.
 *
 * {@code sequence} is the chain position inside the graph store, or the
 * global cache position while the record only lives in the fallback cache
 * ({@code degraded = true}).
 */
public record ShortTermMessage(
        String id,
        String sessionId,
        String role,
        String content,
        Instant createdAt,
        Instant expiresAt,
        long sequence,
        boolean degraded
) implements ConversationLine {

    public boolean isLive(Instant now) {
        return expiresAt == null || !expiresAt.isBefore(now);
    }

    public ShortTermMessage withSequence(long newSequence, boolean isDegraded) {
        return new ShortTermMessage(id, sessionId, role, content, createdAt, expiresAt, newSequence, isDegraded);
    }

    public Map<String, Object> toProperties() {
        var properties = new LinkedHashMap<String, Object>();
        properties.put("id", id);
        properties.put("sessionId", sessionId);
        properties.put("role", role);
        properties.put("content", content);
        properties.put("createdAt", createdAt.toEpochMilli());
        properties.put("expiresAt", expiresAt != null ? expiresAt.toEpochMilli() : null);
        properties.put("sequence", sequence);
        properties.put("degraded", degraded);
        return properties;
    }

    public static ShortTermMessage fromProperties(Map<String, Object> properties) {
        return new ShortTermMessage(
                (String) properties.get("id"),
                (String) properties.get("sessionId"),
                (String) properties.get("role"),
                (String) properties.get("content"),
                toInstant(properties.get("createdAt")),
                toInstant(properties.get("expiresAt")),
                toLong(properties.get("sequence")),
                Boolean.TRUE.equals(properties.get("degraded"))
        );
    }

    private static Instant toInstant(Object epochMs) {
        return epochMs instanceof Number number ? Instant.ofEpochMilli(number.longValue()) : null;
    }

    private static long toLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }
}
