package com.graphmem.core.service.memory;

import com.graphmem.core.service.model.ShortTermMessage;

import java.time.Instant;
import java.util.List;

/**
 * Interface for the fallback cache.
 *
 * Bounded, time-expiring in-memory mirror of short-term messages recorded
 * while the graph store is unreachable. Entries stay until they are written
 * through to the store, expire, or are evicted by the size bound.
 */
public interface FallbackCache {

    /**
     * Appends a message, assigning it the next position in the cache's global order.
     *
     * @param message the message to hold
     * @return the cached record, flagged as degraded and carrying its position
     */
    ShortTermMessage append(ShortTermMessage message);

    /**
     * Live messages of a session, in append order.
     *
     * @param sessionId the session identifier
     * @param now reference time for expiry
     * @return ordered live messages
     */
    List<ShortTermMessage> liveMessages(String sessionId, Instant now);

    /**
     * Live messages of all sessions, in append order.
     *
     * @param now reference time for expiry
     * @return ordered live messages
     */
    List<ShortTermMessage> allLiveMessages(Instant now);

    /**
     * Sessions holding cached messages, ordered by their oldest entry.
     *
     * @return session identifiers
     */
    List<String> sessionIds();

    /**
     * Removes a message once it has been written through.
     *
     * @param sessionId the session identifier
     * @param messageId the message identifier
     * @return true if removed
     */
    boolean remove(String sessionId, String messageId);

    /**
     * Gets the number of cached messages.
     *
     * @return cached message count
     */
    int size();

    /**
     * Drops every cached message.
     */
    void clear();

    /**
     * Evicts expired messages.
     *
     * @return number of messages evicted
     */
    int evictExpired();
}
