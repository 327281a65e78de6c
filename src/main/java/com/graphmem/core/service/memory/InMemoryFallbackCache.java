package com.graphmem.core.service.memory;

import com.graphmem.core.service.config.MetricsConfig;
import com.graphmem.core.service.config.RetentionConfig;
import com.graphmem.core.service.model.ShortTermMessage;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of FallbackCache.
 *
 * Positions come from a single atomic counter, so concurrent appends never
 * share a position. Each session buffer is guarded by its own monitor.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryFallbackCache implements FallbackCache {

    private final RetentionConfig retentionConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final Map<String, SessionBuffer> buffers = new ConcurrentHashMap<>();
    private final AtomicLong positions = new AtomicLong();
    private final AtomicInteger size = new AtomicInteger();

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "graphmem.fallback.size",
                "Number of messages held by the fallback cache",
                this::size
        );
        log.info("InMemoryFallbackCache initialized, max entries: {}",
                retentionConfig.getFallback().getMaxEntries());
    }

    @Override
    public ShortTermMessage append(ShortTermMessage message) {
        ShortTermMessage cached = null;
        while (cached == null) {
            SessionBuffer buffer = buffers.computeIfAbsent(message.sessionId(), id -> new SessionBuffer());
            synchronized (buffer) {
                // a buffer emptied and unregistered concurrently must not receive entries
                if (buffers.get(message.sessionId()) == buffer) {
                    cached = message.withSequence(positions.incrementAndGet(), true);
                    buffer.entries.add(cached);
                }
            }
        }
        size.incrementAndGet();
        enforceBound();

        log.debug("Cached degraded message {} for session {} at position {}",
                cached.id(), cached.sessionId(), cached.sequence());
        return cached;
    }

    @Override
    public List<ShortTermMessage> liveMessages(String sessionId, Instant now) {
        SessionBuffer buffer = buffers.get(sessionId);
        if (buffer == null) return List.of();

        synchronized (buffer) {
            return buffer.entries.stream()
                    .filter(m -> m.isLive(now))
                    .toList();
        }
    }

    @Override
    public List<ShortTermMessage> allLiveMessages(Instant now) {
        List<ShortTermMessage> all = new ArrayList<>();
        for (SessionBuffer buffer : buffers.values()) {
            synchronized (buffer) {
                buffer.entries.stream().filter(m -> m.isLive(now)).forEach(all::add);
            }
        }
        all.sort(Comparator.comparingLong(ShortTermMessage::sequence));
        return all;
    }

    @Override
    public List<String> sessionIds() {
        List<Map.Entry<String, Long>> oldest = new ArrayList<>();
        buffers.forEach((sessionId, buffer) -> oldestPosition(buffer)
                .ifPresent(position -> oldest.add(Map.entry(sessionId, position))));
        return oldest.stream()
                .sorted(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .toList();
    }

    @Override
    public boolean remove(String sessionId, String messageId) {
        SessionBuffer buffer = buffers.get(sessionId);
        if (buffer == null) return false;

        synchronized (buffer) {
            boolean removed = buffer.entries.removeIf(m -> m.id().equals(messageId));
            if (removed) {
                size.decrementAndGet();
            }
            if (buffer.entries.isEmpty()) {
                buffers.remove(sessionId, buffer);
            }
            return removed;
        }
    }

    @Override
    public int size() {
        return size.get();
    }

    @Override
    public void clear() {
        for (String sessionId : List.copyOf(buffers.keySet())) {
            SessionBuffer buffer = buffers.remove(sessionId);
            if (buffer == null) continue;
            synchronized (buffer) {
                size.addAndGet(-buffer.entries.size());
                buffer.entries.clear();
            }
        }
        log.info("Fallback cache cleared");
    }

    @Override
    @Scheduled(fixedDelayString = "${graphmem.retention.fallback.eviction-interval-ms:60000}")
    public int evictExpired() {
        Instant now = clock.instant();
        int evicted = 0;

        for (Map.Entry<String, SessionBuffer> entry : buffers.entrySet()) {
            SessionBuffer buffer = entry.getValue();
            synchronized (buffer) {
                int before = buffer.entries.size();
                buffer.entries.removeIf(m -> !m.isLive(now));
                int removed = before - buffer.entries.size();
                size.addAndGet(-removed);
                evicted += removed;
                if (buffer.entries.isEmpty()) {
                    buffers.remove(entry.getKey(), buffer);
                }
            }
        }

        if (evicted > 0) {
            log.info("Evicted {} expired fallback messages", evicted);
        }
        return evicted;
    }

    // --- Private helpers ---

    private void enforceBound() {
        int maxEntries = retentionConfig.getFallback().getMaxEntries();
        while (size.get() > maxEntries) {
            if (!evictOldest()) {
                return;
            }
        }
    }

    private boolean evictOldest() {
        return sessionIds().stream().findFirst()
                .map(buffers::get)
                .map(this::dropHead)
                .orElse(false);
    }

    private boolean dropHead(SessionBuffer buffer) {
        synchronized (buffer) {
            if (buffer.entries.isEmpty()) return false;
            ShortTermMessage dropped = buffer.entries.remove(0);
            size.decrementAndGet();
            log.warn("Fallback cache full, dropped oldest message {} of session {}",
                    dropped.id(), dropped.sessionId());
            return true;
        }
    }

    private Optional<Long> oldestPosition(SessionBuffer buffer) {
        synchronized (buffer) {
            return buffer.entries.isEmpty()
                    ? Optional.empty()
                    : Optional.of(buffer.entries.get(0).sequence());
        }
    }

    /**
     * Per-session buffer, in append order.
     */
    private static class SessionBuffer {
        final List<ShortTermMessage> entries = new ArrayList<>();
    }
}
