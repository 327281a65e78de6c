package com.graphmem.core.service.memory;

import com.graphmem.core.service.config.MemoryConfig;
import com.graphmem.core.service.config.MetricsConfig;
import com.graphmem.core.service.config.RetentionConfig;
import com.graphmem.core.service.error.NoMessagesException;
import com.graphmem.core.service.error.StorageUnavailableException;
import com.graphmem.core.service.generation.Summarizer;
import com.graphmem.core.service.model.DialogueLine;
import com.graphmem.core.service.model.GraphEdge;
import com.graphmem.core.service.model.GraphLabels;
import com.graphmem.core.service.model.GraphNode;
import com.graphmem.core.service.model.GraphView;
import com.graphmem.core.service.model.Knowledge;
import com.graphmem.core.service.model.MemoryHealth;
import com.graphmem.core.service.model.ShortTermMessage;
import com.graphmem.core.service.persistence.BoundQuery;
import com.graphmem.core.service.persistence.GraphStore;
import com.graphmem.core.service.persistence.GraphStoreException;
import com.graphmem.core.service.persistence.MemoryQuery;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrates short-term message ingestion, consolidation into knowledge
 * and graph export.
 *
 * Best-effort operations (recordMessage, history, exportGraph) never fail
 * because of a store outage: they fall back to the FallbackCache and the
 * outage is only visible through {@link #health()}. Durable operations
 * (consolidate, applyDialogue, reset) fail with
 * {@link StorageUnavailableException} instead.
 *
 * A session's pending fallback messages are always written through before
 * any newer message of that session reaches the store, so the NEXT chain
 * keeps insertion order whichever path received each write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphMemoryService {

    private final GraphStore graphStore;
    private final FallbackCache fallbackCache;
    private final StoreConnectionMonitor connection;
    private final SessionLocks sessionLocks;
    private final Summarizer summarizer;
    private final MemoryConfig memoryConfig;
    private final RetentionConfig retentionConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    // ==================== Short-term Memory ====================

    /**
     * Appends a message to the session chain with a fresh TTL.
     *
     * @return the stored message; {@code degraded} is set when it went to the fallback cache
     */
    public ShortTermMessage recordMessage(String sessionId, String role, String content) {
        requireText(sessionId, "sessionId");
        requireText(role, "role");
        if (content == null) {
            throw new IllegalArgumentException("content is required");
        }

        ReentrantLock lock = sessionLocks.forSession(sessionId);
        lock.lock();
        try {
            ShortTermMessage draft = newMessage(sessionId, role, content, clock.instant());
            metricsConfig.getMessagesRecorded().increment();

            if (connection.shouldAttemptStore()) {
                try {
                    flushSession(sessionId);
                    ShortTermMessage stored = appendToStore(draft);
                    onStoreSuccess();
                    log.debug("Recorded message {} for session {} at position {}",
                            stored.id(), sessionId, stored.sequence());
                    return stored;
                } catch (GraphStoreException e) {
                    connection.markDegraded(e);
                }
            }

            metricsConfig.getMessagesDegraded().increment();
            return fallbackCache.append(draft);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Live messages of a session in chain order.
     * Served from the fallback cache while the store is unreachable.
     */
    public List<ShortTermMessage> history(String sessionId) {
        requireText(sessionId, "sessionId");

        ReentrantLock lock = sessionLocks.forSession(sessionId);
        lock.lock();
        try {
            if (connection.shouldAttemptStore()) {
                try {
                    flushSession(sessionId);
                    List<ShortTermMessage> messages = readLiveFromStore(sessionId);
                    onStoreSuccess();
                    return messages;
                } catch (GraphStoreException e) {
                    connection.markDegraded(e);
                }
            }
            return fallbackCache.liveMessages(sessionId, clock.instant());
        } finally {
            lock.unlock();
        }
    }

    // ==================== Consolidation ====================

    /**
     * Condenses the live messages of a session into a Knowledge node linked
     * to every one of them.
     *
     * @throws NoMessagesException if the session has no live messages
     * @throws StorageUnavailableException if the store cannot take the write
     */
    public Knowledge consolidate(String sessionId, String note) {
        requireText(sessionId, "sessionId");
        Timer.Sample sample = Timer.start(metricsConfig.getRegistry());

        try {
            List<ShortTermMessage> sources = selectLiveForConsolidation(sessionId);
            if (sources.isEmpty()) {
                throw new NoMessagesException(sessionId);
            }

            String summary = summarizer.summarize(sources);
            Knowledge knowledge = writeKnowledge(sessionId, summary, note, sources);

            metricsConfig.getConsolidationsCompleted().increment();
            log.info("Consolidated session {} into knowledge {} ({} source messages)",
                    sessionId, knowledge.id(), sources.size());
            return knowledge;
        } finally {
            sample.stop(metricsConfig.getConsolidationTimer());
        }
    }

    /**
     * Durably writes a dialogue and the knowledge derived from it in one
     * store transaction, as if the dialogue had happened live in the session.
     *
     * @throws StorageUnavailableException if the store cannot take the write
     */
    public AppliedDialogue applyDialogue(String sessionId, List<DialogueLine> lines, String summary, String note) {
        return applyDialogue(sessionId, lines, null, null, summary, note);
    }

    /**
     * Same as {@link #applyDialogue(String, List, String, String)} with caller-chosen node identifiers,
     * so the persisted nodes keep the ids of a previously proposed delta.
     *
     * @param messageIds one identifier per line, in order; generated when null
     * @param knowledgeId identifier of the knowledge node; generated when null
     */
    public AppliedDialogue applyDialogue(String sessionId, List<DialogueLine> lines, List<String> messageIds,
                                         String knowledgeId, String summary, String note) {
        requireText(sessionId, "sessionId");
        if (lines == null || lines.isEmpty()) {
            throw new NoMessagesException(sessionId);
        }
        if (messageIds != null && messageIds.size() != lines.size()) {
            throw new IllegalArgumentException("Expected " + lines.size() + " message ids but got " + messageIds.size());
        }
        ensureDurablePath();

        ReentrantLock lock = sessionLocks.forSession(sessionId);
        lock.lock();
        try {
            flushSession(sessionId);

            Instant now = clock.instant();
            List<ShortTermMessage> drafts = new ArrayList<>();
            for (int i = 0; i < lines.size(); i++) {
                DialogueLine line = lines.get(i);
                String messageId = messageIds != null ? messageIds.get(i) : UUID.randomUUID().toString();
                drafts.add(newMessage(messageId, sessionId, line.role(), line.content(),
                        line.timestamp() != null ? line.timestamp() : now, now));
            }
            String knowledgeNodeId = knowledgeId != null ? knowledgeId : UUID.randomUUID().toString();

            List<BoundQuery> statements = new ArrayList<>();
            drafts.forEach(draft -> statements.add(new BoundQuery(MemoryQuery.APPEND_MESSAGE, appendParams(draft))));
            statements.add(new BoundQuery(MemoryQuery.CREATE_KNOWLEDGE,
                    knowledgeParams(sessionId, knowledgeNodeId, summary, note, now, idsOf(drafts))));

            List<List<Map<String, Object>>> results = graphStore.writeAll(statements);
            onStoreSuccess();

            List<ShortTermMessage> stored = new ArrayList<>();
            for (int i = 0; i < drafts.size(); i++) {
                stored.add(messageFromRows(results.get(i), drafts.get(i)));
            }
            var knowledge = new Knowledge(knowledgeNodeId, sessionId, summary, note, now, idsOf(stored));

            metricsConfig.getMessagesRecorded().increment(stored.size());
            log.info("Applied dialogue of {} messages to session {} with knowledge {}",
                    stored.size(), sessionId, knowledgeNodeId);
            return new AppliedDialogue(stored, knowledge);
        } catch (GraphStoreException e) {
            connection.markDegraded(e);
            throw new StorageUnavailableException("Graph store unavailable, dialogue not applied to session " + sessionId, e);
        } finally {
            lock.unlock();
        }
    }

    // ==================== Graph View ====================

    /**
     * Serialized view of the graph, optionally limited to one session.
     *
     * Fallback messages not yet written through are merged in, deduplicated
     * by identifier; the store's version of a node wins.
     */
    public GraphView exportGraph(String sessionId) {
        Map<String, GraphNode> nodes = new LinkedHashMap<>();
        Set<GraphEdge> edges = new LinkedHashSet<>();

        if (connection.shouldAttemptStore()) {
            try {
                readStoreGraph(sessionId, nodes, edges);
                if (onStoreSuccess() > 0) {
                    // messages just written through left the cache
                    nodes.clear();
                    edges.clear();
                    readStoreGraph(sessionId, nodes, edges);
                }
            } catch (GraphStoreException e) {
                connection.markDegraded(e);
                nodes.clear();
                edges.clear();
            }
        }

        mergeFallback(sessionId, nodes, edges);
        return new GraphView(new ArrayList<>(nodes.values()), new ArrayList<>(edges));
    }

    /**
     * Clears all persisted and cached memory. Irreversible.
     *
     * @throws StorageUnavailableException if the store cannot be cleared
     */
    public void reset() {
        try {
            graphStore.write(MemoryQuery.RESET, Map.of());
        } catch (GraphStoreException e) {
            connection.markDegraded(e);
            throw new StorageUnavailableException("Graph store unavailable, reset not applied", e);
        }
        // cleared before leaving DEGRADED so nothing is reconciled into the empty store
        fallbackCache.clear();
        connection.markHealthy();
        log.warn("Memory graph reset by operator");
    }

    public MemoryHealth health() {
        boolean healthy = connection.isHealthy();
        return new MemoryHealth(healthy, !healthy, fallbackCache.size());
    }

    // ==================== Background Maintenance ====================

    /**
     * Probes the store while degraded and writes pending fallback messages
     * through once it is reachable.
     *
     * @return number of messages reconciled
     */
    @Scheduled(fixedDelayString = "${graphmem.store.probe-interval-ms:5000}")
    public int probeAndReconcile() {
        if (!connection.isHealthy()) {
            if (!graphStore.probe()) {
                log.debug("Graph store still unreachable, {} messages in fallback cache", fallbackCache.size());
                return 0;
            }
            connection.markHealthy();
        }
        return reconcile();
    }

    /**
     * Best-effort physical removal of expired messages. Only chain heads that
     * never contributed to knowledge are removed, one head per round.
     *
     * @return number of messages purged
     */
    @Scheduled(fixedDelayString = "${graphmem.retention.messages.purge-interval-ms:300000}")
    public long purgeExpired() {
        if (!connection.isHealthy()) {
            return 0;
        }
        var retention = retentionConfig.getMessages();
        long cutoff = clock.millis() - retention.getPurgeGraceMs();
        long total = 0;

        try {
            for (int round = 0; round < retention.getMaxPurgeRounds(); round++) {
                List<Map<String, Object>> rows = graphStore.write(MemoryQuery.PURGE_EXPIRED, Map.of("cutoff", cutoff));
                long purged = rows.isEmpty() ? 0 : asLong(rows.get(0).get("purged"));
                total += purged;
                if (purged == 0) break;
            }
        } catch (GraphStoreException e) {
            connection.markDegraded(e);
        }

        if (total > 0) {
            log.info("Purged {} expired short-term messages", total);
        }
        return total;
    }

    // ==================== Reconciliation ====================

    /**
     * @return number of fallback messages reconciled because the store just came back
     */
    private int onStoreSuccess() {
        return connection.markHealthy() ? reconcile() : 0;
    }

    /**
     * Writes pending fallback messages through, oldest session first.
     * Sessions busy with another caller are skipped; that caller flushes them itself.
     */
    private int reconcile() {
        int total = 0;
        for (String sessionId : fallbackCache.sessionIds()) {
            ReentrantLock lock = sessionLocks.forSession(sessionId);
            if (!lock.tryLock()) {
                continue;
            }
            try {
                total += flushSession(sessionId);
            } catch (GraphStoreException e) {
                connection.markDegraded(e);
                break;
            } finally {
                lock.unlock();
            }
        }
        if (total > 0) {
            log.info("Reconciled {} fallback messages into the graph store", total);
        }
        return total;
    }

    /**
     * Must be called with the session lock held.
     */
    private int flushSession(String sessionId) {
        List<ShortTermMessage> pending = fallbackCache.liveMessages(sessionId, clock.instant());
        for (ShortTermMessage message : pending) {
            appendToStore(message);
            fallbackCache.remove(sessionId, message.id());
            metricsConfig.getMessagesReconciled().increment();
        }
        if (!pending.isEmpty()) {
            log.debug("Wrote {} fallback messages through for session {}", pending.size(), sessionId);
        }
        return pending.size();
    }

    // ==================== Store Access ====================

    private ShortTermMessage appendToStore(ShortTermMessage message) {
        List<Map<String, Object>> rows = graphStore.write(MemoryQuery.APPEND_MESSAGE, appendParams(message));
        return messageFromRows(rows, message);
    }

    private List<ShortTermMessage> readLiveFromStore(String sessionId) {
        Map<String, Object> params = Map.of("sessionId", sessionId, "now", clock.millis());
        return graphStore.read(MemoryQuery.READ_LIVE_MESSAGES, params).stream()
                .map(row -> ShortTermMessage.fromProperties(propertiesOf(row.get("message"))))
                .toList();
    }

    private List<ShortTermMessage> selectLiveForConsolidation(String sessionId) {
        ensureDurablePath();

        ReentrantLock lock = sessionLocks.forSession(sessionId);
        lock.lock();
        try {
            flushSession(sessionId);
            return readLiveFromStore(sessionId);
        } catch (GraphStoreException e) {
            connection.markDegraded(e);
            throw new StorageUnavailableException("Graph store unavailable, cannot consolidate session " + sessionId, e);
        } finally {
            lock.unlock();
        }
    }

    private Knowledge writeKnowledge(String sessionId, String summary, String note, List<ShortTermMessage> sources) {
        String knowledgeId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        List<String> sourceIds = idsOf(sources);

        List<Map<String, Object>> rows;
        try {
            rows = graphStore.write(MemoryQuery.CREATE_KNOWLEDGE,
                    knowledgeParams(sessionId, knowledgeId, summary, note, now, sourceIds));
            onStoreSuccess();
        } catch (GraphStoreException e) {
            connection.markDegraded(e);
            throw new StorageUnavailableException("Graph store unavailable, knowledge not written for session " + sessionId, e);
        }

        if (rows.isEmpty()) {
            throw new StorageUnavailableException("Knowledge for session " + sessionId
                    + " was not written: source messages are no longer in the store");
        }
        return new Knowledge(knowledgeId, sessionId, summary, note, now, sourceIds);
    }

    private void ensureDurablePath() {
        if (connection.isHealthy()) {
            return;
        }
        if (!graphStore.probe()) {
            throw new StorageUnavailableException("Graph store is unreachable");
        }
        connection.markHealthy();
    }

    private void readStoreGraph(String sessionId, Map<String, GraphNode> nodes, Set<GraphEdge> edges) {
        Map<String, Object> params = new HashMap<>();
        params.put("sessionId", sessionId);

        for (Map<String, Object> row : graphStore.read(MemoryQuery.EXPORT_NODES, params)) {
            String id = (String) row.get("id");
            nodes.put(id, new GraphNode(id, (String) row.get("label"), propertiesOf(row.get("properties"))));
        }
        for (Map<String, Object> row : graphStore.read(MemoryQuery.EXPORT_EDGES, params)) {
            edges.add(new GraphEdge((String) row.get("source"), (String) row.get("target"), (String) row.get("type")));
        }
    }

    private void mergeFallback(String sessionId, Map<String, GraphNode> nodes, Set<GraphEdge> edges) {
        Instant now = clock.instant();
        List<ShortTermMessage> cached = sessionId == null
                ? fallbackCache.allLiveMessages(now)
                : fallbackCache.liveMessages(sessionId, now);
        if (cached.isEmpty()) {
            return;
        }

        Map<String, String> tails = chainTails(nodes.values(), edges);
        for (ShortTermMessage message : cached) {
            if (nodes.containsKey(message.id())) {
                continue;
            }
            nodes.putIfAbsent(message.sessionId(), new GraphNode(message.sessionId(), GraphLabels.CHAT_SESSION,
                    Map.of("id", message.sessionId(), "createdAt", message.createdAt().toEpochMilli())));
            nodes.put(message.id(), new GraphNode(message.id(), GraphLabels.SHORT_TERM_MESSAGE, message.toProperties()));
            edges.add(new GraphEdge(message.sessionId(), message.id(), GraphLabels.HAS_MESSAGE));

            String previous = tails.put(message.sessionId(), message.id());
            if (previous != null) {
                edges.add(new GraphEdge(previous, message.id(), GraphLabels.NEXT));
            }
        }
    }

    /**
     * Last message of each session chain in the exported store view.
     */
    private Map<String, String> chainTails(Iterable<GraphNode> nodes, Set<GraphEdge> edges) {
        Set<String> withSuccessor = new HashSet<>();
        edges.stream()
                .filter(edge -> GraphLabels.NEXT.equals(edge.type()))
                .forEach(edge -> withSuccessor.add(edge.source()));

        Map<String, String> tails = new HashMap<>();
        for (GraphNode node : nodes) {
            if (GraphLabels.SHORT_TERM_MESSAGE.equals(node.label()) && !withSuccessor.contains(node.id())) {
                tails.put((String) node.properties().get("sessionId"), node.id());
            }
        }
        return tails;
    }

    // ==================== Helpers ====================

    private ShortTermMessage newMessage(String sessionId, String role, String content, Instant createdAt) {
        return newMessage(sessionId, role, content, createdAt, createdAt);
    }

    private ShortTermMessage newMessage(String sessionId, String role, String content,
                                        Instant createdAt, Instant ttlStart) {
        return newMessage(UUID.randomUUID().toString(), sessionId, role, content, createdAt, ttlStart);
    }

    private ShortTermMessage newMessage(String id, String sessionId, String role, String content,
                                        Instant createdAt, Instant ttlStart) {
        Duration ttl = Duration.ofMinutes(memoryConfig.getShortTerm().getTtlMinutes());
        return new ShortTermMessage(id, sessionId, role, content, createdAt, ttlStart.plus(ttl), 0, false);
    }

    private static Map<String, Object> appendParams(ShortTermMessage message) {
        Map<String, Object> params = new HashMap<>();
        params.put("sessionId", message.sessionId());
        params.put("messageId", message.id());
        params.put("role", message.role());
        params.put("content", message.content());
        params.put("createdAt", message.createdAt().toEpochMilli());
        params.put("expiresAt", message.expiresAt().toEpochMilli());
        params.put("degraded", message.degraded());
        return params;
    }

    private static Map<String, Object> knowledgeParams(String sessionId, String knowledgeId, String summary,
                                                       String note, Instant createdAt, List<String> messageIds) {
        Map<String, Object> params = new HashMap<>();
        params.put("sessionId", sessionId);
        params.put("knowledgeId", knowledgeId);
        params.put("summary", summary);
        params.put("note", note);
        params.put("createdAt", createdAt.toEpochMilli());
        params.put("messageIds", messageIds);
        return params;
    }

    /**
     * An empty result means the message already existed (idempotent write-through).
     */
    private static ShortTermMessage messageFromRows(List<Map<String, Object>> rows, ShortTermMessage fallback) {
        if (rows.isEmpty()) {
            return fallback;
        }
        return ShortTermMessage.fromProperties(propertiesOf(rows.get(0).get("message")));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> propertiesOf(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private static List<String> idsOf(List<ShortTermMessage> messages) {
        return messages.stream().map(ShortTermMessage::id).toList();
    }

    private static long asLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
