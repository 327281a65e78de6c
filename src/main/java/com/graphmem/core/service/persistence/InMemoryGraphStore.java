package com.graphmem.core.service.persistence;

import com.graphmem.core.service.config.MetricsConfig;
import com.graphmem.core.service.model.GraphLabels;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory implementation of GraphStore.
 *
 * Interprets the statement catalog with the same semantics as the Cypher
 * text. Used when Neo4j is disabled (local development, tests). All
 * operations are serialized on the store monitor; {@link #writeAll} restores
 * the previous state if any statement fails.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "graphmem.neo4j", name = "enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryGraphStore implements GraphStore {

    private final MetricsConfig metricsConfig;

    private Map<String, StoredNode> nodes = new LinkedHashMap<>();
    private List<StoredEdge> edges = new ArrayList<>();

    // ==================== Lifecycle ====================

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "graphmem.store.nodes.count",
                "Number of nodes in the in-memory graph store",
                this::nodeCount
        );
        log.info("InMemoryGraphStore initialized (Neo4j disabled)");
    }

    // ==================== GraphStore Interface ====================

    @Override
    public synchronized List<Map<String, Object>> write(MemoryQuery query, Map<String, Object> params) {
        requireWrite(query, true);
        return execute(query, params);
    }

    @Override
    public synchronized List<Map<String, Object>> read(MemoryQuery query, Map<String, Object> params) {
        requireWrite(query, false);
        return execute(query, params);
    }

    @Override
    public synchronized List<List<Map<String, Object>>> writeAll(List<BoundQuery> statements) {
        var nodesBefore = copyNodes();
        var edgesBefore = new ArrayList<>(edges);
        try {
            List<List<Map<String, Object>>> results = new ArrayList<>();
            for (BoundQuery statement : statements) {
                requireWrite(statement.query(), true);
                results.add(execute(statement.query(), statement.params()));
            }
            return results;
        } catch (RuntimeException e) {
            nodes = nodesBefore;
            edges = edgesBefore;
            throw e instanceof GraphStoreException gse ? gse
                    : new GraphStoreException("Transaction rolled back: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean probe() {
        return true;
    }

    public synchronized int nodeCount() {
        return nodes.size();
    }

    // ==================== Statement Dispatch ====================

    private List<Map<String, Object>> execute(MemoryQuery query, Map<String, Object> params) {
        return switch (query) {
            case APPEND_MESSAGE -> appendMessage(params);
            case READ_LIVE_MESSAGES -> readLiveMessages(params);
            case CREATE_KNOWLEDGE -> createKnowledge(params);
            case EXPORT_NODES -> exportNodes(params);
            case EXPORT_EDGES -> exportEdges(params);
            case PURGE_EXPIRED -> purgeExpired(params);
            case RESET -> reset();
        };
    }

    private List<Map<String, Object>> appendMessage(Map<String, Object> params) {
        String sessionId = (String) params.get("sessionId");
        String messageId = (String) params.get("messageId");

        StoredNode session = nodes.computeIfAbsent(sessionId, id -> newNode(GraphLabels.CHAT_SESSION,
                properties("id", id, "createdAt", params.get("createdAt"))));
        if (nodes.containsKey(messageId)) {
            return List.of();
        }

        Optional<StoredNode> tail = findTail(sessionId);
        long sequence = tail.map(t -> asLong(t.properties().get("sequence")) + 1).orElse(0L);

        StoredNode message = newNode(GraphLabels.SHORT_TERM_MESSAGE, properties(
                "id", messageId,
                "sessionId", sessionId,
                "role", params.get("role"),
                "content", params.get("content"),
                "createdAt", params.get("createdAt"),
                "expiresAt", params.get("expiresAt"),
                "sequence", sequence,
                "degraded", params.get("degraded")));
        nodes.put(messageId, message);
        edges.add(new StoredEdge(idOf(session), messageId, GraphLabels.HAS_MESSAGE));
        tail.ifPresent(t -> edges.add(new StoredEdge(idOf(t), messageId, GraphLabels.NEXT)));

        return List.of(row("message", new HashMap<>(message.properties())));
    }

    private List<Map<String, Object>> readLiveMessages(Map<String, Object> params) {
        String sessionId = (String) params.get("sessionId");
        long now = asLong(params.get("now"));

        return sessionMessages(sessionId).stream()
                .filter(m -> asLong(m.properties().get("expiresAt")) >= now)
                .sorted(Comparator.comparingLong(m -> asLong(m.properties().get("sequence"))))
                .map(m -> row("message", new HashMap<>(m.properties())))
                .toList();
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> createKnowledge(Map<String, Object> params) {
        String sessionId = (String) params.get("sessionId");
        List<String> messageIds = (List<String>) params.get("messageIds");
        if (!nodes.containsKey(sessionId) || messageIds == null || messageIds.isEmpty()) {
            return List.of();
        }

        List<String> sources = messageIds.stream()
                .filter(id -> isMessageOfSession(id, sessionId))
                .distinct()
                .toList();
        if (sources.size() != messageIds.size()) {
            return List.of();
        }

        String knowledgeId = (String) params.get("knowledgeId");
        nodes.put(knowledgeId, newNode(GraphLabels.KNOWLEDGE, properties(
                "id", knowledgeId,
                "sessionId", sessionId,
                "summary", params.get("summary"),
                "note", params.get("note"),
                "createdAt", params.get("createdAt"))));
        edges.add(new StoredEdge(sessionId, knowledgeId, GraphLabels.YIELDED));
        sources.forEach(id -> edges.add(new StoredEdge(id, knowledgeId, GraphLabels.CONTRIBUTED_TO)));

        return List.of(properties("id", knowledgeId, "contributed", (long) sources.size()));
    }

    private List<Map<String, Object>> exportNodes(Map<String, Object> params) {
        String sessionId = (String) params.get("sessionId");
        return nodes.values().stream()
                .filter(n -> sessionId == null
                        || sessionId.equals(n.properties().get("sessionId"))
                        || sessionId.equals(idOf(n)))
                .map(n -> properties(
                        "id", idOf(n),
                        "label", n.label(),
                        "properties", new HashMap<>(n.properties())))
                .toList();
    }

    private List<Map<String, Object>> exportEdges(Map<String, Object> params) {
        String sessionId = (String) params.get("sessionId");
        return edges.stream()
                .filter(e -> sessionId == null || sessionId.equals(sessionScopeOf(e.source())))
                .map(e -> properties("source", e.source(), "target", e.target(), "type", e.type()))
                .toList();
    }

    private List<Map<String, Object>> purgeExpired(Map<String, Object> params) {
        long cutoff = asLong(params.get("cutoff"));
        List<String> purged = nodes.values().stream()
                .filter(n -> GraphLabels.SHORT_TERM_MESSAGE.equals(n.label()))
                .filter(n -> asLong(n.properties().get("expiresAt")) < cutoff)
                .map(this::idOf)
                .filter(id -> !hasIncoming(id, GraphLabels.NEXT))
                .filter(id -> !hasOutgoing(id, GraphLabels.CONTRIBUTED_TO))
                .toList();

        purged.forEach(this::detachDelete);
        return List.of(properties("purged", (long) purged.size()));
    }

    private List<Map<String, Object>> reset() {
        int removed = nodes.size();
        nodes = new LinkedHashMap<>();
        edges = new ArrayList<>();
        log.info("In-memory graph store reset ({} nodes removed)", removed);
        return List.of();
    }

    // ==================== Graph Helpers ====================

    private Collection<StoredNode> sessionMessages(String sessionId) {
        return edges.stream()
                .filter(e -> e.source().equals(sessionId) && GraphLabels.HAS_MESSAGE.equals(e.type()))
                .map(e -> nodes.get(e.target()))
                .filter(Objects::nonNull)
                .toList();
    }

    private Optional<StoredNode> findTail(String sessionId) {
        return sessionMessages(sessionId).stream()
                .filter(m -> !hasOutgoing(idOf(m), GraphLabels.NEXT))
                .findFirst();
    }

    private boolean isMessageOfSession(String id, String sessionId) {
        StoredNode node = nodes.get(id);
        return node != null
                && GraphLabels.SHORT_TERM_MESSAGE.equals(node.label())
                && sessionId.equals(node.properties().get("sessionId"));
    }

    private String sessionScopeOf(String nodeId) {
        StoredNode node = nodes.get(nodeId);
        if (node == null) return null;
        Object sessionId = node.properties().get("sessionId");
        return sessionId != null ? (String) sessionId : nodeId;
    }

    private boolean hasOutgoing(String id, String type) {
        return edges.stream().anyMatch(e -> e.source().equals(id) && e.type().equals(type));
    }

    private boolean hasIncoming(String id, String type) {
        return edges.stream().anyMatch(e -> e.target().equals(id) && e.type().equals(type));
    }

    private void detachDelete(String id) {
        nodes.remove(id);
        edges.removeIf(e -> e.source().equals(id) || e.target().equals(id));
    }

    private Map<String, StoredNode> copyNodes() {
        var copy = new LinkedHashMap<String, StoredNode>();
        nodes.forEach((id, node) -> copy.put(id, newNode(node.label(), node.properties())));
        return copy;
    }

    private String idOf(StoredNode node) {
        return (String) node.properties().get("id");
    }

    private static void requireWrite(MemoryQuery query, boolean write) {
        if (query.isWrite() != write) {
            throw new GraphStoreException(query.name() + (write ? " is not a write statement" : " is not a read statement"));
        }
    }

    private static StoredNode newNode(String label, Map<String, Object> properties) {
        return new StoredNode(label, new LinkedHashMap<>(properties));
    }

    /**
     * Builds a property map from key/value pairs, dropping null values like Neo4j does.
     */
    private static Map<String, Object> properties(Object... keyValues) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return map;
    }

    private static Map<String, Object> row(String column, Object value) {
        var row = new LinkedHashMap<String, Object>();
        row.put(column, value);
        return row;
    }

    private static long asLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }

    // ==================== Inner Types ====================

    private record StoredNode(String label, Map<String, Object> properties) {}

    private record StoredEdge(String source, String target, String type) {}
}
