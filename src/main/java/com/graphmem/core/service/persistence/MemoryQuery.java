package com.graphmem.core.service.persistence;

/**
 * Catalog of the Cypher statements issued against the graph store.
 *
 * Timestamps are stored as epoch milliseconds. Every statement returns plain
 * maps and scalars so that results do not depend on driver node types.
 */
public enum MemoryQuery {

    /**
     * Appends a message to the tail of its session chain. Returns no row when
     * a message with the same id already exists, which makes write-through of
     * fallback records idempotent.
     */
    APPEND_MESSAGE(true, """
            MERGE (s:ChatSession {id: $sessionId})
              ON CREATE SET s.createdAt = $createdAt
            WITH s
            OPTIONAL MATCH (existing:ShortTermMessage {id: $messageId})
            WITH s, existing
            WHERE existing IS NULL
            OPTIONAL MATCH (s)-[:HAS_MESSAGE]->(tail:ShortTermMessage)
            WHERE NOT (tail)-[:NEXT]->()
            CREATE (m:ShortTermMessage {
                id: $messageId,
                sessionId: $sessionId,
                role: $role,
                content: $content,
                createdAt: $createdAt,
                expiresAt: $expiresAt,
                sequence: coalesce(tail.sequence + 1, 0),
                degraded: $degraded
            })
            CREATE (s)-[:HAS_MESSAGE]->(m)
            FOREACH (t IN CASE WHEN tail IS NULL THEN [] ELSE [tail] END | CREATE (t)-[:NEXT]->(m))
            RETURN properties(m) AS message
            """),

    READ_LIVE_MESSAGES(false, """
            MATCH (s:ChatSession {id: $sessionId})-[:HAS_MESSAGE]->(m:ShortTermMessage)
            WHERE m.expiresAt >= $now
            RETURN properties(m) AS message
            ORDER BY m.sequence ASC
            """),

    /**
     * Creates a knowledge node only if every listed source message exists.
     */
    CREATE_KNOWLEDGE(true, """
            MATCH (s:ChatSession {id: $sessionId})
            MATCH (m:ShortTermMessage)
            WHERE m.id IN $messageIds AND m.sessionId = $sessionId
            WITH s, collect(m) AS sources
            WHERE size(sources) = size($messageIds) AND size(sources) > 0
            CREATE (k:Knowledge {
                id: $knowledgeId,
                sessionId: $sessionId,
                summary: $summary,
                note: $note,
                createdAt: $createdAt
            })
            CREATE (s)-[:YIELDED]->(k)
            FOREACH (m IN sources | CREATE (m)-[:CONTRIBUTED_TO]->(k))
            RETURN k.id AS id, size(sources) AS contributed
            """),

    EXPORT_NODES(false, """
            MATCH (n)
            WHERE $sessionId IS NULL OR n.sessionId = $sessionId OR n.id = $sessionId
            RETURN n.id AS id, labels(n)[0] AS label, properties(n) AS properties
            ORDER BY label, coalesce(n.sequence, 0), n.id
            """),

    EXPORT_EDGES(false, """
            MATCH (a)-[r]->(b)
            WHERE $sessionId IS NULL OR coalesce(a.sessionId, a.id) = $sessionId
            RETURN a.id AS source, b.id AS target, type(r) AS type
            """),

    /**
     * Removes expired chain heads that never contributed to knowledge.
     */
    PURGE_EXPIRED(true, """
            MATCH (m:ShortTermMessage)
            WHERE m.expiresAt < $cutoff
              AND NOT ()-[:NEXT]->(m)
              AND NOT (m)-[:CONTRIBUTED_TO]->()
            DETACH DELETE m
            RETURN count(*) AS purged
            """),

    RESET(true, """
            MATCH (n)
            DETACH DELETE n
            """);

    private final boolean write;
    private final String cypher;

    MemoryQuery(boolean write, String cypher) {
        this.write = write;
        this.cypher = cypher;
    }

    public boolean isWrite() {
        return write;
    }

    public String cypher() {
        return cypher;
    }
}
