package com.graphmem.core.service.persistence;

import java.util.List;
import java.util.Map;

/**
 * Thin transactional interface to the property-graph database.
 *
 * Only GraphMemoryService talks to the store.
 */
public interface GraphStore {

    /**
     * Runs a write statement in its own transaction.
     *
     * @param query the statement
     * @param params statement parameters
     * @return result rows
     * @throws GraphStoreException when the store is unreachable or the statement fails
     */
    List<Map<String, Object>> write(MemoryQuery query, Map<String, Object> params);

    /**
     * Runs a read statement.
     *
     * @param query the statement
     * @param params statement parameters
     * @return result rows
     * @throws GraphStoreException when the store is unreachable or the statement fails
     */
    List<Map<String, Object>> read(MemoryQuery query, Map<String, Object> params);

    /**
     * Runs several write statements in one transaction; either all apply or none does.
     *
     * @param statements statements in execution order
     * @return result rows per statement, in the same order
     * @throws GraphStoreException when the transaction cannot be committed
     */
    List<List<Map<String, Object>>> writeAll(List<BoundQuery> statements);

    /**
     * Checks connectivity.
     *
     * @return true if the store is reachable
     */
    boolean probe();
}
