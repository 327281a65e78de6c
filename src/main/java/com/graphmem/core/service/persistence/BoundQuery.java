package com.graphmem.core.service.persistence;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A catalog statement together with its parameters.
 */
public record BoundQuery(MemoryQuery query, Map<String, Object> params) {

    public BoundQuery {
        // HashMap: Cypher parameters may be null
        params = Collections.unmodifiableMap(new HashMap<>(params));
    }
}
