package com.graphmem.core.service.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serialized graph node: identifier, primary label and property map.
 */
public record GraphNode(String id, String label, Map<String, Object> properties) {

    public GraphNode {
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }
}
