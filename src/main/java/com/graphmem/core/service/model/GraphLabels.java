package com.graphmem.core.service.model;

/**
 * Node labels and relationship types of the memory graph.
 */
public final class GraphLabels {

    public static final String CHAT_SESSION = "ChatSession";
    public static final String SHORT_TERM_MESSAGE = "ShortTermMessage";
    public static final String KNOWLEDGE = "Knowledge";

    public static final String HAS_MESSAGE = "HAS_MESSAGE";
    public static final String NEXT = "NEXT";
    public static final String CONTRIBUTED_TO = "CONTRIBUTED_TO";
    public static final String YIELDED = "YIELDED";

    private GraphLabels() {
    }
}
