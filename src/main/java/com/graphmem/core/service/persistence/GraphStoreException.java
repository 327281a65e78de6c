package com.graphmem.core.service.persistence;

/**
 * Failure talking to the graph store: connectivity loss or a failed statement.
 */
public class GraphStoreException extends RuntimeException {

    public GraphStoreException(String message) {
        super(message);
    }

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
