package com.graphmem.core.service.error;

/**
 * Thrown when a durable write is required but the graph store cannot be reached.
 */
public class StorageUnavailableException extends MemoryServiceException {

    public static final String CODE = "STORAGE_UNAVAILABLE";

    public StorageUnavailableException(String message) {
        super(message, CODE);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, null, CODE, cause);
    }
}
