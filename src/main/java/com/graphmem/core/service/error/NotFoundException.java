package com.graphmem.core.service.error;

/**
 * Thrown for unknown job or session identifiers.
 */
public class NotFoundException extends MemoryServiceException {

    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String kind, String id) {
        super(kind + " " + id + " not found", id, CODE);
    }
}
