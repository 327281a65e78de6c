package com.graphmem.core.service.error;

/**
 * Thrown when an operation is not valid for the current status of a job.
 */
public class InvalidStateException extends MemoryServiceException {

    public static final String CODE = "INVALID_STATE";

    public InvalidStateException(String message, String entityId) {
        super(message, entityId, CODE);
    }
}
