package com.graphmem.core.service.error;

/**
 * Base exception for memory and simulation operations.
 *
 * Carries a stable error code that the API layer maps to a response status.
 */
public class MemoryServiceException extends RuntimeException {

    private final String errorCode;
    private final String entityId;

    public MemoryServiceException(String message, String errorCode) {
        this(message, null, errorCode, null);
    }

    public MemoryServiceException(String message, String entityId, String errorCode) {
        this(message, entityId, errorCode, null);
    }

    public MemoryServiceException(String message, String entityId, String errorCode, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getEntityId() {
        return entityId;
    }
}
