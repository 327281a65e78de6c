package com.graphmem.core.service.error;

/**
 * Failure of the external text-completion collaborator.
 *
 * Transient failures (network errors, throttling, 5xx) may be retried;
 * permanent ones may not.
 */
public class GeneratorException extends MemoryServiceException {

    public static final String CODE = "GENERATOR_ERROR";

    private final boolean transientFailure;

    public GeneratorException(String message, boolean transientFailure) {
        super(message, null, CODE, null);
        this.transientFailure = transientFailure;
    }

    public GeneratorException(String message, boolean transientFailure, Throwable cause) {
        super(message, null, CODE, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
