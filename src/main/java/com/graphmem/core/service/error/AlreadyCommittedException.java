package com.graphmem.core.service.error;

/**
 * Thrown when a simulation job is committed a second time.
 */
public class AlreadyCommittedException extends MemoryServiceException {

    public static final String CODE = "ALREADY_COMMITTED";

    public AlreadyCommittedException(String jobId) {
        super("Simulation job " + jobId + " has already been committed", jobId, CODE);
    }
}
