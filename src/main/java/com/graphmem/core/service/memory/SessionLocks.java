package com.graphmem.core.service.memory;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-session locks: appends to one session's chain are totally ordered,
 * different sessions mostly proceed in parallel.
 *
 * Locks are striped over a fixed array indexed by the session id hash, so
 * the number of locks does not grow with the number of sessions. Two
 * sessions may share a stripe, so while one session lock is held another
 * may only be taken with {@code tryLock}.
 */
@Component
public class SessionLocks {

    static final int DEFAULT_STRIPES = 256;

    private final ReentrantLock[] stripes;

    public SessionLocks() {
        this(DEFAULT_STRIPES);
    }

    SessionLocks(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be positive");
        }
        stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public ReentrantLock forSession(String sessionId) {
        return stripes[Math.floorMod(sessionId.hashCode(), stripes.length)];
    }

    int stripeCount() {
        return stripes.length;
    }
}
