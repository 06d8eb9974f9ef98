package com.catalogsync.crawl.service;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cooperative stop flag for one session. Reads and writes go through the owning registry's lock.
 */
public final class CancellationToken {
    private final String sessionId;
    private final Lock lock;
    private boolean canceled;

    CancellationToken(String sessionId, Lock lock) {
        this.sessionId = sessionId;
        this.lock = lock;
    }

    /**
     * A token nobody can cancel, for work that is not tied to a registered session.
     */
    public static CancellationToken none() {
        return new CancellationToken(null, new ReentrantLock());
    }

    public String sessionId() {
        return sessionId;
    }

    public boolean isCanceled() {
        lock.lock();
        try {
            return canceled;
        } finally {
            lock.unlock();
        }
    }

    void cancel() {
        lock.lock();
        try {
            canceled = true;
        } finally {
            lock.unlock();
        }
    }
}
