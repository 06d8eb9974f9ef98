package com.catalogsync.crawl.service;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide map of session id to cancellation token. Not persisted; a restart forgets every flag.
 */
public class CancellationRegistry {
    private final Lock lock = new ReentrantLock();
    private final Map<String, CancellationToken> tokens = new HashMap<>();

    public CancellationToken register(String sessionId) {
        lock.lock();
        try {
            return tokens.computeIfAbsent(sessionId, id -> new CancellationToken(id, lock));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return false when no token is registered for the session
     */
    public boolean cancel(String sessionId) {
        lock.lock();
        try {
            CancellationToken token = tokens.get(sessionId);
            if (token == null) {
                return false;
            }
            token.cancel();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isCanceled(String sessionId) {
        lock.lock();
        try {
            CancellationToken token = tokens.get(sessionId);
            return token != null && token.isCanceled();
        } finally {
            lock.unlock();
        }
    }

    public boolean isRegistered(String sessionId) {
        lock.lock();
        try {
            return tokens.containsKey(sessionId);
        } finally {
            lock.unlock();
        }
    }

    public void release(String sessionId) {
        lock.lock();
        try {
            tokens.remove(sessionId);
        } finally {
            lock.unlock();
        }
    }
}
