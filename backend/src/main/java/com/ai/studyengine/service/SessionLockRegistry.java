package com.ai.studyengine.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair lock per study session. Serializes content generation for a
 * session inside this instance; the session row lock taken by the
 * orchestrator covers other instances.
 */
@Component
public class SessionLockRegistry {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String sessionId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(sessionId, id -> new ReentrantLock(true));
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /** Drops the lock of a deleted session. */
    public void forget(String sessionId) {
        locks.remove(sessionId);
    }

    int size() {
        return locks.size();
    }
}
