package com.project.scratch.analysis.service;

import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One exclusive lock per experiment. Writers of the same experiment's result set run one at a
 * time; different experiments never wait on each other.
 */
@Component
public class ExperimentLockRegistry {
    private final ConcurrentMap<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(UUID experimentId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(experimentId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(UUID experimentId, Runnable action) {
        withLock(experimentId, () -> {
            action.run();
            return null;
        });
    }

    boolean isLocked(UUID experimentId) {
        ReentrantLock lock = locks.get(experimentId);
        return lock != null && lock.isLocked();
    }
}
