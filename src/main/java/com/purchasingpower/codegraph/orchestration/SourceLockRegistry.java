package com.purchasingpower.codegraph.orchestration;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per source id, created on first use and kept for the life of the
 * process. Growth is bounded by the number of registered sources.
 */
@Component
public class SourceLockRegistry {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(String sourceId) {
        return locks.computeIfAbsent(sourceId, id -> new ReentrantLock());
    }

    public boolean isLocked(String sourceId) {
        ReentrantLock lock = locks.get(sourceId);
        return lock != null && lock.isLocked();
    }

    public int size() {
        return locks.size();
    }
}
