package com.tanmi.core.workspace;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-writer lock per workspace. Every read-modify-write of a workspace's
 * graph, config or prose runs inside {@link #withLock}. Reentrant, so a locked
 * service may call another locked service on the same workspace.
 */
@Component
public class WorkspaceLocks {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String workspaceId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(workspaceId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void run(String workspaceId, Runnable action) {
        withLock(workspaceId, () -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread(String workspaceId) {
        ReentrantLock lock = locks.get(workspaceId);
        return lock != null && lock.isHeldByCurrentThread();
    }
}
