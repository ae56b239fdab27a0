package org.example.progress.service;

import org.example.progress.config.ProgressEngineProperties;
import org.example.progress.model.ProgressKey;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes mutations of the same progress record inside this JVM. Locks are
 * striped by key hash; unrelated records sharing a stripe only wait on each
 * other briefly. The database row lock covers other JVMs.
 */
@Component
public class ProgressLockRegistry {

    private final ReentrantLock[] stripes;

    @Autowired
    public ProgressLockRegistry(ProgressEngineProperties properties) {
        this(properties.getLockStripes());
    }

    ProgressLockRegistry(int stripeCount) {
        int count = Math.max(1, stripeCount);
        this.stripes = new ReentrantLock[count];
        for (int i = 0; i < count; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(ProgressKey key, Supplier<T> action) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    int stripeCount() {
        return stripes.length;
    }

    private ReentrantLock lockFor(ProgressKey key) {
        return stripes[Math.floorMod(key.hashCode(), stripes.length)];
    }
}
