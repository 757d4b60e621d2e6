package com.gt.wordreminder.util;

import com.gt.wordreminder.exception.SessionConflictException;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-owner mutual exclusion for session operations. Locks are taken with {@code tryLock}, so a request
 * that arrives while another request for the same owner is running fails fast with a
 * {@link SessionConflictException} instead of queueing behind it.
 * <p>
 * Each session service owns its own registry, so a review and a quiz for the same owner do not exclude
 * each other.
 */
public class OwnerLockRegistry {

    private final String name;
    private final ConcurrentMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public OwnerLockRegistry(String name) {
        this.name = name;
    }

    public <T> T withOwnerLock(long owner, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(owner, key -> new ReentrantLock());

        if (!lock.tryLock()) {
            throw new SessionConflictException("Another " + name + " request for owner " + owner + " is in progress");
        }

        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
