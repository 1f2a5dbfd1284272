package com.liquidityledger.common;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One exclusive lock per ledger entity (pool, staking pool, validator, governance proposal). Operations on different keys run in
 * parallel; operations on the same key are serialized. Locks are reentrant so a ledger operation may call
 * another operation on the same entity while holding its lock.
 */
@Component
public class EntityLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public static String pool(String poolId) {
        return "pool:" + poolId;
    }

    public static String stakingPool(String stakingPoolId) {
        return "staking:" + stakingPoolId;
    }

    public static String validator(String validatorId) {
        return "validator:" + validatorId;
    }

    public static String proposal(String proposalId) {
        return "proposal:" + proposalId;
    }

    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithLock(String key, Runnable action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * True if the current thread holds the lock for the key. Used to guard internal mutators.
     */
    public boolean isHeldByCurrentThread(String key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isHeldByCurrentThread();
    }
}
