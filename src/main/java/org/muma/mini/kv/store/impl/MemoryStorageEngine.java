package org.muma.mini.kv.store.impl;

import org.muma.mini.kv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * 内存存储引擎
 * <p>
 * 数据 Map 与过期 Map 由同一把锁保护：
 * SET+TTL 的写入、GET+惰性删除 都必须作为一个整体被其它线程观察到。
 */
public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    // 1. 数据存储 (Key -> Value)
    private final Map<String, byte[]> memoryDb = new HashMap<>();

    // 2. 过期时间存储 (Key -> ExpireAt Timestamp)
    // 只有带 TTL 的 Key 才有记录，定期清理只需要扫描这个 Map
    private final Map<String, Long> ttlMap = new HashMap<>();

    private final ReentrantLock lock = new ReentrantLock();

    // 时钟 (毫秒)，测试时可以替换
    private final LongSupplier clock;

    public MemoryStorageEngine() {
        this(System::currentTimeMillis);
    }

    public MemoryStorageEngine(LongSupplier clock) {
        this.clock = clock;
    }

    @Override
    public void set(String key, byte[] value) {
        lock.lock();
        try {
            memoryDb.put(key, value);
            // 覆盖写入时清除旧的过期时间
            ttlMap.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String key, byte[] value, long ttlMillis) {
        if (ttlMillis <= 0) {
            throw new IllegalArgumentException("invalid expire time in 'set' command");
        }
        lock.lock();
        try {
            memoryDb.put(key, value);
            ttlMap.put(key, clock.getAsLong() + ttlMillis);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public byte[] get(String key) {
        lock.lock();
        try {
            if (expireIfNeeded(key)) {
                return null;
            }
            return memoryDb.get(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        lock.lock();
        try {
            if (expireIfNeeded(key)) {
                return false;
            }
            ttlMap.remove(key); // 记得同步移除 TTL
            return memoryDb.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean exists(String key) {
        lock.lock();
        try {
            if (expireIfNeeded(key)) {
                return false;
            }
            return memoryDb.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return memoryDb.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 定期删除策略 (简化版 Redis 算法)
     * 每次抽取一部分 Key 进行检查，顺带清理没有对应数据的孤儿过期记录
     */
    @Override
    public int activeExpireCycle(int sampleSize) {
        lock.lock();
        try {
            if (ttlMap.isEmpty()) return 0;

            int expiredCount = 0;
            int loop = 0;
            long now = clock.getAsLong();
            Iterator<Map.Entry<String, Long>> iterator = ttlMap.entrySet().iterator();

            while (iterator.hasNext() && loop < sampleSize) {
                Map.Entry<String, Long> entry = iterator.next();
                String key = entry.getKey();
                if (!memoryDb.containsKey(key)) {
                    iterator.remove();
                } else if (now >= entry.getValue()) {
                    memoryDb.remove(key);
                    iterator.remove();
                    expiredCount++;
                }
                loop++;
            }

            if (expiredCount > 0) {
                log.debug("Active cleanup: scanned {}, expired {}", loop, expiredCount);
            }
            return expiredCount;
        } finally {
            lock.unlock();
        }
    }

    // 必须在持锁时调用。Key 已过期则删除数据和 TTL 记录并返回 true
    private boolean expireIfNeeded(String key) {
        Long expireAt = ttlMap.get(key);
        if (expireAt == null) {
            return false;
        }
        if (!memoryDb.containsKey(key)) {
            // 没有数据的过期记录是垃圾，直接丢弃
            ttlMap.remove(key);
            return false;
        }
        if (clock.getAsLong() < expireAt) {
            return false;
        }
        memoryDb.remove(key);
        ttlMap.remove(key);
        log.debug("Lazy expired key: {}", key);
        return true;
    }
}
