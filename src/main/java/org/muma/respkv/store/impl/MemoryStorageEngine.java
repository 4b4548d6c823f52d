package org.muma.respkv.store.impl;

import org.muma.respkv.store.StorageEngine;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 内存存储：一个 HashMap + 一把锁。
 * <p>
 * 整个 Map 只有一个互斥边界 (不做分段/按 key 加锁)，
 * 临界区内只有一次 put 或 get，O(1) 且不做任何 I/O。
 * 不同连接对同一个 key 的并发 SET 是 last-writer-wins。
 */
public class MemoryStorageEngine implements StorageEngine {

    private final Map<String, String> memoryDb = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public String get(String key) {
        lock.lock();
        try {
            return memoryDb.get(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(String key, String value) {
        lock.lock();
        try {
            memoryDb.put(key, value);
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
}
