package org.muma.respkv.store;

/**
 * 共享的 KV 存储，所有连接持有同一个实例。
 * 实现必须保证每个操作都是一个完整的临界区：读不到写了一半的值。
 */
public interface StorageEngine {

    // 基础 KV 操作，key 不存在时返回 null
    String get(String key);

    // 插入或覆盖
    void put(String key, String value);

    int size();
}
