package org.muma.mini.kv.store;

public interface StorageEngine {

    // 基础 KV 操作
    void set(String key, byte[] value);

    /**
     * 写入并设置过期时间 (毫秒)，ttlMillis 必须大于 0
     */
    void set(String key, byte[] value, long ttlMillis);

    // 带惰性删除：已过期的 Key 返回 null 并被清理
    byte[] get(String key);

    /**
     * @return 删除前 Key 是否存在 (已过期但尚未清理的视为不存在)
     */
    boolean delete(String key);

    // 与 get 一致，同样执行惰性过期
    boolean exists(String key);

    int size();

    /**
     * 定期删除：最多抽查 sampleSize 个带过期时间的 Key
     *
     * @return 本轮删除的 Key 数量
     */
    int activeExpireCycle(int sampleSize);
}
