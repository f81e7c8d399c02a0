package org.muma.mini.kv.protocol;

// 3. 整数 (:)，可以为负数
public record RedisInteger(long value) implements RedisMessage {
}
