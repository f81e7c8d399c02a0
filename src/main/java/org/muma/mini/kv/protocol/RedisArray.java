package org.muma.mini.kv.protocol;

import java.util.Arrays;

// 5. 数组 (*) - elements 为 null 表示 *-1
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    /**
     * 由若干字符串构建命令数组，每个参数编码为 BulkString
     */
    public static RedisArray of(String... args) {
        RedisMessage[] msgs = new RedisMessage[args.length];
        for (int i = 0; i < args.length; i++) {
            msgs[i] = new BulkString(args[i]);
        }
        return new RedisArray(msgs);
    }

    public int size() {
        return elements == null ? 0 : elements.length;
    }

    /**
     * 取第 i 个参数的字符串形式，非 BulkString 参数视为非法
     */
    public String argAsString(int i) {
        if (elements[i] instanceof BulkString b && !b.isNull()) {
            return b.asString();
        }
        throw new IllegalArgumentException("argument " + i + " is not a bulk string");
    }

    public byte[] argAsBytes(int i) {
        if (elements[i] instanceof BulkString b && !b.isNull()) {
            return b.content();
        }
        throw new IllegalArgumentException("argument " + i + " is not a bulk string");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RedisArray other && Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        return "RedisArray" + Arrays.toString(elements);
    }
}
