package org.muma.mini.kv.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

// 4. 批量字符串 ($) - 支持 null (表示 $-1)，长度为 0 的内容是空数组而不是 null
public record BulkString(byte[] content) implements RedisMessage {

    public static final BulkString NULL = new BulkString((byte[]) null);

    public BulkString(String s) {
        this(s == null ? null : s.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isNull() {
        return content == null;
    }

    public String asString() {
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    // record 默认按引用比较数组，这里改为按内容比较
    @Override
    public boolean equals(Object o) {
        return o instanceof BulkString other && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return content == null ? "BulkString[nil]" : "BulkString[" + asString() + "]";
    }
}
