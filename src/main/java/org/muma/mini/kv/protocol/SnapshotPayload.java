package org.muma.mini.kv.protocol;

import java.util.Arrays;

/**
 * 全量同步时传输的快照数据。
 * <p>
 * 线上格式为 {@code $<len>\r\n<bytes>}，末尾没有 CRLF，内容不做解析。
 */
public record SnapshotPayload(byte[] content) implements RedisMessage {

    public int length() {
        return content.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SnapshotPayload other && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "SnapshotPayload[" + content.length + " bytes]";
    }
}
