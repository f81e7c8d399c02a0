package org.muma.mini.kv.replication;

import io.netty.buffer.ByteBufUtil;
import org.muma.mini.kv.protocol.SnapshotPayload;

/**
 * 全量同步时发送的占位快照：一个不含任何 Key 的 RDB 文件。
 * 不反映当前数据集，Slave 收到后直接丢弃。
 */
final class EmptySnapshot {

    private static final String EMPTY_RDB_HEX =
            "524544495330303131fa0972656469732d76657205372e322e30fa0a72656469732d62697473c040fa056374696d65"
                    + "c26d08bc65fa08757365642d6d656dc2b0c41000fa08616f662d62617365c000fff06e3bfec0ff5aa2";

    private static final byte[] CONTENT = ByteBufUtil.decodeHexDump(EMPTY_RDB_HEX);

    private EmptySnapshot() {
    }

    static SnapshotPayload payload() {
        return new SnapshotPayload(CONTENT.clone());
    }
}
