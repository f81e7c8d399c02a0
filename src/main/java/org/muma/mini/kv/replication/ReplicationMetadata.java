package org.muma.mini.kv.replication;

import lombok.Getter;
import lombok.Setter;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 复制元数据
 * Master 和 Slave 都需要维护
 */
public class ReplicationMetadata {

    // 自身复制 ID (作为 Master 时用)，实例生命周期内不变
    @Getter
    private final String replId;

    // 全局复制偏移量 (Master: 已传播的字节数)
    private final AtomicLong replOffset = new AtomicLong(0);

    // Master 的 Host/Port (仅 Slave 模式有效)
    @Getter
    private final String masterHost;
    @Getter
    private final int masterPort;

    // FULLRESYNC 时 Master 告知的复制 ID 与偏移量 (Slave 模式下记录)
    @Setter
    @Getter
    private volatile String cachedMasterReplId = "?";
    @Setter
    @Getter
    private volatile long cachedMasterOffset = -1;

    public ReplicationMetadata(String masterHost, int masterPort) {
        // 生成 40 字节十六进制 ID (简单起见用 UUID 去掉横杠)
        this.replId = UUID.randomUUID().toString().replace("-", "") + UUID.randomUUID().toString().substring(0, 8);
        this.masterHost = masterHost;
        this.masterPort = masterPort;
    }

    public long getReplOffset() {
        return replOffset.get();
    }

    public void addOffset(long delta) {
        replOffset.addAndGet(delta);
    }
}
