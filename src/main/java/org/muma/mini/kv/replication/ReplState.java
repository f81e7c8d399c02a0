package org.muma.mini.kv.replication;

public enum ReplState {
    // --- As Slave ---
    NONE,               // 非 Slave (Master 模式)
    CONNECT,            // 未连接，等待 (重新) 连接 Master
    CONNECTING,         // TCP 连接中
    RECEIVE_PONG,       // 等待 PING 响应
    SEND_PORT,          // 已发送 REPLCONF listening-port，等待 OK
    SEND_CAPA,          // 已发送 REPLCONF capa，等待 OK
    RECEIVE_PSYNC,      // 等待 PSYNC 响应
    TRANSFER,           // 正在接收快照
    CONNECTED;          // 全量同步完成，进入命令流 (Command Stream)

    // Master 没有全局状态，状态是针对每个 Slave 连接维护的 (见 ReplicaInfo)

    public boolean isHandshaking() {
        return this.ordinal() >= RECEIVE_PONG.ordinal() && this.ordinal() <= TRANSFER.ordinal();
    }
}
