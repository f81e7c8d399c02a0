package org.muma.mini.kv.replication;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.timeout.ReadTimeoutException;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.protocol.SnapshotPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Slave 端的握手 Handler
 * 负责处理 Master 发回的握手响应和快照；快照收完后被替换为普通命令 Handler。
 * 任何不符合预期的响应都会断开连接，由 ReplicationManager 负责退避重连。
 */
public class RedisSlaveHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisSlaveHandler.class);
    private final ReplicationManager manager;

    public RedisSlaveHandler(ReplicationManager manager) {
        this.manager = manager;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        ReplState state = manager.getState();

        // 错误处理
        if (msg instanceof ErrorMessage err) {
            fail(ctx, state, "master responded error: " + err.content());
            return;
        }

        switch (state) {
            case RECEIVE_PONG -> {
                if (isSimple(msg, "PONG")) {
                    log.debug("Master PONG received.");
                    manager.sendReplConfPort();
                } else {
                    fail(ctx, state, "expected PONG, got " + msg);
                }
            }
            case SEND_PORT -> { // 等待 Port 的 OK
                if (isSimple(msg, "OK")) {
                    manager.sendReplConfCapa();
                } else {
                    fail(ctx, state, "expected OK, got " + msg);
                }
            }
            case SEND_CAPA -> { // 等待 Capa 的 OK
                if (isSimple(msg, "OK")) {
                    manager.sendPsync();
                } else {
                    fail(ctx, state, "expected OK, got " + msg);
                }
            }
            case RECEIVE_PSYNC -> {
                // +FULLRESYNC <replid> <offset>，不支持 +CONTINUE (部分同步)
                String[] parts = msg instanceof SimpleString ss ? ss.content().split(" ") : new String[0];
                if (parts.length == 3 && "FULLRESYNC".equals(parts[0])) {
                    try {
                        manager.handleFullResync(parts[1], Long.parseLong(parts[2]));
                    } catch (NumberFormatException e) {
                        fail(ctx, state, "invalid FULLRESYNC offset: " + parts[2]);
                    }
                } else {
                    fail(ctx, state, "expected FULLRESYNC, got " + msg);
                }
            }
            case TRANSFER -> {
                if (msg instanceof SnapshotPayload snapshot) {
                    manager.handleSnapshotLoaded(ctx, snapshot.length());
                } else {
                    fail(ctx, state, "expected snapshot payload, got " + msg);
                }
            }
            default -> fail(ctx, state, "unexpected message " + msg);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof ReadTimeoutException) {
            fail(ctx, manager.getState(), "handshake timed out");
        } else {
            fail(ctx, manager.getState(), cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
    }

    private void fail(ChannelHandlerContext ctx, ReplState state, String reason) {
        log.warn("Replication handshake failed in state {}: {}", state, reason);
        ctx.close();
    }

    private boolean isSimple(RedisMessage msg, String expected) {
        return msg instanceof SimpleString ss && expected.equalsIgnoreCase(ss.content());
    }
}
