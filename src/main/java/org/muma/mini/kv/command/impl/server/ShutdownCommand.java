package org.muma.mini.kv.command.impl.server;

import io.netty.channel.ChannelFutureListener;
import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SHUTDOWN [NOSAVE|SAVE]
 * <p>
 * 先把 OK 写回客户端，写完之后再触发关闭。没有持久化，NOSAVE/SAVE 都被忽略。
 */
public class ShutdownCommand implements RedisCommand {

    private static final Logger log = LoggerFactory.getLogger(ShutdownCommand.class);

    private final Runnable shutdownHook;

    public ShutdownCommand(Runnable shutdownHook) {
        this.shutdownHook = shutdownHook;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        checkArity(args, 1, 2, "shutdown");
        if (context.isMasterLink()) {
            // 复制链路上的 SHUTDOWN 直接忽略
            log.warn("Ignoring SHUTDOWN received on the master link");
            return null;
        }
        log.info("SHUTDOWN requested by {}", context.channel().remoteAddress());

        context.getNettyCtx().writeAndFlush(SimpleString.OK)
                .addListener((ChannelFutureListener) f -> shutdownHook.run());
        return null;
    }
}
