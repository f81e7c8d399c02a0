package org.muma.mini.kv.server;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SnapshotPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * 连接处理循环：每个连接一个实例
 * <p>
 * RespDecoder 每解出一帧就交给这里，命令在该连接所属的 EventLoop 上按到达顺序执行，
 * 响应写回之后才处理下一帧。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    private final CommandDispatcher dispatcher;
    private final boolean masterLink;
    private RedisContext context;

    public RedisCommandHandler(CommandDispatcher dispatcher) {
        this(dispatcher, false);
    }

    public RedisCommandHandler(CommandDispatcher dispatcher, boolean masterLink) {
        this.dispatcher = dispatcher;
        this.masterLink = masterLink;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        this.context = new RedisContext(ctx, masterLink);
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client connected: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.info("{} disconnected: {}", masterLink ? "Master" : "Client", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        if (msg instanceof RedisArray array && array.size() > 0) {
            RedisMessage response = dispatcher.dispatch(array, context);
            if (response != null) {
                ctx.writeAndFlush(response);
            }
        } else if (msg instanceof SnapshotPayload snapshot) {
            log.debug("Ignoring opaque snapshot payload of {} bytes", snapshot.length());
        } else {
            log.warn("Received non-command message from {}: {}", ctx.channel().remoteAddress(), msg);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            // 协议错误只关闭当前连接
            log.warn("Protocol error from {}, closing connection: {}", ctx.channel().remoteAddress(),
                    cause.getCause() != null ? cause.getCause().getMessage() : cause.getMessage());
        } else if (cause instanceof IOException) {
            log.info("Connection error from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("Unexpected error on connection {}", ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }
}
