package org.muma.mini.kv.server;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;

/**
 * 命令执行上下文
 * 封装了与当前连接相关的所有环境信息
 */
public class RedisContext {

    private final ChannelHandlerContext nettyCtx;

    // 该连接是不是本节点 (Slave) 通往 Master 的复制链路
    private final boolean masterLink;

    public RedisContext(ChannelHandlerContext nettyCtx) {
        this(nettyCtx, false);
    }

    public RedisContext(ChannelHandlerContext nettyCtx, boolean masterLink) {
        this.nettyCtx = nettyCtx;
        this.masterLink = masterLink;
    }

    public ChannelHandlerContext getNettyCtx() {
        return nettyCtx;
    }

    public Channel channel() {
        return nettyCtx.channel();
    }

    public boolean isMasterLink() {
        return masterLink;
    }
}
