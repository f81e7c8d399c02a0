package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

public class RespEncoder extends MessageToByteEncoder<RedisMessage> {

    @Override
    protected void encode(ChannelHandlerContext ctx, RedisMessage msg, ByteBuf out) {
        RespCodec.encode(msg, out);
    }
}
