package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * RESP 协议解码器
 * <p>
 * ByteToMessageDecoder 会把不完整的帧留在累积缓冲区里，等下一次 read 再继续，
 * 所以一次 read 里粘在一起的多条命令 (Pipeline) 和被拆开的半条命令都能正确处理。
 * <p>
 * 用于 Master 链路 (Slave 端) 时，收到 +FULLRESYNC 之后的下一帧是快照，按快照格式读取。
 */
public class RespDecoder extends ByteToMessageDecoder {

    private static final Logger log = LoggerFactory.getLogger(RespDecoder.class);

    private final boolean masterLink;
    private boolean snapshotExpected;

    public RespDecoder() {
        this(false);
    }

    public RespDecoder(boolean masterLink) {
        this.masterLink = masterLink;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (snapshotExpected) {
            SnapshotPayload snapshot = RespCodec.decodeSnapshot(in);
            if (snapshot != null) {
                snapshotExpected = false;
                log.debug("Snapshot payload received: {} bytes", snapshot.length());
                out.add(snapshot);
            }
            return;
        }

        // 每次只解一帧，ByteToMessageDecoder 会循环调用直到数据不足
        RedisMessage msg = RespCodec.decode(in);
        if (msg == null) {
            return;
        }
        if (masterLink && msg instanceof SimpleString s && s.content().startsWith("FULLRESYNC")) {
            snapshotExpected = true;
        }
        out.add(msg);
    }

    boolean isSnapshotExpected() {
        return snapshotExpected;
    }
}
