package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.util.ByteProcessor;

import java.nio.charset.StandardCharsets;

/**
 * RESP 协议编解码核心 (与 Netty Pipeline 无关，可单独使用)
 * <p>
 * 解码按长度前缀逐个读取完整的值，绝不按分隔符切分，
 * 因为 '*'、CR、LF 都可能出现在 BulkString 的内容里。
 */
public final class RespCodec {

    private static final byte PLUS_BYTE = '+';
    private static final byte MINUS_BYTE = '-';
    private static final byte COLON_BYTE = ':';
    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';

    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte[] CRLF = {CR, LF};

    // 快照文件的魔数，遇到它说明后面是不透明的快照字节，不按 RESP 解析
    static final byte[] SNAPSHOT_MARKER = "REDIS".getBytes(StandardCharsets.US_ASCII);

    static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    static final int MAX_ARRAY_LENGTH = 1024 * 1024;
    private static final int MAX_LINE_LENGTH = 64 * 1024;

    private RespCodec() {
    }

    /**
     * decode(byte[]) 的结果：解出的值 + 未消费的剩余字节
     */
    public record Decoded(RedisMessage message, byte[] remaining) {
    }

    // =========================================================
    // Encode
    // =========================================================

    public static byte[] encode(RedisMessage msg) {
        ByteBuf buf = Unpooled.buffer(64);
        try {
            encode(msg, buf);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    public static void encode(RedisMessage msg, ByteBuf out) {
        if (msg instanceof SimpleString s) {
            out.writeByte(PLUS_BYTE);
            out.writeCharSequence(s.content(), StandardCharsets.UTF_8);
            out.writeBytes(CRLF);
        } else if (msg instanceof ErrorMessage e) {
            out.writeByte(MINUS_BYTE);
            out.writeCharSequence(e.content(), StandardCharsets.UTF_8);
            out.writeBytes(CRLF);
        } else if (msg instanceof RedisInteger i) {
            out.writeByte(COLON_BYTE);
            writeNumber(out, i.value());
        } else if (msg instanceof BulkString b) {
            out.writeByte(DOLLAR_BYTE);
            if (b.isNull()) {
                writeNumber(out, -1);
            } else {
                writeNumber(out, b.content().length);
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            out.writeByte(ASTERISK_BYTE);
            if (a.elements() == null) {
                writeNumber(out, -1);
            } else {
                writeNumber(out, a.elements().length);
                for (RedisMessage element : a.elements()) {
                    encode(element, out);
                }
            }
        } else if (msg instanceof SnapshotPayload p) {
            // 快照传输：$<len>\r\n<bytes>，没有结尾的 CRLF
            out.writeByte(DOLLAR_BYTE);
            writeNumber(out, p.length());
            out.writeBytes(p.content());
        }
    }

    private static void writeNumber(ByteBuf out, long value) {
        out.writeCharSequence(Long.toString(value), StandardCharsets.US_ASCII);
        out.writeBytes(CRLF);
    }

    // =========================================================
    // Decode
    // =========================================================

    /**
     * 从完整的字节数组中解出一个值，并返回剩余字节 (用于 Pipeline 场景下连续解码)。
     * 空输入返回 (null, 空数组)；帧不完整视为协议错误。
     */
    public static Decoded decode(byte[] data) {
        if (data.length == 0) {
            return new Decoded(null, data);
        }
        ByteBuf in = Unpooled.wrappedBuffer(data);
        RedisMessage msg = decode(in);
        if (msg == null) {
            throw new RespProtocolException("Truncated RESP frame (" + data.length + " bytes)");
        }
        return new Decoded(msg, ByteBufUtil.getBytes(in));
    }

    /**
     * 流式解码：数据不足一个完整的值时返回 null，并且不移动 readerIndex。
     *
     * @throws RespProtocolException 数据格式非法
     */
    public static RedisMessage decode(ByteBuf in) {
        if (!in.isReadable()) {
            return null;
        }
        if (in.getByte(in.readerIndex()) == SNAPSHOT_MARKER[0]) {
            return readOpaqueSnapshot(in);
        }
        int start = in.readerIndex();
        RedisMessage msg = readNext(in);
        if (msg == null) {
            in.readerIndex(start);
        }
        return msg;
    }

    /**
     * 读取全量同步的快照：$<len>\r\n 后面紧跟 len 个字节，没有 CRLF。
     * 数据不足时返回 null。
     */
    public static SnapshotPayload decodeSnapshot(ByteBuf in) {
        if (!in.isReadable()) {
            return null;
        }
        byte type = in.getByte(in.readerIndex());
        if (type == SNAPSHOT_MARKER[0]) {
            return readOpaqueSnapshot(in);
        }
        if (type != DOLLAR_BYTE) {
            throw new RespProtocolException("Expected snapshot bulk header, got type byte: " + describe(type));
        }
        int start = in.readerIndex();
        in.skipBytes(1);
        String line = readLine(in);
        if (line == null) {
            in.readerIndex(start);
            return null;
        }
        int length = parseLength(line, MAX_BULK_LENGTH, "snapshot");
        if (length < 0) {
            throw new RespProtocolException("Invalid snapshot length: " + length);
        }
        if (in.readableBytes() < length) {
            in.readerIndex(start);
            return null;
        }
        byte[] content = new byte[length];
        in.readBytes(content);
        return new SnapshotPayload(content);
    }

    // 以魔数开头的不透明数据：整段吞掉，交给调用方忽略
    private static SnapshotPayload readOpaqueSnapshot(ByteBuf in) {
        int readable = in.readableBytes();
        int check = Math.min(readable, SNAPSHOT_MARKER.length);
        for (int i = 0; i < check; i++) {
            if (in.getByte(in.readerIndex() + i) != SNAPSHOT_MARKER[i]) {
                throw new RespProtocolException("Unknown RESP type byte: " + describe(in.getByte(in.readerIndex())));
            }
        }
        if (readable < SNAPSHOT_MARKER.length) {
            return null;
        }
        byte[] content = new byte[readable];
        in.readBytes(content);
        return new SnapshotPayload(content);
    }

    // 递归读取下一个完整的值，数据不足返回 null (由最外层回滚 readerIndex)
    private static RedisMessage readNext(ByteBuf in) {
        if (!in.isReadable()) {
            return null;
        }
        byte type = in.readByte();
        switch (type) {
            case PLUS_BYTE: {
                String line = readLine(in);
                return line == null ? null : new SimpleString(line);
            }
            case MINUS_BYTE: {
                String line = readLine(in);
                return line == null ? null : new ErrorMessage(line);
            }
            case COLON_BYTE: {
                String line = readLine(in);
                return line == null ? null : new RedisInteger(parseLong(line));
            }
            case DOLLAR_BYTE:
                return readBulkString(in);
            case ASTERISK_BYTE:
                return readArray(in);
            default:
                throw new RespProtocolException("Unknown RESP type byte: " + describe(type));
        }
    }

    // $<length>\r\n<data>\r\n
    private static BulkString readBulkString(ByteBuf in) {
        String line = readLine(in);
        if (line == null) return null;

        int length = parseLength(line, MAX_BULK_LENGTH, "bulk string");
        if (length == -1) {
            return BulkString.NULL;
        }
        if (in.readableBytes() < length + 2) {
            return null;
        }
        byte[] content = new byte[length];
        in.readBytes(content);

        byte b1 = in.readByte();
        byte b2 = in.readByte();
        if (b1 != CR || b2 != LF) {
            throw new RespProtocolException("Bulk string of length " + length + " not terminated by CRLF");
        }
        return new BulkString(content);
    }

    // *<count>\r\n<element1>...<elementN>
    private static RedisArray readArray(ByteBuf in) {
        String line = readLine(in);
        if (line == null) return null;

        int count = parseLength(line, MAX_ARRAY_LENGTH, "array");
        if (count == -1) {
            return new RedisArray(null);
        }
        RedisMessage[] elements = new RedisMessage[count];
        for (int i = 0; i < count; i++) {
            RedisMessage element = readNext(in);
            if (element == null) {
                return null;
            }
            elements[i] = element;
        }
        return new RedisArray(elements);
    }

    // 读取一行 (不含 CRLF)，没有遇到 LF 时返回 null
    private static String readLine(ByteBuf in) {
        int lf = in.forEachByte(ByteProcessor.FIND_LF);
        if (lf < 0) {
            if (in.readableBytes() > MAX_LINE_LENGTH) {
                throw new RespProtocolException("Line too long (> " + MAX_LINE_LENGTH + " bytes)");
            }
            return null;
        }
        int lineLength = lf - in.readerIndex() - 1;
        if (lineLength < 0 || in.getByte(lf - 1) != CR) {
            throw new RespProtocolException("Line not terminated by CRLF");
        }
        String line = in.toString(in.readerIndex(), lineLength, StandardCharsets.UTF_8);
        in.readerIndex(lf + 1);
        return line;
    }

    private static int parseLength(String line, int max, String what) {
        long length = parseLong(line);
        if (length < -1 || length > max) {
            throw new RespProtocolException("Invalid " + what + " length: " + length);
        }
        return (int) length;
    }

    private static long parseLong(String line) {
        try {
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new RespProtocolException("Not a number: '" + line + "'", e);
        }
    }

    private static String describe(byte b) {
        return b >= 0x20 && b < 0x7f ? "'" + (char) b + "'" : String.format("0x%02x", b);
    }
}
