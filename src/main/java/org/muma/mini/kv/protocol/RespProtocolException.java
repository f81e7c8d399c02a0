package org.muma.mini.kv.protocol;

/**
 * 协议解析错误：类型字节未知、长度非法、缺少 CRLF 或帧被截断。
 * 只会导致当前连接被关闭。
 */
public class RespProtocolException extends RuntimeException {

    public RespProtocolException(String message) {
        super(message);
    }

    public RespProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
