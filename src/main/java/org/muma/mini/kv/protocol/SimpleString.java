package org.muma.mini.kv.protocol;

// 1. 简单字符串 (+)，不允许包含 CR/LF
public record SimpleString(String content) implements RedisMessage {

    public static final SimpleString OK = new SimpleString("OK");
    public static final SimpleString PONG = new SimpleString("PONG");
}
