package org.muma.mini.kv.command.impl.string;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

import java.util.Locale;

public class SetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        // 基本格式: SET key value [EX seconds | PX milliseconds]
        checkArity(args, 3, 5, "set");

        String key = args.argAsString(1);
        byte[] value = args.argAsBytes(2);

        // --- 1. 参数解析阶段 ---
        long ttlMillis = -1; // -1 表示不过期
        if (args.size() > 3) {
            if (args.size() != 5) {
                throw new IllegalArgumentException("syntax error");
            }
            String opt = args.argAsString(3).toUpperCase(Locale.ROOT);
            long amount = parseLong(args.argAsString(4));
            if (amount <= 0 || amount > Long.MAX_VALUE / 1000) {
                throw new IllegalArgumentException("invalid expire time in 'set' command");
            }
            ttlMillis = switch (opt) {
                case "PX" -> amount;
                case "EX" -> amount * 1000;
                default -> throw new IllegalArgumentException("syntax error");
            };
        }

        // --- 2. 写入阶段 ---
        if (ttlMillis == -1) {
            storage.set(key, value);
        } else {
            storage.set(key, value, ttlMillis);
        }
        return SimpleString.OK;
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
