package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

public class ExistsCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        checkArity(args, 2, -1, "exists");

        int count = 0;
        // 遍历所有 Key
        for (int i = 1; i < args.size(); i++) {
            // exists 自带惰性删除逻辑，过期的 Key 不计数
            if (storage.exists(args.argAsString(i))) {
                count++;
            }
        }
        return new RedisInteger(count);
    }
}
