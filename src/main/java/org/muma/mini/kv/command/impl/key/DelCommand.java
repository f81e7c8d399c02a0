package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

public class DelCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        // 格式: DEL key [key ...]
        checkArity(args, 2, -1, "del");

        int deletedCount = 0;
        for (int i = 1; i < args.size(); i++) {
            if (storage.delete(args.argAsString(i))) {
                deletedCount++;
            }
        }
        return new RedisInteger(deletedCount);
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
