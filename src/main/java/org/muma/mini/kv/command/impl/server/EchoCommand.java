package org.muma.mini.kv.command.impl.server;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

public class EchoCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        checkArity(args, 2, 2, "echo");
        return new BulkString(args.argAsBytes(1));
    }
}
