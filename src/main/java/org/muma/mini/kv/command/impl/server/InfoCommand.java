package org.muma.mini.kv.command.impl.server;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.replication.ReplicationManager;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

/**
 * INFO [section]
 * <p>
 * 只有复制这一段：角色、Slave 数量、复制 ID、复制偏移量，单行返回。
 */
public class InfoCommand implements RedisCommand {

    private final ReplicationManager replicationManager;

    public InfoCommand(ReplicationManager replicationManager) {
        this.replicationManager = replicationManager;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        checkArity(args, 1, 2, "info");
        return new SimpleString(replicationManager.infoLine());
    }
}
