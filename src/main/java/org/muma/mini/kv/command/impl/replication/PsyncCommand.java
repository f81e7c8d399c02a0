package org.muma.mini.kv.command.impl.replication;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.replication.ReplicationManager;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

/**
 * PSYNC <replid> <offset>
 * <p>
 * 不支持部分同步，无论参数是什么都走全量同步。
 * +FULLRESYNC 和快照由 ReplicationManager 直接写出，这里不再返回响应。
 */
public class PsyncCommand implements RedisCommand {

    private final ReplicationManager replicationManager;

    public PsyncCommand(ReplicationManager replicationManager) {
        this.replicationManager = replicationManager;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        checkArity(args, 3, 3, "psync");

        if (!replicationManager.isMaster()) {
            return new ErrorMessage("ERR PSYNC not supported on a replica");
        }
        replicationManager.fullResync(context.getNettyCtx());
        return null;
    }
}
