package org.muma.mini.kv.command.impl.replication;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.replication.ReplicationManager;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

import java.util.Locale;

/**
 * REPLCONF <option> <value> ...
 * 用于主从握手阶段交换信息，或者心跳 ACK。
 */
public class ReplConfCommand implements RedisCommand {

    private final ReplicationManager replicationManager;

    public ReplConfCommand(ReplicationManager replicationManager) {
        this.replicationManager = replicationManager;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        checkArity(args, 2, -1, "replconf");

        String option = args.argAsString(1).toLowerCase(Locale.ROOT);
        switch (option) {
            case "listening-port" -> {
                checkArity(args, 3, 3, "replconf");
                long port = parseLong(args.argAsString(2));
                if (port < 0 || port > 65535) {
                    throw new IllegalArgumentException("invalid listening-port " + port);
                }
                if (replicationManager.isMaster()) {
                    replicationManager.registerReplica(context.channel(), (int) port);
                }
                return SimpleString.OK;
            }
            case "getack" -> {
                // Slave 端不跟踪已应用的偏移量，固定回复 0
                return RedisArray.of("REPLCONF", "ACK", "0");
            }
            case "ack" -> {
                // Slave 的 ACK 不需要回复
                return null;
            }
            default -> {
                // capa 等其它选项：接受并忽略
                return SimpleString.OK;
            }
        }
    }

    @Override
    public boolean repliesOnMasterLink() {
        return true;
    }
}
