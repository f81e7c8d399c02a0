package org.muma.mini.kv.command;

import org.muma.mini.kv.command.impl.key.DelCommand;
import org.muma.mini.kv.command.impl.key.ExistsCommand;
import org.muma.mini.kv.command.impl.replication.PsyncCommand;
import org.muma.mini.kv.command.impl.replication.ReplConfCommand;
import org.muma.mini.kv.command.impl.server.EchoCommand;
import org.muma.mini.kv.command.impl.server.InfoCommand;
import org.muma.mini.kv.command.impl.server.PingCommand;
import org.muma.mini.kv.command.impl.server.ShutdownCommand;
import org.muma.mini.kv.command.impl.string.GetCommand;
import org.muma.mini.kv.command.impl.string.SetCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.replication.ReplicationManager;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 命令分发
 * <p>
 * 按命令名 (不区分大小写) 查找并执行，Master 上执行成功的写命令原样传播给 Slave。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final Map<String, RedisCommand> commandMap = new HashMap<>();
    private final StorageEngine storage;
    private final ReplicationManager replicationManager;
    private final ReentrantLock writeLock = new ReentrantLock();

    /**
     * @param shutdownHook SHUTDOWN 命令回复写出后执行的关闭动作
     */
    public CommandDispatcher(StorageEngine storage, ReplicationManager replicationManager, Runnable shutdownHook) {
        this.storage = storage;
        this.replicationManager = replicationManager;
        this.initCommandRegistry(shutdownHook);
    }

    /**
     * 初始化命令注册表
     */
    private void initCommandRegistry(Runnable shutdownHook) {
        // server
        commandMap.put("PING", new PingCommand());
        commandMap.put("ECHO", new EchoCommand());
        commandMap.put("INFO", new InfoCommand(replicationManager));
        commandMap.put("SHUTDOWN", new ShutdownCommand(shutdownHook));

        // string / key
        commandMap.put("SET", new SetCommand());
        commandMap.put("GET", new GetCommand());
        commandMap.put("DEL", new DelCommand());
        commandMap.put("EXISTS", new ExistsCommand());

        // replication
        commandMap.put("REPLCONF", new ReplConfCommand(replicationManager));
        commandMap.put("PSYNC", new PsyncCommand(replicationManager));

        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    /**
     * 核心分发逻辑
     *
     * @return 需要写回的响应，null 表示不回复
     */
    public RedisMessage dispatch(RedisArray args, RedisContext context) {
        String commandName;
        try {
            commandName = args.argAsString(0).toUpperCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            log.warn("Command name is not a bulk string: {}", args);
            return null;
        }

        // 1. 查找命令，未知命令不回复，连接保持
        RedisCommand command = commandMap.get(commandName);
        if (command == null) {
            log.warn("Unknown command: {}", commandName);
            return null;
        }

        if (log.isDebugEnabled()) {
            log.debug("Execute Command: {} ({} args){}", commandName, args.size() - 1,
                    context.isMasterLink() ? " from master" : "");
        }

        // 2. 执行并监控耗时
        // 写命令的执行与传播放在同一把锁里：Slave 收到命令的顺序必须与 Master 应用的顺序一致
        boolean write = command.isWrite();
        long startTime = System.nanoTime();
        RedisMessage response;
        if (write) {
            writeLock.lock();
        }
        try {
            try {
                response = command.execute(storage, args, context);
            } catch (IllegalArgumentException e) {
                // 预期内的客户端错误 (参数个数、格式错误)：回复 nil，不写入也不传播
                log.warn("Command execution failed (Client Error): {} - {}", commandName, e.getMessage());
                return context.isMasterLink() ? null : BulkString.NULL;
            } catch (Exception e) {
                // 意料之外的系统错误
                log.error("Internal Server Error processing command: {}", commandName, e);
                return context.isMasterLink() ? null : new ErrorMessage("ERR internal error");
            }

            // 3. 写命令传播 (只有 Master 才传播，先写本地再传播)
            if (write && replicationManager.isMaster()) {
                replicationManager.propagate(args);
            }
        } finally {
            if (write) {
                writeLock.unlock();
            }
        }

        long duration = (System.nanoTime() - startTime) / 1000_000; // ms
        if (duration > 10) {
            log.warn("Slow command detected: {} cost {}ms", commandName, duration);
        }

        // 4. Master 链路上的命令不逐条回复
        if (context.isMasterLink() && !command.repliesOnMasterLink()) {
            return null;
        }
        return response;
    }
}
