package org.muma.mini.kv.command;

import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

public interface RedisCommand {

    /**
     * 执行命令，传入存储引擎和参数
     *
     * @return 响应；null 表示什么都不写回
     * @throws IllegalArgumentException 参数个数或格式错误
     */
    RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context);

    /**
     * 辅助工具：校验参数个数 (包含命令名本身)，max 为 -1 表示不限
     */
    default void checkArity(RedisArray args, int min, int max, String cmd) {
        int n = args.size();
        if (n < min || (max >= 0 && n > max)) {
            throw new IllegalArgumentException("wrong number of arguments for '" + cmd + "' command");
        }
    }

    /**
     * 辅助工具：解析整数参数
     */
    default long parseLong(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("value is not an integer or out of range");
        }
    }

    // 默认不是写命令，SET/DEL 等需要覆盖返回 true，Master 执行成功后会传播给 Slave
    default boolean isWrite() {
        return false;
    }

    // 在 Master 复制链路上默认不回复 (Slave 不逐条确认 Master 传播来的命令)
    default boolean repliesOnMasterLink() {
        return false;
    }
}
