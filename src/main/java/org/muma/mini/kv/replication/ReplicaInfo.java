package org.muma.mini.kv.replication;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import lombok.Getter;
import org.muma.mini.kv.protocol.RedisArray;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Master 端记录的一个 Slave 连接
 * <p>
 * 注册后先处于 pending 状态：期间传播的命令先缓存起来，
 * 全量同步回复写出之后晋升为 online，再按顺序补发缓存的命令。
 * 所有状态变更都在 this 上加锁，保证补发与新命令的顺序。
 */
public class ReplicaInfo {

    @Getter
    private final Channel channel;
    @Getter
    private final String host;
    @Getter
    private final int listeningPort;

    private final List<RedisArray> backlog = new ArrayList<>();
    private boolean online;

    public ReplicaInfo(Channel channel, String host, int listeningPort) {
        this.channel = channel;
        this.host = host;
        this.listeningPort = listeningPort;
    }

    public synchronized boolean isOnline() {
        return online;
    }

    /**
     * 在线则直接写出，否则缓存。
     * 缓存超过上限或写出失败时回调 onDrop，由调用方移除该 Slave。
     */
    synchronized void offer(RedisArray command, int backlogMax, Consumer<String> onDrop) {
        if (!online) {
            if (backlog.size() >= backlogMax) {
                backlog.clear();
                onDrop.accept("pending backlog exceeded " + backlogMax + " commands");
                return;
            }
            backlog.add(command);
            return;
        }
        channel.writeAndFlush(command).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                onDrop.accept("write failed");
            }
        });
    }

    /**
     * 晋升为 online，返回需要补发的命令 (调用方在持有同一把锁的情况下写出)
     */
    synchronized List<RedisArray> promote() {
        online = true;
        List<RedisArray> pending = new ArrayList<>(backlog);
        backlog.clear();
        return pending;
    }

    synchronized int backlogSize() {
        return backlog.size();
    }

    public String address() {
        return host + ":" + listeningPort;
    }

    @Override
    public String toString() {
        return "Replica{" + address() + ", online=" + isOnline() + "}";
    }
}
