package org.muma.mini.kv.replication;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.timeout.ReadTimeoutHandler;
import lombok.Getter;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.RespCodec;
import org.muma.mini.kv.protocol.RespDecoder;
import org.muma.mini.kv.protocol.RespEncoder;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.server.RedisCommandHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 复制管理器 (Replication Manager)
 * 同时负责 Master 和 Slave 的角色逻辑，角色在启动后不再改变。
 */
public class ReplicationManager {

    private static final Logger log = LoggerFactory.getLogger(ReplicationManager.class);

    static final String HANDLER_TIMEOUT = "handshakeTimeout";
    static final String HANDLER_HANDSHAKE = "handshake";
    static final String HANDLER_COMMAND = "command";

    private final MiniKvConfig config;

    // --- Getters ---
    @Getter
    private final ReplicationMetadata metadata;
    @Getter
    private volatile ReplState state;

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    // --- Slave 角色字段 ---
    private volatile Channel masterChannel;
    private EventLoopGroup group;
    private CommandDispatcher dispatcher;
    private int ownPort;

    // --- Master 角色字段 ---
    // 已注册的 Slave 连接 (REPLCONF listening-port 之后加入)
    private final Map<Channel, ReplicaInfo> replicas = new ConcurrentHashMap<>();

    public ReplicationManager(MiniKvConfig config) {
        this.config = config;
        this.metadata = new ReplicationMetadata(config.getReplicaOfHost(), config.getReplicaOfPort());
        this.state = isMaster() ? ReplState.NONE : ReplState.CONNECT;
    }

    public boolean isMaster() {
        return config.getRole() == MiniKvConfig.Role.MASTER;
    }

    /**
     * INFO 输出的复制摘要 (单行，适合放进 SimpleString)
     */
    public String infoLine() {
        return "role:" + (isMaster() ? "master" : "slave")
                + ", connected_slaves:" + replicaCount()
                + ", master_replid:" + metadata.getReplId()
                + ", master_repl_offset:" + metadata.getReplOffset();
    }

    // =========================================================
    // Master 角色逻辑
    // =========================================================

    /**
     * REPLCONF listening-port 时注册 Slave，此时处于 pending 状态
     */
    public ReplicaInfo registerReplica(Channel channel, int listeningPort) {
        ReplicaInfo replica = new ReplicaInfo(channel, remoteHost(channel.remoteAddress()), listeningPort);
        ReplicaInfo existing = replicas.putIfAbsent(channel, replica);
        if (existing != null) {
            log.debug("Replica already registered: {}", existing);
            return existing;
        }
        // 连接关闭时自动移除
        channel.closeFuture().addListener((ChannelFutureListener) f -> {
            if (replicas.remove(channel, replica)) {
                log.info("Replica {} disconnected, {} replicas left", replica.address(), replicas.size());
            }
        });
        // 迟迟不发 PSYNC 的 Slave 不能一直占着 pending 缓存
        long timeout = config.getReplHandshakeTimeoutMillis();
        channel.eventLoop().schedule(() -> {
            if (!replica.isOnline()) {
                dropReplica(replica, "no PSYNC within " + timeout + "ms");
            }
        }, timeout, TimeUnit.MILLISECONDS);
        log.info("New replica registered: {}", replica.address());
        return replica;
    }

    /**
     * 处理 PSYNC：写出 +FULLRESYNC 与占位快照 (同一次 flush，中间没有帧边界)，
     * 然后把该 Slave 晋升为 online 并补发 pending 期间缓存的命令。
     */
    public void fullResync(ChannelHandlerContext ctx) {
        ReplicaInfo replica = replicas.get(ctx.channel());
        if (replica == null) {
            // 没有先发 REPLCONF listening-port 的 Slave，端口未知
            replica = registerReplica(ctx.channel(), -1);
        }

        synchronized (replica) {
            String reply = "FULLRESYNC " + metadata.getReplId() + " " + metadata.getReplOffset();
            log.info("Full resync with replica {}: {}", replica.address(), reply);
            ctx.write(new SimpleString(reply));
            ctx.write(EmptySnapshot.payload());

            List<RedisArray> pending = replica.promote();
            if (!pending.isEmpty()) {
                log.info("Promoting replica to online. Replaying {} buffered commands.", pending.size());
            }
            for (RedisArray cmd : pending) {
                ctx.write(cmd); // write 不 flush
            }
        }
        ctx.flush();
    }

    /**
     * 命令传播 (Propagate)
     * 在 Master 执行完写命令之后调用，逐个写给已注册的 Slave；
     * 写失败或 pending 缓存溢出的 Slave 直接移除，不重试也不影响其它 Slave。
     */
    public void propagate(RedisArray command) {
        metadata.addOffset(RespCodec.encode(command).length);

        for (ReplicaInfo replica : replicas.values()) {
            if (!replica.getChannel().isActive()) {
                dropReplica(replica, "channel inactive");
                continue;
            }
            replica.offer(command, config.getReplBacklogMax(), reason -> dropReplica(replica, reason));
        }
    }

    public int replicaCount() {
        return replicas.size();
    }

    private void dropReplica(ReplicaInfo replica, String reason) {
        if (replicas.remove(replica.getChannel(), replica)) {
            log.warn("Dropping replica {}: {}", replica.address(), reason);
        }
        replica.getChannel().close();
    }

    private static String remoteHost(SocketAddress address) {
        if (address instanceof InetSocketAddress inet) {
            return inet.getHostString();
        }
        return String.valueOf(address);
    }

    // =========================================================
    // Slave 角色逻辑
    // =========================================================

    /**
     * 以 Slave 身份启动复制：连接 Master 并完成握手，失败后按固定间隔无限重试直到 shutdown。
     *
     * @param ownPort 本节点实际监听的端口，通过 REPLCONF listening-port 告知 Master
     */
    public void startReplication(EventLoopGroup group, CommandDispatcher dispatcher, int ownPort) {
        if (isMaster()) {
            throw new IllegalStateException("Node is a master, nothing to replicate from");
        }
        this.group = group;
        this.dispatcher = dispatcher;
        this.ownPort = ownPort;
        log.info("Replica of {}:{} enabled, state: CONNECT", metadata.getMasterHost(), metadata.getMasterPort());
        connectToMaster();
    }

    private void connectToMaster() {
        if (shutdown.get()) {
            return;
        }
        state = ReplState.CONNECTING;
        long handshakeTimeout = config.getReplHandshakeTimeoutMillis();

        Bootstrap b = new Bootstrap();
        b.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) handshakeTimeout)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(HANDLER_TIMEOUT, new ReadTimeoutHandler(handshakeTimeout, TimeUnit.MILLISECONDS))
                                .addLast(new RespDecoder(true))
                                .addLast(new RespEncoder())
                                .addLast(HANDLER_HANDSHAKE, new RedisSlaveHandler(ReplicationManager.this));
                    }
                });

        b.connect(metadata.getMasterHost(), metadata.getMasterPort())
                .addListener((ChannelFutureListener) future -> {
                    if (future.isSuccess()) {
                        log.info("Connected to master {}:{}", metadata.getMasterHost(), metadata.getMasterPort());
                        Channel ch = future.channel();
                        masterChannel = ch;
                        ch.closeFuture().addListener((ChannelFutureListener) f -> onMasterLinkClosed(ch));
                        if (shutdown.get()) {
                            ch.close();
                            return;
                        }
                        sendPing();
                    } else {
                        log.warn("Failed to connect to master {}:{}: {}", metadata.getMasterHost(),
                                metadata.getMasterPort(), future.cause().getMessage());
                        scheduleReconnect();
                    }
                });
    }

    private void onMasterLinkClosed(Channel ch) {
        if (masterChannel == ch) {
            masterChannel = null;
        }
        if (shutdown.get()) {
            return;
        }
        if (state.isHandshaking()) {
            log.warn("Link with master closed during handshake (state {})", state);
        } else {
            log.warn("Link with master lost in state {}", state);
        }
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        state = ReplState.CONNECT;
        if (shutdown.get() || group.isShuttingDown()) {
            return;
        }
        long backoff = config.getReplBackoffMillis();
        log.info("Reconnecting to master in {}ms", backoff);
        try {
            group.schedule(this::connectToMaster, backoff, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Event loop is shutting down, reconnect cancelled");
        }
    }

    // --- State Actions ---
    void sendPing() {
        state = ReplState.RECEIVE_PONG;
        writeToMaster(RedisArray.of("PING"));
    }

    void sendReplConfPort() {
        state = ReplState.SEND_PORT;
        writeToMaster(RedisArray.of("REPLCONF", "listening-port", String.valueOf(ownPort)));
    }

    void sendReplConfCapa() {
        state = ReplState.SEND_CAPA;
        writeToMaster(RedisArray.of("REPLCONF", "capa", "eof", "capa", "psync2"));
    }

    void sendPsync() {
        state = ReplState.RECEIVE_PSYNC;
        writeToMaster(RedisArray.of("PSYNC", "?", "-1"));
    }

    // --- Callbacks for Handler ---

    void handleFullResync(String replId, long offset) {
        log.info("Full resync accepted. Master replid: {}, offset: {}", replId, offset);
        metadata.setCachedMasterReplId(replId);
        metadata.setCachedMasterOffset(offset);
        state = ReplState.TRANSFER;
    }

    /**
     * 快照接收完毕：移除握手超时，把握手 Handler 换成普通的命令处理 Handler，
     * 之后 Master 传播来的命令与普通客户端的命令走同一条处理路径。
     */
    void handleSnapshotLoaded(ChannelHandlerContext ctx, int snapshotLength) {
        log.info("Snapshot of {} bytes received and discarded, streaming commands from master", snapshotLength);
        state = ReplState.CONNECTED;
        if (ctx.pipeline().get(HANDLER_TIMEOUT) != null) {
            ctx.pipeline().remove(HANDLER_TIMEOUT);
        }
        ctx.pipeline().replace(ctx.handler(), HANDLER_COMMAND, new RedisCommandHandler(dispatcher, true));
    }

    private void writeToMaster(RedisMessage msg) {
        Channel ch = masterChannel;
        if (ch != null && ch.isActive()) {
            ch.writeAndFlush(msg).addListener((ChannelFutureListener) f -> {
                if (!f.isSuccess()) {
                    log.warn("Failed to write to master: {}", f.cause().getMessage());
                    f.channel().close();
                }
            });
        }
    }

    // =========================================================
    // Lifecycle
    // =========================================================

    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        Channel ch = masterChannel;
        if (ch != null) {
            ch.close();
        }
        for (ReplicaInfo replica : replicas.values()) {
            replica.getChannel().close();
        }
        replicas.clear();
        if (!isMaster()) {
            state = ReplState.CONNECT;
        }
        log.info("Replication manager stopped");
    }
}
