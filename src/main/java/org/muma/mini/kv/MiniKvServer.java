package org.muma.mini.kv;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.GlobalEventExecutor;
import lombok.Getter;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.protocol.RespDecoder;
import org.muma.mini.kv.protocol.RespEncoder;
import org.muma.mini.kv.replication.ReplicationManager;
import org.muma.mini.kv.server.RedisCommandHandler;
import org.muma.mini.kv.store.StorageEngine;
import org.muma.mini.kv.store.impl.MemoryStorageEngine;
import org.muma.mini.kv.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mini-KV 节点
 * <p>
 * 负责组装各个模块并管理生命周期：start() 绑定端口 (Slave 同时开始复制)，shutdown() 关闭监听和所有连接。
 * 每个实例的配置、存储、复制状态相互独立。
 */
public class MiniKvServer {

    private static final Logger log = LoggerFactory.getLogger(MiniKvServer.class);

    @Getter
    private final MiniKvConfig config;
    @Getter
    private final StorageEngine storage;
    @Getter
    private final ReplicationManager replicationManager;
    private final CommandDispatcher dispatcher;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private ChannelGroup allChannels;
    private Channel serverChannel;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public MiniKvServer(MiniKvConfig config) {
        this(config, new MemoryStorageEngine());
    }

    public MiniKvServer(MiniKvConfig config, StorageEngine storage) {
        this.config = config;
        this.storage = storage;
        this.replicationManager = new ReplicationManager(config);
        this.dispatcher = new CommandDispatcher(storage, replicationManager, this::shutdown);
    }

    /**
     * 绑定端口并开始服务。绑定失败是唯一的致命错误。
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Server already started");
        }
        bossGroup = new NioEventLoopGroup(1, ThreadUtils.namedThreadFactory("minikv-boss"));
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads(), ThreadUtils.namedThreadFactory("minikv-worker"));
        allChannels = new DefaultChannelGroup("minikv-clients", GlobalEventExecutor.INSTANCE);

        var bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                .handler(new LoggingHandler(LogLevel.DEBUG))
                .option(ChannelOption.SO_REUSEADDR, true)
                // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        allChannels.add(ch);
                        ch.pipeline()
                                .addLast(new RespDecoder())
                                .addLast(new RespEncoder())
                                .addLast(new RedisCommandHandler(dispatcher));
                    }
                });

        log.info("Starting Mini-KV {} on {}:{}", config.getRole(), config.getBindAddress(), config.getPort());
        try {
            serverChannel = bootstrap.bind(config.getBindAddress(), config.getPort()).sync().channel();
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            bossGroup.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
            workerGroup.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
            throw new IllegalStateException("Failed to bind port " + config.getPort(), e);
        }

        if (config.isActiveExpire()) {
            long interval = config.getActiveExpireIntervalMillis();
            int sampleSize = config.getActiveExpireSampleSize();
            workerGroup.scheduleAtFixedRate(() -> storage.activeExpireCycle(sampleSize),
                    interval, interval, TimeUnit.MILLISECONDS);
        }

        if (config.getRole() == MiniKvConfig.Role.REPLICA) {
            replicationManager.startReplication(workerGroup, dispatcher, getPort());
        }
        log.info("Mini-KV started successfully on port {}", getPort());
    }

    /**
     * 实际监听的端口 (配置为 0 时由系统分配)
     */
    public int getPort() {
        if (serverChannel == null) {
            return config.getPort();
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public boolean isRunning() {
        return started.get() && !shutdown.get();
    }

    /**
     * 优雅关闭：停止接受新连接，关闭所有连接，停止复制与后台任务。
     * 可重复调用，也可以在 EventLoop 线程里调用 (SHUTDOWN 命令)。
     */
    public void shutdown() {
        if (!started.get() || !shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down Mini-KV on port {} ({} keys in memory)", getPort(), storage.size());

        replicationManager.shutdown();
        if (serverChannel != null) {
            serverChannel.close();
        }
        allChannels.close();
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    /**
     * 阻塞直到所有 EventLoop 线程退出
     */
    public void awaitTermination() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
        if (workerGroup != null) {
            workerGroup.terminationFuture().sync();
            bossGroup.terminationFuture().sync();
        }
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. 初始化配置并解析参数
        MiniKvConfig config = MiniKvConfig.fromArgs(args);
        MiniKvServer server = new MiniKvServer(config);
        try {
            server.start();
        } catch (IllegalStateException e) {
            log.error("Failed to start server", e);
            System.exit(1);
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::shutdown, "minikv-shutdown-hook"));
        server.awaitTermination();
        log.info("Mini-KV stopped.");
    }
}
