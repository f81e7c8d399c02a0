package org.muma.mini.kv.replication;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.ReferenceCountUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.RespCodec;
import org.muma.mini.kv.protocol.RespDecoder;
import org.muma.mini.kv.protocol.RespEncoder;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.protocol.SnapshotPayload;
import org.muma.mini.kv.server.RedisCommandHandler;
import org.muma.mini.kv.store.impl.MemoryStorageEngine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ReplicationManagerTest {

    private ReplicationManager manager;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        MiniKvConfig config = new MiniKvConfig();
        manager = new ReplicationManager(config);
        dispatcher = new CommandDispatcher(new MemoryStorageEngine(), manager, () -> {
        });
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    // 模拟一个连到 Master 的 Slave 连接
    private EmbeddedChannel replicaConnection() {
        return new EmbeddedChannel(new RespDecoder(), new RespEncoder(), new RedisCommandHandler(dispatcher));
    }

    private void send(EmbeddedChannel ch, RedisArray cmd) {
        ch.writeInbound(Unpooled.wrappedBuffer(RespCodec.encode(cmd)));
    }

    private ByteBuf drainOutbound(EmbeddedChannel ch) {
        ByteBuf all = Unpooled.buffer();
        ByteBuf buf;
        while ((buf = ch.readOutbound()) != null) {
            all.writeBytes(buf);
            buf.release();
        }
        return all;
    }

    @Test
    void testMasterMetadata() {
        assertTrue(manager.isMaster());
        assertEquals(ReplState.NONE, manager.getState());
        assertEquals(40, manager.getMetadata().getReplId().length());
        assertTrue(manager.getMetadata().getReplId().matches("[0-9a-f]{40}"));
        assertEquals(0, manager.getMetadata().getReplOffset());
        assertTrue(manager.infoLine().startsWith("role:master, connected_slaves:0, master_replid:"));
    }

    @Test
    void testOffsetAdvancesByEncodedLength() {
        RedisArray set = RedisArray.of("SET", "foo", "bar");
        manager.propagate(set);
        manager.propagate(set);

        assertEquals(2L * RespCodec.encode(set).length, manager.getMetadata().getReplOffset());
    }

    @Test
    void testFullResyncReplaysPendingCommands() {
        EmbeddedChannel replica = replicaConnection();
        try {
            send(replica, RedisArray.of("REPLCONF", "listening-port", "6380"));
            assertEquals("+OK\r\n", drainOutbound(replica).toString(StandardCharsets.UTF_8));
            assertEquals(1, manager.replicaCount());

            // 注册之后、PSYNC 之前的写命令先缓存
            RedisArray pending = RedisArray.of("SET", "early", "1");
            manager.propagate(pending);
            assertNull(replica.readOutbound());

            send(replica, RedisArray.of("REPLCONF", "capa", "eof", "capa", "psync2"));
            assertEquals("+OK\r\n", drainOutbound(replica).toString(StandardCharsets.UTF_8));

            send(replica, RedisArray.of("PSYNC", "?", "-1"));
            ByteBuf out = drainOutbound(replica);

            RedisMessage header = RespCodec.decode(out);
            String expected = "FULLRESYNC " + manager.getMetadata().getReplId() + " "
                    + RespCodec.encode(pending).length;
            assertEquals(new SimpleString(expected), header);

            SnapshotPayload snapshot = RespCodec.decodeSnapshot(out);
            assertNotNull(snapshot);
            assertTrue(new String(snapshot.content(), StandardCharsets.US_ASCII).startsWith("REDIS"));

            assertEquals(pending, RespCodec.decode(out));
            assertFalse(out.isReadable());
            out.release();

            // 晋升为 online 之后直接写出
            RedisArray live = RedisArray.of("DEL", "early");
            manager.propagate(live);
            ByteBuf next = drainOutbound(replica);
            assertEquals(live, RespCodec.decode(next));
            next.release();
        } finally {
            replica.finishAndReleaseAll();
        }
    }

    @Test
    void testPsyncWithoutListeningPortStillRegisters() {
        EmbeddedChannel replica = replicaConnection();
        try {
            send(replica, RedisArray.of("PSYNC", "?", "-1"));
            assertEquals(1, manager.replicaCount());
            ByteBuf out = drainOutbound(replica);
            assertInstanceOf(SimpleString.class, RespCodec.decode(out));
            out.release();
        } finally {
            replica.finishAndReleaseAll();
        }
    }

    @Test
    void testPendingReplicaBuffersInsteadOfWriting() {
        EmbeddedChannel replica = replicaConnection();
        try {
            ReplicaInfo info = manager.registerReplica(replica, 6381);
            assertFalse(info.isOnline());

            manager.propagate(RedisArray.of("SET", "a", "1"));
            manager.propagate(RedisArray.of("SET", "b", "2"));

            assertEquals(2, info.backlogSize());
            assertNull(replica.readOutbound());
            // 重复注册返回同一个对象
            assertSame(info, manager.registerReplica(replica, 6381));
        } finally {
            replica.finishAndReleaseAll();
        }
    }

    @Test
    void testClosedReplicaIsRemoved() {
        EmbeddedChannel replica = replicaConnection();
        send(replica, RedisArray.of("REPLCONF", "listening-port", "6380"));
        assertEquals(1, manager.replicaCount());

        replica.close();
        replica.runPendingTasks();

        assertEquals(0, manager.replicaCount());
        // 之后的传播不受影响
        manager.propagate(RedisArray.of("SET", "x", "y"));
        replica.finishAndReleaseAll();
    }

    @Test
    void testWriteFailureDropsReplica() {
        // 所有写出都失败的连接
        EmbeddedChannel broken = new EmbeddedChannel(new ChannelOutboundHandlerAdapter() {
            @Override
            public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
                ReferenceCountUtil.release(msg);
                promise.setFailure(new IOException("Broken pipe"));
            }
        }, new RespEncoder());
        EmbeddedChannel healthy = replicaConnection();
        try {
            manager.registerReplica(broken, 6380).promote();
            manager.registerReplica(healthy, 6381).promote();
            assertEquals(2, manager.replicaCount());

            RedisArray cmd = RedisArray.of("SET", "k", "v");
            manager.propagate(cmd);
            broken.runPendingTasks();

            assertEquals(1, manager.replicaCount());
            assertFalse(broken.isOpen());
            ByteBuf out = drainOutbound(healthy);
            assertEquals(cmd, RespCodec.decode(out));
            out.release();
        } finally {
            broken.finishAndReleaseAll();
            healthy.finishAndReleaseAll();
        }
    }

    @Test
    void testPendingBacklogOverflowDropsReplica() {
        MiniKvConfig config = new MiniKvConfig();
        config.setReplBacklogMax(3);
        ReplicationManager limited = new ReplicationManager(config);
        EmbeddedChannel replica = replicaConnection();
        try {
            ReplicaInfo info = limited.registerReplica(replica, 7000);
            for (int i = 0; i < 3; i++) {
                limited.propagate(RedisArray.of("SET", "k" + i, "v"));
            }
            assertEquals(3, info.backlogSize());
            assertEquals(1, limited.replicaCount());

            // 第 4 条超出上限：缓存清空，连接断开
            limited.propagate(RedisArray.of("SET", "k3", "v"));
            replica.runPendingTasks();

            assertEquals(0, info.backlogSize());
            assertEquals(0, limited.replicaCount());
            assertFalse(replica.isOpen());
            assertTrue(limited.infoLine().contains("connected_slaves:0"));
        } finally {
            limited.shutdown();
            replica.finishAndReleaseAll();
        }
    }

    @Test
    void testReplicaWithoutPsyncIsDroppedAfterTimeout() throws Exception {
        MiniKvConfig config = new MiniKvConfig();
        config.setReplHandshakeTimeoutMillis(50);
        ReplicationManager strict = new ReplicationManager(config);
        EmbeddedChannel replica = replicaConnection();
        try {
            strict.registerReplica(replica, 7000);
            strict.propagate(RedisArray.of("SET", "a", "1"));
            assertEquals(1, strict.replicaCount());

            Thread.sleep(100);
            replica.runScheduledPendingTasks();

            assertEquals(0, strict.replicaCount());
            assertFalse(replica.isOpen());
        } finally {
            strict.shutdown();
            replica.finishAndReleaseAll();
        }
    }

    @Test
    void testOnlineReplicaSurvivesPsyncTimeout() throws Exception {
        MiniKvConfig config = new MiniKvConfig();
        config.setReplHandshakeTimeoutMillis(50);
        ReplicationManager strict = new ReplicationManager(config);
        EmbeddedChannel replica = replicaConnection();
        try {
            strict.registerReplica(replica, 7000).promote();

            Thread.sleep(100);
            replica.runScheduledPendingTasks();

            assertEquals(1, strict.replicaCount());
            assertTrue(replica.isOpen());
        } finally {
            strict.shutdown();
            replica.finishAndReleaseAll();
        }
    }

    @Test
    void testReplicaRoleRejectsStartOnMaster() {
        assertThrows(IllegalStateException.class, () -> manager.startReplication(null, dispatcher, 0));
    }
}
