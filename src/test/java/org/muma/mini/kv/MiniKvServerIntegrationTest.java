package org.muma.mini.kv;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.replication.ReplState;

import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 端到端测试：真实端口 + 真实 Socket
 */
class MiniKvServerIntegrationTest {

    private final List<MiniKvServer> servers = new ArrayList<>();
    private MiniKvServer master;

    @BeforeEach
    void setUp() {
        master = startServer(null);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        for (MiniKvServer server : servers) {
            server.shutdown();
        }
        for (MiniKvServer server : servers) {
            server.awaitTermination();
        }
    }

    private MiniKvServer startServer(String replicaOf) {
        MiniKvConfig config = new MiniKvConfig();
        config.setPort(0);
        config.setBindAddress("127.0.0.1");
        config.setWorkerThreads(2);
        config.setReplicaOf(replicaOf);
        config.setReplBackoffMillis(100);
        MiniKvServer server = new MiniKvServer(config);
        server.start();
        servers.add(server);
        return server;
    }

    private static void await(BooleanSupplier condition, String what) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for " + what);
            }
            Thread.sleep(20);
        }
    }

    @Test
    void testPingAndEcho() throws Exception {
        try (RespTestClient client = new RespTestClient(master.getPort())) {
            assertEquals(SimpleString.PONG, client.call("PING"));
            assertEquals(new BulkString("hey"), client.call("ECHO", "hey"));
        }
    }

    @Test
    void testSetGetDel() throws Exception {
        try (RespTestClient client = new RespTestClient(master.getPort())) {
            assertEquals(SimpleString.OK, client.call("SET", "foo", "bar"));
            assertEquals(new BulkString("bar"), client.call("GET", "foo"));
            assertEquals(new RedisInteger(1), client.call("DEL", "foo", "other"));
            assertEquals(BulkString.NULL, client.call("GET", "foo"));
            assertEquals(new RedisInteger(0), client.call("EXISTS", "foo"));
        }
    }

    @Test
    void testKeyExpiresAfterPx() throws Exception {
        try (RespTestClient client = new RespTestClient(master.getPort())) {
            assertEquals(SimpleString.OK, client.call("SET", "test", "value", "PX", "100"));
            assertEquals(new BulkString("value"), client.call("GET", "test"));

            Thread.sleep(150);
            assertEquals(BulkString.NULL, client.call("GET", "test"));
        }
    }

    @Test
    void testUnknownCommandGetsNoReply() throws Exception {
        try (RespTestClient client = new RespTestClient(master.getPort())) {
            client.send("FOOBAR", "x");
            assertTrue(client.noReplyWithin(200));

            // 连接仍然可用
            assertEquals(SimpleString.PONG, client.call("PING"));
        }
    }

    @Test
    void testPipelinedRequestsInOneWrite() throws Exception {
        try (RespTestClient client = new RespTestClient(master.getPort())) {
            client.sendRaw("*1\r\n$4\r\nPING\r\n"
                    + "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n"
                    + "*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");

            assertEquals(SimpleString.PONG, client.read());
            assertEquals(SimpleString.OK, client.read());
            assertEquals(new BulkString("v"), client.read());
        }
    }

    @Test
    void testMalformedInputClosesOnlyThatConnection() throws Exception {
        try (RespTestClient bad = new RespTestClient(master.getPort());
             RespTestClient good = new RespTestClient(master.getPort())) {
            bad.sendRaw("hello world\r\n");
            assertTrue(bad.isClosedByServer());

            assertEquals(SimpleString.PONG, good.call("PING"));
        }
    }

    @Test
    void testConcurrentClients() throws Exception {
        int clients = 4;
        int perClient = 200;
        ExecutorService pool = Executors.newFixedThreadPool(clients);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int c = 0; c < clients; c++) {
                final int id = c;
                futures.add(pool.submit(() -> {
                    try (RespTestClient client = new RespTestClient(master.getPort())) {
                        for (int i = 0; i < perClient; i++) {
                            assertEquals(SimpleString.OK, client.call("SET", "c" + id + ":" + i, String.valueOf(i)));
                        }
                    }
                    return null;
                }));
            }
            for (Future<?> f : futures) {
                f.get(20, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(clients * perClient, master.getStorage().size());
        try (RespTestClient client = new RespTestClient(master.getPort())) {
            assertEquals(new BulkString("199"), client.call("GET", "c3:199"));
        }
    }

    @Test
    void testReplicaReceivesWrites() throws Exception {
        MiniKvServer replica = startServer("127.0.0.1 " + master.getPort());

        await(() -> replica.getReplicationManager().getState() == ReplState.CONNECTED, "replica handshake");
        await(() -> master.getReplicationManager().replicaCount() == 1, "master to register replica");

        try (RespTestClient client = new RespTestClient(master.getPort())) {
            assertEquals(SimpleString.OK, client.call("SET", "foo", "123"));
            assertEquals(SimpleString.OK, client.call("SET", "bar", "456"));
            assertEquals(SimpleString.OK, client.call("SET", "tmp", "x"));
            assertEquals(new RedisInteger(1), client.call("DEL", "tmp"));
            assertEquals(SimpleString.OK, client.call("SET", "done", "1"));

            RedisMessage info = client.call("INFO", "replication");
            assertTrue(((SimpleString) info).content().contains("connected_slaves:1"));
        }

        // 命令按顺序应用，看到最后一条即说明前面的都已生效
        await(() -> replica.getStorage().get("done") != null, "replication stream");
        try (RespTestClient client = new RespTestClient(replica.getPort())) {
            assertEquals(new BulkString("123"), client.call("GET", "foo"));
            assertEquals(new BulkString("456"), client.call("GET", "bar"));
            assertEquals(BulkString.NULL, client.call("GET", "tmp"));

            RedisMessage info = client.call("INFO");
            assertTrue(((SimpleString) info).content().startsWith("role:slave"));
        }
        assertTrue(master.getReplicationManager().getMetadata().getReplOffset() > 0);
    }

    @Test
    void testReplicaReconnectsWhenMasterStartsLater() throws Exception {
        // 先拿一个空闲端口，Master 稍后才启动
        int masterPort;
        try (ServerSocket free = new ServerSocket(0)) {
            masterPort = free.getLocalPort();
        }
        MiniKvServer replica = startServer("127.0.0.1 " + masterPort);
        Thread.sleep(300);
        assertNotEquals(ReplState.CONNECTED, replica.getReplicationManager().getState());

        MiniKvConfig config = new MiniKvConfig();
        config.setPort(masterPort);
        config.setBindAddress("127.0.0.1");
        MiniKvServer lateMaster = new MiniKvServer(config);
        lateMaster.start();
        servers.add(lateMaster);

        await(() -> replica.getReplicationManager().getState() == ReplState.CONNECTED, "replica to connect");
        await(() -> lateMaster.getReplicationManager().replicaCount() == 1, "master to register replica");
        try (RespTestClient client = new RespTestClient(lateMaster.getPort())) {
            client.call("SET", "late", "yes");
        }
        await(() -> replica.getStorage().get("late") != null, "replication of late");
    }

    @Test
    void testShutdownCommand() throws Exception {
        try (RespTestClient client = new RespTestClient(master.getPort())) {
            assertEquals(SimpleString.OK, client.call("SHUTDOWN"));
        }
        await(() -> !master.isRunning(), "server to stop");
        master.awaitTermination();
    }
}
