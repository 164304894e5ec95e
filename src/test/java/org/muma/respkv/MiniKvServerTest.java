package org.muma.respkv;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.respkv.config.MiniKvConfig;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MiniKvServerTest {

    private MiniKvServer server;
    private int port;

    @BeforeEach
    void setUp() throws InterruptedException {
        MiniKvConfig config = new MiniKvConfig();
        config.setBind("127.0.0.1");
        config.setPort(0);
        config.setMaxClients(4);
        config.setExpireHz(50);
        config.setShutdownTimeoutMs(2000);
        server = new MiniKvServer(config);
        server.start();
        port = server.getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void testBasicRoundTrip() throws IOException {
        try (RespTestClient client = new RespTestClient(port)) {
            assertEquals(SimpleString.PONG, client.call("PING"));
            assertEquals(SimpleString.OK, client.call("SET", "greeting", "hello"));
            assertEquals(new BulkString("hello"), client.call("GET", "greeting"));
            assertEquals(BulkString.NULL, client.call("GET", "missing"));
            assertEquals(new RedisInteger(1), client.call("DEL", "greeting"));
            assertEquals(RedisInteger.ZERO, client.call("EXISTS", "greeting"));
        }
    }

    @Test
    void testPipelinedBatchAnsweredInOrder() throws IOException {
        try (RespTestClient client = new RespTestClient(port)) {
            StringBuilder batch = new StringBuilder();
            for (int i = 0; i < 100; i++) {
                batch.append(RespTestClient.encode("INCR", "counter"));
            }
            batch.append("PING\r\n");
            client.sendRaw(batch.toString());

            for (int i = 1; i <= 100; i++) {
                assertEquals(new RedisInteger(i), client.read());
            }
            assertEquals(SimpleString.PONG, client.read());
        }
    }

    @Test
    void testKeyExpiresOverTime() throws Exception {
        try (RespTestClient client = new RespTestClient(port)) {
            assertEquals(SimpleString.OK, client.call("SET", "session", "x", "PX", "100"));
            assertEquals(new BulkString("x"), client.call("GET", "session"));

            Thread.sleep(250);
            assertEquals(BulkString.NULL, client.call("GET", "session"));
            assertEquals(new RedisInteger(-2), client.call("TTL", "session"));
        }
    }

    @Test
    void testWrongTypeKeepsConnectionUsable() throws IOException {
        try (RespTestClient client = new RespTestClient(port)) {
            client.call("RPUSH", "list", "a", "b");
            RedisMessage reply = client.call("GET", "list");
            assertInstanceOf(ErrorMessage.class, reply);
            assertTrue(((ErrorMessage) reply).content().startsWith("WRONGTYPE"));

            assertEquals(new RedisArray(new RedisMessage[]{new BulkString("a"), new BulkString("b")}),
                    client.call("LRANGE", "list", "0", "-1"));
        }
    }

    @Test
    void testMalformedInputClosesOnlyThatConnection() throws IOException {
        try (RespTestClient bad = new RespTestClient(port);
             RespTestClient good = new RespTestClient(port)) {
            bad.sendRaw(RespTestClient.encode("SET", "k", "v") + "*1\r\n$-5\r\n");
            assertEquals(SimpleString.OK, bad.read());
            assertTrue(bad.isClosedByServer());

            assertEquals(new BulkString("v"), good.call("GET", "k"));
        }
    }

    @Test
    void testQuitClosesConnection() throws IOException {
        try (RespTestClient client = new RespTestClient(port)) {
            assertEquals(SimpleString.OK, client.call("QUIT"));
            assertTrue(client.isClosedByServer());
        }
    }

    @Test
    void testConcurrentClientsIncrementAtomically() throws Exception {
        int clients = 4;
        int perClient = 250;
        ExecutorService pool = Executors.newFixedThreadPool(clients);
        List<Future<?>> futures = new ArrayList<>();
        for (int c = 0; c < clients; c++) {
            futures.add(pool.submit(() -> {
                try (RespTestClient client = new RespTestClient(port)) {
                    for (int i = 0; i < perClient; i++) {
                        assertInstanceOf(RedisInteger.class, client.call("INCR", "shared"));
                    }
                }
                return null;
            }));
        }
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        try (RespTestClient client = new RespTestClient(port)) {
            assertEquals(new BulkString(String.valueOf(clients * perClient)), client.call("GET", "shared"));
        }
    }

    @Test
    void testMaxClientsRejectsExtraConnection() throws Exception {
        List<RespTestClient> admitted = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                RespTestClient c = new RespTestClient(port);
                assertEquals(SimpleString.PONG, c.call("PING"));
                admitted.add(c);
            }
            try (RespTestClient extra = new RespTestClient(port)) {
                assertEquals(new ErrorMessage("ERR max number of clients reached"), extra.read());
                assertTrue(extra.isClosedByServer());
            }
            assertEquals(4, server.getConnectedClients());
        } finally {
            for (RespTestClient c : admitted) {
                c.close();
            }
        }
    }

    @Test
    void testStopClosesClientsAndRefusesNewOnes() throws Exception {
        RespTestClient client = new RespTestClient(port);
        try {
            assertEquals(SimpleString.OK, client.call("SET", "k", "v"));
            server.stop();
            assertTrue(client.isClosedByServer());
        } finally {
            client.close();
        }
        assertThrows(IOException.class, () -> new RespTestClient(port).close());
        assertFalse(server.getContext().getReaper().isRunning());
    }
}
