package net.belfry.ws;

import java.net.InetSocketAddress;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import net.belfry.api.TransportState;
import net.belfry.proto.ChannelRegistry;
import net.belfry.proto.Connection;
import net.belfry.proto.HeartbeatMonitor;
import net.belfry.proto.MessageRouter;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.handshake.ServerHandshake;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

class RelayWebSocketServerTest {

    private static final long TIMEOUT = 5000;
    private static final Map<String, String> NO_HEADERS =
        Collections.<String, String>emptyMap();

    private final List<LogRecord> records =
        Collections.synchronizedList(new ArrayList<LogRecord>());
    private final Handler recorder = new Handler() {
        public void publish(LogRecord record) {
            records.add(record);
        }
        public void flush() {}
        public void close() {}
    };

    private final List<Client> clients = new ArrayList<Client>();
    private ScheduledExecutorService eventLoop;
    private ChannelRegistry registry;
    private HeartbeatMonitor monitor;
    private RelayWebSocketServer server;

    @BeforeEach
    void setUp() {
        eventLoop = Executors.newSingleThreadScheduledExecutor();
        registry = new ChannelRegistry();
        monitor = new HeartbeatMonitor(registry);
        Logger.getLogger("RelayWSServer").addHandler(recorder);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        Logger.getLogger("RelayWSServer").removeHandler(recorder);
        for (Client c : clients) c.close();
        if (server != null) server.stop(1000);
        eventLoop.shutdownNow();
    }

    @Test
    void relaysPingsAndDirectsBetweenRealClients() throws Exception {
        start(new MessageRouter(registry, 150));
        Client host = connect("/game1/host");
        Client p1 = connect("/game1/p1");
        awaitTrue(new BooleanSupplier() {
            public boolean getAsBoolean() {
                return registry.getConnectionCount() == 2;
            }
        });

        host.send("[\"ping\",\"latency\"]");
        String ping = p1.received.poll(TIMEOUT, TimeUnit.MILLISECONDS);
        assertNotNull(ping);
        assertTrue(ping.matches("\\[\"ping\",\\d+\\]"), ping);

        p1.send("[\"direct\",{\"host\":\"hi\",\"p2\":\"no\"}]");
        assertEquals("\"hi\"",
                     host.received.poll(TIMEOUT, TimeUnit.MILLISECONDS));
        assertTrue(p1.received.isEmpty());
    }

    @Test
    void secondHostIsClosedWithReason() throws Exception {
        start(new MessageRouter(registry, 150));
        connect("/game1/host");
        awaitTrue(new BooleanSupplier() {
            public boolean getAsBoolean() {
                return registry.getConnectionCount() == 1;
            }
        });
        Client intruder = connect("/game1/host");

        assertTrue(intruder.closed.await(TIMEOUT, TimeUnit.MILLISECONDS));
        assertEquals(1000, intruder.closeCode);
        assertEquals("The channel \"game1\" already has a host",
                     intruder.closeReason);
        assertEquals(1, registry.getConnectionCount());
    }

    @Test
    void pongAnswersTheHeartbeat() throws Exception {
        start(new MessageRouter(registry, 150));
        connect("/game1/p1");
        awaitTrue(new BooleanSupplier() {
            public boolean getAsBoolean() {
                return registry.getConnectionCount() == 1;
            }
        });

        eventLoop.submit(new Runnable() {
            public void run() {
                monitor.tick(System.currentTimeMillis());
            }
        }).get();
        awaitTrue(new BooleanSupplier() {
            public boolean getAsBoolean() {
                synchronized (registry) {
                    return registry.getConnections().get(0).isAlive();
                }
            }
        });

        int dropped = eventLoop.submit(new Callable<Integer>() {
            public Integer call() {
                return monitor.tick(System.currentTimeMillis());
            }
        }).get();

        assertEquals(0, dropped);
        assertEquals(1, registry.getConnectionCount());
    }

    @Test
    void remoteCloseLeavesTheChannel() throws Exception {
        start(new MessageRouter(registry, 150));
        Client p1 = connect("/game1/p1");
        awaitTrue(new BooleanSupplier() {
            public boolean getAsBoolean() {
                return registry.getConnectionCount() == 1;
            }
        });

        p1.closeBlocking();

        awaitTrue(new BooleanSupplier() {
            public boolean getAsBoolean() {
                return registry.getConnectionCount() == 0;
            }
        });
        assertEquals(0, registry.getChannel("game1").size());
    }

    @Test
    void originIsCheckedDuringHandshake() throws Exception {
        start(new MessageRouter(registry, 150));
        server.setAdmissionPolicy(OriginWhitelist.makeDefault());

        Client stranger = new Client("/game1/p1",
            Collections.singletonMap("Origin", "https://evil.example"));
        Client local = new Client("/game1/p2",
            Collections.singletonMap("Origin", "http://localhost:3000"));
        clients.add(stranger);
        clients.add(local);

        assertFalse(stranger.connectBlocking(TIMEOUT, TimeUnit.MILLISECONDS));
        assertTrue(local.connectBlocking(TIMEOUT, TimeUnit.MILLISECONDS));
    }

    @Test
    void failingHandlerIsLoggedAndLoopKeepsRunning() throws Exception {
        start(new MessageRouter(registry, 150) {
            public int dispatch(Connection sender, String data) {
                throw new IllegalStateException("broken router");
            }
        });
        Client p1 = connect("/game1/p1");
        awaitTrue(new BooleanSupplier() {
            public boolean getAsBoolean() {
                return registry.getConnectionCount() == 1;
            }
        });

        p1.send("[\"gs\",1]");
        p1.closeBlocking();

        awaitTrue(new BooleanSupplier() {
            public boolean getAsBoolean() {
                return registry.getConnectionCount() == 0;
            }
        });
        LogRecord rec = findSevere();
        assertNotNull(rec);
        assertEquals("broken router", rec.getThrown().getMessage());
    }

    @Test
    void peerMapsReadyStates() throws Exception {
        start(new MessageRouter(registry, 150));
        Client c = new Client("/game1/p1", NO_HEADERS);
        clients.add(c);
        WebSocketPeer peer = new WebSocketPeer(c);

        assertEquals(TransportState.CONNECTING, peer.getState());
        assertTrue(c.connectBlocking(TIMEOUT, TimeUnit.MILLISECONDS));
        assertEquals(TransportState.OPEN, peer.getState());
        assertEquals("/game1/p1", peer.getPath());

        c.closeBlocking();

        assertEquals(TransportState.CLOSED, peer.getState());
        assertFalse(peer.send("[\"gs\"]"));
    }

    @Test
    void guardSwallowsAndLogsRuntimeExceptions() {
        Runnable task = RelayWebSocketServer.guard("message", new Runnable() {
            public void run() {
                throw new IllegalArgumentException("bad");
            }
        });

        task.run();

        LogRecord rec = findSevere();
        assertNotNull(rec);
        assertTrue(rec.getMessage().contains("message"));
        assertTrue(rec.getThrown() instanceof IllegalArgumentException);
    }

    private void start(MessageRouter router) throws InterruptedException {
        final CountDownLatch started = new CountDownLatch(1);
        server = new RelayWebSocketServer(
                new InetSocketAddress("127.0.0.1", 0), registry, router,
                monitor, eventLoop) {
            public void onStart() {
                super.onStart();
                started.countDown();
            }
        };
        server.start();
        assertTrue(started.await(TIMEOUT, TimeUnit.MILLISECONDS));
    }

    private Client connect(String path) throws InterruptedException {
        Client c = new Client(path, NO_HEADERS);
        clients.add(c);
        assertTrue(c.connectBlocking(TIMEOUT, TimeUnit.MILLISECONDS));
        return c;
    }

    private LogRecord findSevere() {
        synchronized (records) {
            for (LogRecord r : records) {
                if (r.getLevel() == Level.SEVERE) return r;
            }
        }
        return null;
    }

    private static void awaitTrue(BooleanSupplier cond)
            throws InterruptedException {
        long deadline = System.currentTimeMillis() + TIMEOUT;
        while (! cond.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("Timed out");
            Thread.sleep(10);
        }
    }

    private class Client extends WebSocketClient {

        final BlockingQueue<String> received =
            new LinkedBlockingQueue<String>();
        final CountDownLatch closed = new CountDownLatch(1);
        volatile int closeCode;
        volatile String closeReason;

        Client(String path, Map<String, String> headers) {
            super(URI.create("ws://127.0.0.1:" + server.getPort() + path),
                  headers);
        }

        public void onOpen(ServerHandshake handshake) {}

        public void onMessage(String message) {
            received.add(message);
        }

        public void onClose(int code, String reason, boolean remote) {
            closeCode = code;
            closeReason = reason;
            closed.countDown();
        }

        public void onError(Exception ex) {}

    }

}
