package net.belfry.proto;

import io.prometheus.client.CollectorRegistry;
import net.belfry.api.Termination;
import net.belfry.api.TransportState;
import net.belfry.metrics.PrometheusRelayMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChannelRegistryTest {

    private CollectorRegistry collectors;
    private ChannelRegistry registry;

    @BeforeEach
    void setUp() {
        collectors = new CollectorRegistry();
        registry = new ChannelRegistry(new PrometheusRelayMetrics(collectors));
    }

    @Test
    void admissionCreatesChannelAndProbes() {
        FakePeer peer = new FakePeer("/game1/p1");

        Connection conn = registry.admit(peer, 1000);

        assertNotNull(conn);
        assertEquals("game1", conn.getChannelId());
        assertEquals("p1", conn.getPlayerId());
        assertTrue(conn.isAlive());
        assertEquals(1000, conn.getProbeIssuedAt());
        assertEquals(0, conn.getLatency());
        assertEquals(0, conn.getMessageCount());
        assertEquals(1, peer.getPings());
        Channel channel = registry.getChannel("game1");
        assertNotNull(channel);
        assertTrue(channel.contains(conn));
        assertSame(conn, registry.getConnection(peer));
    }

    @Test
    void secondOpenHostIsRejected() {
        FakePeer first = new FakePeer("/game1/host");
        FakePeer second = new FakePeer("/GAME1/Host");
        Connection host = registry.admit(first, 1000);

        Connection rejected = registry.admit(second, 1001);

        assertNull(rejected);
        assertEquals(Termination.NORMAL_CLOSURE, second.getCloseCode());
        assertEquals("The channel \"game1\" already has a host",
                     second.getCloseReason());
        assertEquals(0, second.getPings());
        assertEquals(1, registry.getChannel("game1").size());
        assertTrue(registry.getChannel("game1").contains(host));
        assertNull(registry.getConnection(second));
        assertFalse(first.isClosed());
        assertEquals(1.0, collectors.getSampleValue(
            "connection_terminated_host_total"));
    }

    @Test
    void hostMayRejoinOnceThePreviousOneIsGone() {
        FakePeer first = new FakePeer("/game1/host");
        registry.admit(first, 1000);
        first.setState(TransportState.CLOSING);

        Connection second = registry.admit(new FakePeer("/game1/host"),
                                           2000);

        assertNotNull(second);
        assertEquals(0.0, collectors.getSampleValue(
            "connection_terminated_host_total"));
    }

    @Test
    void hostsOfDifferentChannelsDoNotConflict() {
        assertNotNull(registry.admit(new FakePeer("/a/host"), 1000));
        assertNotNull(registry.admit(new FakePeer("/b/host"), 1000));
        assertEquals(2, registry.getChannelCount());
    }

    @Test
    void removalKeepsTheChannel() {
        FakePeer peer = new FakePeer("/game1/p1");
        Connection conn = registry.admit(peer, 1000);

        assertTrue(registry.remove(conn));
        assertFalse(registry.remove(conn));

        assertEquals(0, registry.getConnectionCount());
        assertNotNull(registry.getChannel("game1"));
        assertEquals(0, registry.getChannel("game1").size());
    }

    @Test
    void gaugesFollowMembership() {
        Connection p1 = registry.admit(new FakePeer("/game1/p1"), 1000);
        registry.admit(new FakePeer("/game1/host"), 1000);
        registry.admit(new FakePeer("/other/p1"), 1000);

        assertEquals(3.0, collectors.getSampleValue("players_concurrent"));
        assertEquals(2.0, collectors.getSampleValue("channels_concurrent"));
        assertEquals(2.0, channelGauge("game1"));

        registry.remove(p1);

        assertEquals(2.0, collectors.getSampleValue("players_concurrent"));
        assertEquals(1.0, channelGauge("game1"));
    }

    @Test
    void gracefulTerminationClosesOnce() {
        FakePeer peer = new FakePeer("/game1/p1");
        Connection conn = registry.admit(peer, 1000);

        registry.terminate(conn, Termination.SPAM);
        registry.terminate(conn, Termination.SPAM);

        assertTrue(conn.isTerminated());
        assertEquals(TransportState.CLOSING, peer.getState());
        assertTrue(registry.getChannel("game1").contains(conn));
        assertEquals(1.0, collectors.getSampleValue(
            "connection_terminated_spam_total"));
    }

    @Test
    void timeoutTerminationDropsConnection() {
        FakePeer peer = new FakePeer("/game1/p1");
        Connection conn = registry.admit(peer, 1000);

        registry.terminate(conn, Termination.TIMEOUT);

        assertTrue(peer.isTerminated());
        assertFalse(peer.isClosed());
        assertFalse(registry.getChannel("game1").contains(conn));
        assertEquals(1.0, collectors.getSampleValue(
            "connection_terminated_timeout_total"));
    }

    private Double channelGauge(String name) {
        return collectors.getSampleValue("channel_players",
            new String[] { "name" }, new String[] { name });
    }

}
