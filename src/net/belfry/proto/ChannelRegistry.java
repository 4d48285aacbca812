package net.belfry.proto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import net.belfry.api.Peer;
import net.belfry.api.RelayMetrics;
import net.belfry.api.Termination;

/**
 * Process-wide mapping from channel ids to channels.
 * All relay state lives here; every compound operation on it (admission,
 * routing, heartbeat ticks, reaping) runs while holding this object's
 * monitor.
 */
public class ChannelRegistry {

    private static final Logger LOGGER = Logger.getLogger("Registry");

    private final Map<String, Channel> channels;
    private final Map<Peer, Connection> connections;
    private final RelayMetrics metrics;

    public ChannelRegistry(RelayMetrics metrics) {
        this.channels = new LinkedHashMap<String, Channel>();
        this.connections = new LinkedHashMap<Peer, Connection>();
        this.metrics = (metrics == null) ? RelayMetrics.NULL : metrics;
    }
    public ChannelRegistry() {
        this(null);
    }

    public RelayMetrics getMetrics() {
        return metrics;
    }

    /**
     * Admit a freshly opened transport connection.
     * A second host for a channel that already has an open one is closed
     * right away and never enters the registry; null is returned in that
     * case. Otherwise, the connection joins its channel (which is created
     * if necessary) and gets its first liveness probe.
     */
    public synchronized Connection admit(Peer peer, long now) {
        PeerIdentity identity = PeerIdentity.fromPath(peer.getPath());
        Channel channel = channels.get(identity.getChannelId());
        if (identity.isHost() && channel != null &&
                channel.hasOpenHost(null)) {
            LOGGER.info(identity.getChannelId() + " duplicate host");
            peer.close(Termination.NORMAL_CLOSURE,
                Termination.HOST_CONFLICT.formatReason(
                    identity.getChannelId()));
            metrics.connectionTerminated(Termination.HOST_CONFLICT);
            return null;
        }
        Connection conn = new Connection(peer, identity, now);
        if (channel == null) {
            channel = new Channel(identity.getChannelId());
            channels.put(channel.getId(), channel);
        }
        channel.add(conn);
        connections.put(peer, conn);
        LOGGER.fine("Admitted " + conn);
        updateGauges(channel);
        conn.issueInitialProbe();
        return conn;
    }

    public synchronized Connection getConnection(Peer peer) {
        return connections.get(peer);
    }

    /**
     * A snapshot of all connections currently held.
     */
    public synchronized List<Connection> getConnections() {
        return new ArrayList<Connection>(connections.values());
    }

    public synchronized Channel getChannel(String id) {
        return channels.get(id);
    }

    /**
     * A snapshot of all channels currently held.
     */
    public synchronized List<Channel> getChannels() {
        return new ArrayList<Channel>(channels.values());
    }

    public synchronized int getConnectionCount() {
        return connections.size();
    }

    public synchronized int getChannelCount() {
        return channels.size();
    }

    /**
     * Drop a connection from its channel.
     * The channel itself stays until the reaper removes it. Returns
     * whether the connection was present.
     */
    public synchronized boolean remove(Connection conn) {
        if (connections.get(conn.getPeer()) != conn) return false;
        connections.remove(conn.getPeer());
        Channel channel = channels.get(conn.getChannelId());
        if (channel != null) {
            channel.remove(conn);
            updateGauges(channel);
        } else {
            metrics.setConnections(connections.size());
        }
        return true;
    }

    /**
     * Remove a channel together with whatever members it still has.
     * Per-channel metrics are cleared as well.
     */
    public synchronized boolean removeChannel(Channel channel) {
        if (channels.get(channel.getId()) != channel) return false;
        channels.remove(channel.getId());
        for (Connection c : channel.getMembers()) {
            if (connections.get(c.getPeer()) == c)
                connections.remove(c.getPeer());
        }
        metrics.clearChannel(channel.getId());
        metrics.setChannels(channels.size());
        metrics.setConnections(connections.size());
        return true;
    }

    /**
     * End a connection on the relay's own initiative.
     * Graceful reasons close with a handshake and leave the connection in
     * place until the transport reports the close; timeouts drop the
     * transport and the connection at once. Each connection is counted at
     * most once.
     */
    public synchronized void terminate(Connection conn, Termination reason) {
        if (! conn.markTerminated()) return;
        if (reason.isGraceful()) {
            conn.getPeer().close(Termination.NORMAL_CLOSURE,
                                 reason.formatReason(conn.getChannelId()));
        } else {
            conn.getPeer().terminate();
            remove(conn);
        }
        metrics.connectionTerminated(reason);
    }

    /**
     * Refresh the per-channel member gauge of channel.
     */
    synchronized void refreshGauge(Channel channel) {
        metrics.setChannelMembers(channel.getId(), channel.countActive());
    }

    private void updateGauges(Channel channel) {
        metrics.setConnections(connections.size());
        metrics.setChannels(channels.size());
        refreshGauge(channel);
    }

}
