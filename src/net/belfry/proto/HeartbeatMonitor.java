package net.belfry.proto;

import java.util.logging.Logger;
import net.belfry.api.Termination;
import net.belfry.api.TransportState;

/**
 * Periodic liveness check over all connections.
 * Every tick, connections that left the previous probe unanswered are
 * dropped, and all others are probed anew.
 */
public class HeartbeatMonitor implements Runnable {

    private static final Logger LOGGER = Logger.getLogger("Heartbeat");

    public static final long DEFAULT_INTERVAL = 30000;

    private final ChannelRegistry registry;
    private final long interval;

    public HeartbeatMonitor(ChannelRegistry registry, long interval) {
        this.registry = registry;
        this.interval = interval;
    }
    public HeartbeatMonitor(ChannelRegistry registry) {
        this(registry, DEFAULT_INTERVAL);
    }

    public long getInterval() {
        return interval;
    }

    /**
     * Run one heartbeat round at time now.
     * Returns the number of connections dropped for not answering.
     */
    public int tick(long now) {
        int dropped = 0;
        synchronized (registry) {
            for (Connection conn : registry.getConnections()) {
                TransportState state = conn.getState();
                if (state == TransportState.CLOSED) {
                    registry.remove(conn);
                    continue;
                }
                if (conn.isTerminated() || state != TransportState.OPEN)
                    continue;
                if (! conn.isAlive()) {
                    LOGGER.info(conn.getChannelId() + " timed out " +
                                conn.getPlayerId());
                    registry.terminate(conn, Termination.TIMEOUT);
                    dropped++;
                } else {
                    conn.issueProbe(now);
                }
            }
        }
        return dropped;
    }

    /**
     * Record the answer to a probe.
     * Returns the connection's new latency estimate.
     */
    public long probeAnswered(Connection conn, long now) {
        synchronized (registry) {
            return conn.probeAnswered(now);
        }
    }

    public void run() {
        LOGGER.fine("Probing connections...");
        tick(System.currentTimeMillis());
    }

}
