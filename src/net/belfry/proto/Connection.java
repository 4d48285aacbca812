package net.belfry.proto;

import net.belfry.api.Peer;
import net.belfry.api.TransportState;

/**
 * Relay-side state of one admitted client.
 * Instances are only ever mutated while holding the owning
 * ChannelRegistry's lock; the methods below are the only mutation paths.
 */
public class Connection {

    private final Peer peer;
    private final PeerIdentity identity;
    private boolean alive;
    private long probeIssuedAt;
    private long latency;
    private int messageCount;
    private boolean terminated;

    public Connection(Peer peer, PeerIdentity identity, long now) {
        this.peer = peer;
        this.identity = identity;
        this.alive = true;
        this.probeIssuedAt = now;
        this.latency = 0;
        this.messageCount = 0;
        this.terminated = false;
    }

    public Peer getPeer() {
        return peer;
    }

    public String getChannelId() {
        return identity.getChannelId();
    }

    public String getPlayerId() {
        return identity.getPlayerId();
    }

    public boolean isHost() {
        return identity.isHost();
    }

    public TransportState getState() {
        return peer.getState();
    }

    public boolean isOpen() {
        return peer.getState() == TransportState.OPEN;
    }

    public boolean isAlive() {
        return alive;
    }

    public long getProbeIssuedAt() {
        return probeIssuedAt;
    }

    /**
     * Half the round-trip time of the last answered probe, in
     * milliseconds; zero until the first answer arrives.
     */
    public long getLatency() {
        return latency;
    }

    public int getMessageCount() {
        return messageCount;
    }

    /**
     * Whether the relay has already ended this connection.
     * Input arriving afterwards is ignored.
     */
    public boolean isTerminated() {
        return terminated;
    }

    /**
     * Issue a liveness probe and mark the connection as suspect until it
     * is answered.
     */
    public void issueProbe(long now) {
        alive = false;
        probeIssuedAt = now;
        peer.ping();
    }

    /**
     * Issue the initial probe of a fresh connection.
     * Unlike issueProbe(), this does not make the connection suspect.
     */
    void issueInitialProbe() {
        peer.ping();
    }

    /**
     * Record a probe answer.
     * Updates the latency estimate, refills the message budget and marks
     * the connection as alive. Returns the new latency estimate.
     */
    public long probeAnswered(long now) {
        latency = Math.round((now - probeIssuedAt) / 2.0);
        messageCount = 0;
        alive = true;
        return latency;
    }

    /**
     * Count an inbound message against the budget.
     * Returns the number of messages received since the last probe
     * answer, including this one.
     */
    public int countMessage() {
        return ++messageCount;
    }

    /**
     * Mark the connection as ended by the relay.
     * Returns false if it already was.
     */
    boolean markTerminated() {
        if (terminated) return false;
        terminated = true;
        return true;
    }

    public String toString() {
        return "Connection[" + identity + "]";
    }

}
