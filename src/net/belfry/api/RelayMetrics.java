package net.belfry.api;

/**
 * Write-only observability sink of the relay core.
 * The core keeps these values accurate as a side effect of its work; it
 * never reads them back. How (and whether) they are exported is up to the
 * implementation.
 */
public interface RelayMetrics {

    /** A sink discarding everything. */
    RelayMetrics NULL = new RelayMetrics() {
        public void setConnections(int count) {}
        public void setChannels(int count) {}
        public void setChannelMembers(String channelId, int count) {}
        public void clearChannel(String channelId) {}
        public void messageReceived() {}
        public void messageSent() {}
        public void connectionTerminated(Termination reason) {}
    };

    /**
     * Report the number of connections currently held by the registry.
     */
    void setConnections(int count);

    /**
     * Report the number of channels currently held by the registry.
     */
    void setChannels(int count);

    /**
     * Report the number of open or connecting members of a channel.
     */
    void setChannelMembers(String channelId, int count);

    /**
     * Drop any per-channel state kept for the given channel.
     * Called when the channel is removed from the registry.
     */
    void clearChannel(String channelId);

    /**
     * Count one inbound message.
     */
    void messageReceived();

    /**
     * Count one delivered outbound message.
     */
    void messageSent();

    /**
     * Count one connection the relay ended on its own initiative.
     */
    void connectionTerminated(Termination reason);

}
