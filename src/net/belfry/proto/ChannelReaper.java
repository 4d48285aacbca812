package net.belfry.proto;

import java.util.logging.Logger;

/**
 * Periodic sweep removing channels without any open or connecting
 * members.
 */
public class ChannelReaper implements Runnable {

    private static final Logger LOGGER = Logger.getLogger("Reaper");

    private final ChannelRegistry registry;

    public ChannelReaper(ChannelRegistry registry) {
        this.registry = registry;
    }

    /**
     * Remove all inactive channels.
     * Surviving channels get their member gauges refreshed. Returns the
     * number of channels removed.
     */
    public int sweep() {
        int removed = 0;
        synchronized (registry) {
            for (Channel ch : registry.getChannels()) {
                if (ch.isActive()) {
                    registry.refreshGauge(ch);
                } else if (registry.removeChannel(ch)) {
                    LOGGER.fine("Removed channel " + ch.getId());
                    removed++;
                }
            }
        }
        return removed;
    }

    public void run() {
        sweep();
    }

}
