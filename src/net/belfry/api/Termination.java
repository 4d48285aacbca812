package net.belfry.api;

/**
 * Reasons for which the relay ends a connection on its own initiative.
 */
public enum Termination {

    /**
     * A second host tried to join a channel that already has one.
     * The reason text is a format string taking the channel id.
     */
    HOST_CONFLICT("The channel \"%s\" already has a host"),

    /**
     * The connection exceeded its message budget.
     */
    SPAM("Your app seems to be malfunctioning, please clear your " +
         "browser cache."),

    /**
     * The connection did not answer a liveness probe in time.
     * Such connections are dropped without a closing handshake, so there
     * is no reason text.
     */
    TIMEOUT(null);

    /** The WebSocket "normal closure" status code. */
    public static final int NORMAL_CLOSURE = 1000;

    private final String reasonFormat;

    private Termination(String reasonFormat) {
        this.reasonFormat = reasonFormat;
    }

    /**
     * Whether connections ended for this reason get a closing handshake.
     */
    public boolean isGraceful() {
        return reasonFormat != null;
    }

    /**
     * The human-readable close reason for the given channel.
     * Returns null for ungraceful terminations.
     */
    public String formatReason(String channelId) {
        if (reasonFormat == null) return null;
        return String.format(reasonFormat, channelId);
    }

}
