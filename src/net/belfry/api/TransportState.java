package net.belfry.api;

/**
 * Lifecycle state of a transport connection.
 * Owned by the transport layer; the relay core only reads it.
 */
public enum TransportState {

    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED;

    /**
     * Whether a connection in this state still counts towards keeping its
     * channel alive.
     */
    public boolean isActive() {
        return this == CONNECTING || this == OPEN;
    }

}
