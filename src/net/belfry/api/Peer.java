package net.belfry.api;

/**
 * One client's transport connection, as seen by the relay core.
 * Implementations wrap whatever the transport library hands out; the core
 * never touches the transport directly.
 */
public interface Peer {

    /**
     * The request path the connection was opened with.
     * Channel and player identifiers are derived from it exactly once.
     */
    String getPath();

    /**
     * Current transport state.
     * May change concurrently; callers should treat the value as a
     * snapshot.
     */
    TransportState getState();

    /**
     * Queue a text frame for the client.
     * Delivery is fire-and-forget. Returns false if the frame could not be
     * queued because the connection is no longer open.
     */
    boolean send(String data);

    /**
     * Issue a liveness probe.
     * The transport reports the answer back to the core asynchronously.
     */
    void ping();

    /**
     * Close the connection with a closing handshake.
     * reason is shown to the client.
     */
    void close(int code, String reason);

    /**
     * Drop the connection without a closing handshake.
     */
    void terminate();

}
