package net.belfry.ws;

import java.util.logging.Logger;
import net.belfry.api.Peer;
import net.belfry.api.TransportState;
import org.java_websocket.WebSocket;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.java_websocket.framing.CloseFrame;

/**
 * Adapts a Java-WebSocket connection to the relay core's Peer interface.
 */
public class WebSocketPeer implements Peer {

    private static final Logger LOGGER = Logger.getLogger("WSPeer");

    private final WebSocket conn;

    public WebSocketPeer(WebSocket conn) {
        this.conn = conn;
    }

    public String getPath() {
        return conn.getResourceDescriptor();
    }

    public TransportState getState() {
        switch (conn.getReadyState()) {
            case NOT_YET_CONNECTED:
                return TransportState.CONNECTING;
            case OPEN:
                return TransportState.OPEN;
            case CLOSING:
                return TransportState.CLOSING;
            default:
                return TransportState.CLOSED;
        }
    }

    public boolean send(String data) {
        try {
            conn.send(data);
            return true;
        } catch (WebsocketNotConnectedException exc) {
            // The remaining receivers are unaffected.
            return false;
        }
    }

    public void ping() {
        try {
            conn.sendPing();
        } catch (WebsocketNotConnectedException exc) {
            LOGGER.fine("Not probing closed connection " + this);
        }
    }

    public void close(int code, String reason) {
        conn.close(code, reason);
    }

    public void terminate() {
        conn.closeConnection(CloseFrame.ABNORMAL_CLOSE, "Timeout");
    }

    public String toString() {
        return "WebSocketPeer[" + conn.getRemoteSocketAddress() + " " +
            getPath() + "]";
    }

}
