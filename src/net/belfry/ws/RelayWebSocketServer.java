package net.belfry.ws;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.belfry.api.AdmissionPolicy;
import net.belfry.proto.ChannelRegistry;
import net.belfry.proto.Connection;
import net.belfry.proto.HeartbeatMonitor;
import net.belfry.proto.MessageRouter;
import org.java_websocket.WebSocket;
import org.java_websocket.drafts.Draft;
import org.java_websocket.exceptions.InvalidDataException;
import org.java_websocket.framing.CloseFrame;
import org.java_websocket.framing.Framedata;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.handshake.ServerHandshakeBuilder;
import org.java_websocket.server.WebSocketServer;

/**
 * The relay's WebSocket endpoint.
 * Transport callbacks arrive on the library's worker threads; they are
 * handed to a single event loop, so the relay core sees one event at a
 * time, in arrival order per connection.
 */
public class RelayWebSocketServer extends WebSocketServer {

    private static final Logger LOGGER = Logger.getLogger("RelayWSServer");

    private final ChannelRegistry registry;
    private final MessageRouter router;
    private final HeartbeatMonitor monitor;
    private final Executor eventLoop;
    private AdmissionPolicy admission;

    public RelayWebSocketServer(InetSocketAddress addr,
                                ChannelRegistry registry,
                                MessageRouter router,
                                HeartbeatMonitor monitor,
                                Executor eventLoop) {
        super(addr);
        this.registry = registry;
        this.router = router;
        this.monitor = monitor;
        this.eventLoop = eventLoop;
        this.admission = AdmissionPolicy.ALLOW_ALL;
        // Liveness is tracked by the HeartbeatMonitor.
        setConnectionLostTimeout(0);
        setReuseAddr(true);
    }

    public ChannelRegistry getRegistry() {
        return registry;
    }

    public AdmissionPolicy getAdmissionPolicy() {
        return admission;
    }
    public void setAdmissionPolicy(AdmissionPolicy p) {
        admission = p;
    }

    @Override
    public ServerHandshakeBuilder onWebsocketHandshakeReceivedAsServer(
            WebSocket conn, Draft draft, ClientHandshake request)
            throws InvalidDataException {
        String origin = (request.hasFieldValue("Origin")) ?
            request.getFieldValue("Origin") : null;
        if (! admission.admit(origin)) {
            LOGGER.fine("Refusing connection from origin " + origin);
            throw new InvalidDataException(CloseFrame.POLICY_VALIDATION,
                                           "Origin not allowed");
        }
        return super.onWebsocketHandshakeReceivedAsServer(conn, draft,
                                                          request);
    }

    public void onStart() {
        LOGGER.info("Listening on " + getAddress() + "...");
    }

    public void onOpen(final WebSocket conn, ClientHandshake handshake) {
        post("open", new Runnable() {
            public void run() {
                Connection c = registry.admit(new WebSocketPeer(conn),
                                              System.currentTimeMillis());
                if (c != null) conn.setAttachment(c);
            }
        });
    }

    public void onMessage(final WebSocket conn, final String message) {
        post("message", new Runnable() {
            public void run() {
                Connection c = conn.getAttachment();
                if (c != null) router.dispatch(c, message);
            }
        });
    }

    public void onMessage(WebSocket conn, ByteBuffer message) {
        onMessage(conn, StandardCharsets.UTF_8.decode(message).toString());
    }

    @Override
    public void onWebsocketPong(final WebSocket conn, Framedata f) {
        final long now = System.currentTimeMillis();
        post("pong", new Runnable() {
            public void run() {
                Connection c = conn.getAttachment();
                if (c != null) monitor.probeAnswered(c, now);
            }
        });
    }

    public void onClose(final WebSocket conn, int code, String reason,
                        boolean remote) {
        post("close", new Runnable() {
            public void run() {
                Connection c = conn.getAttachment();
                if (c != null) registry.remove(c);
            }
        });
    }

    /**
     * Run task on the event loop.
     * The loop does not report what its tasks throw, so failures are
     * logged here.
     */
    protected void post(String event, Runnable task) {
        eventLoop.execute(guard(event, task));
    }

    static Runnable guard(final String event, final Runnable task) {
        return new Runnable() {
            public void run() {
                try {
                    task.run();
                } catch (RuntimeException exc) {
                    LOGGER.log(Level.SEVERE, "Exception while handling " +
                               event + " event", exc);
                }
            }
        };
    }

    public void onError(WebSocket conn, Exception ex) {
        if (conn == null) {
            LOGGER.log(Level.SEVERE, "Server error", ex);
        } else {
            LOGGER.log(Level.WARNING, "Error on connection " +
                       conn.getRemoteSocketAddress(), ex);
        }
    }

}
