package net.belfry.proto;

import java.util.logging.Level;
import java.util.logging.Logger;
import net.belfry.api.RelayMetrics;
import net.belfry.api.Termination;
import org.json.JSONException;

/**
 * Decides who receives an inbound message, and in which form.
 * Pings travel only between the host and players, with the summed latency
 * estimates of both ends patched in; direct messages carry one payload per
 * addressed player; everything else is broadcast verbatim. The sender
 * never receives its own message.
 */
public class MessageRouter {

    private static final Logger LOGGER = Logger.getLogger("Router");

    private final ChannelRegistry registry;
    private final int messageBudget;

    /**
     * messageBudget is the number of messages a connection may send
     * between two answered liveness probes.
     */
    public MessageRouter(ChannelRegistry registry, int messageBudget) {
        this.registry = registry;
        this.messageBudget = messageBudget;
    }

    public ChannelRegistry getRegistry() {
        return registry;
    }

    public int getMessageBudget() {
        return messageBudget;
    }

    /**
     * Compute the deliveries for a message from sender.
     * A sender exceeding its message budget is closed and gets an empty
     * plan, as do senders the relay has already closed.
     */
    public DeliveryPlan route(Connection sender, String data) {
        RelayMetrics metrics = registry.getMetrics();
        synchronized (registry) {
            metrics.messageReceived();
            if (sender.isTerminated()) return DeliveryPlan.EMPTY;
            if (sender.countMessage() > messageBudget) {
                LOGGER.info(sender.getChannelId() +
                            " disconnecting user due to spam");
                registry.terminate(sender, Termination.SPAM);
                return DeliveryPlan.EMPTY;
            }
            Channel channel = registry.getChannel(sender.getChannelId());
            if (channel == null || ! channel.contains(sender)) {
                LOGGER.warning("Message from unregistered " + sender);
                return DeliveryPlan.EMPTY;
            }
            Envelope env;
            try {
                env = Envelope.decode(data);
            } catch (JSONException exc) {
                LOGGER.log(Level.WARNING, "Error parsing direct message " +
                           "from " + sender, exc);
                return DeliveryPlan.EMPTY;
            }
            switch (env.getKind()) {
                case PING:
                    return planPing(sender, channel, (Envelope.Ping) env);
                case DIRECT:
                    return planDirect(sender, channel,
                                      (Envelope.Direct) env);
                default:
                    return planBroadcast(sender, channel, env);
            }
        }
    }

    /**
     * Route a message from sender and deliver it.
     * Returns the number of payloads sent.
     */
    public int dispatch(Connection sender, String data) {
        return route(sender, data).deliver(registry.getMetrics());
    }

    protected DeliveryPlan planPing(Connection sender, Channel channel,
                                    Envelope.Ping ping) {
        DeliveryPlan ret = new DeliveryPlan();
        for (Connection r : channel.getMembers()) {
            if (r == sender || ! r.isOpen()) continue;
            if (! sender.isHost() && ! r.isHost()) continue;
            ret.add(r, ping.withLatency(r.getLatency() +
                                        sender.getLatency()));
        }
        return ret;
    }

    protected DeliveryPlan planDirect(Connection sender, Channel channel,
                                      Envelope.Direct direct) {
        DeliveryPlan ret = new DeliveryPlan();
        for (Connection r : channel.getMembers()) {
            if (r == sender || ! r.isOpen()) continue;
            String payload = direct.payloadFor(r.getPlayerId());
            if (payload != null) ret.add(r, payload);
        }
        return ret;
    }

    protected DeliveryPlan planBroadcast(Connection sender, Channel channel,
                                         Envelope env) {
        DeliveryPlan ret = new DeliveryPlan();
        for (Connection r : channel.getMembers()) {
            if (r == sender || ! r.isOpen()) continue;
            ret.add(r, env.getRaw());
        }
        return ret;
    }

}
