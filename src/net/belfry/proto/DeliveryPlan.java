package net.belfry.proto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.belfry.api.RelayMetrics;

/**
 * The outcome of routing one inbound message: which connection gets which
 * payload.
 */
public class DeliveryPlan {

    public static final DeliveryPlan EMPTY = new DeliveryPlan(
        Collections.<Delivery>emptyList());

    public static class Delivery {

        private final Connection target;
        private final String payload;

        public Delivery(Connection target, String payload) {
            this.target = target;
            this.payload = payload;
        }

        public Connection getTarget() {
            return target;
        }

        public String getPayload() {
            return payload;
        }

        public String toString() {
            return target + " <- " + payload;
        }

    }

    private final List<Delivery> deliveries;

    private DeliveryPlan(List<Delivery> deliveries) {
        this.deliveries = deliveries;
    }
    public DeliveryPlan() {
        this(new ArrayList<Delivery>());
    }

    public List<Delivery> getDeliveries() {
        return Collections.unmodifiableList(deliveries);
    }

    public boolean isEmpty() {
        return deliveries.isEmpty();
    }

    public int size() {
        return deliveries.size();
    }

    /**
     * The payload planned for target, or null if there is none.
     */
    public String getPayloadFor(Connection target) {
        for (Delivery d : deliveries) {
            if (d.getTarget() == target) return d.getPayload();
        }
        return null;
    }

    public DeliveryPlan add(Connection target, String payload) {
        deliveries.add(new Delivery(target, payload));
        return this;
    }

    /**
     * Send every planned payload.
     * A failed send does not affect the others. Returns the number of
     * payloads that were handed to the transport.
     */
    public int deliver(RelayMetrics metrics) {
        int sent = 0;
        for (Delivery d : deliveries) {
            if (d.getTarget().getPeer().send(d.getPayload())) {
                metrics.messageSent();
                sent++;
            }
        }
        return sent;
    }

}
