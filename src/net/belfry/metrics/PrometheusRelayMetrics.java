package net.belfry.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import net.belfry.api.RelayMetrics;
import net.belfry.api.Termination;

public class PrometheusRelayMetrics implements RelayMetrics {

    private final Gauge playersConcurrent;
    private final Gauge channelsConcurrent;
    private final Gauge channelPlayers;
    private final Counter messagesIncoming;
    private final Counter messagesOutgoing;
    private final Counter terminatedHost;
    private final Counter terminatedSpam;
    private final Counter terminatedTimeout;

    public PrometheusRelayMetrics(CollectorRegistry registry) {
        playersConcurrent = Gauge.build()
            .name("players_concurrent")
            .help("Concurrent Players")
            .register(registry);
        channelsConcurrent = Gauge.build()
            .name("channels_concurrent")
            .help("Concurrent Channels")
            .register(registry);
        channelPlayers = Gauge.build()
            .name("channel_players")
            .help("Players in each channel")
            .labelNames("name")
            .register(registry);
        messagesIncoming = Counter.build()
            .name("messages_incoming")
            .help("Incoming messages")
            .register(registry);
        messagesOutgoing = Counter.build()
            .name("messages_outgoing")
            .help("Outgoing messages")
            .register(registry);
        terminatedHost = Counter.build()
            .name("connection_terminated_host")
            .help("Duplicate host")
            .register(registry);
        terminatedSpam = Counter.build()
            .name("connection_terminated_spam")
            .help("Spam")
            .register(registry);
        terminatedTimeout = Counter.build()
            .name("connection_terminated_timeout")
            .help("Timeout")
            .register(registry);
    }
    public PrometheusRelayMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public void setConnections(int count) {
        playersConcurrent.set(count);
    }

    public void setChannels(int count) {
        channelsConcurrent.set(count);
    }

    public void setChannelMembers(String channelId, int count) {
        channelPlayers.labels(channelId).set(count);
    }

    public void clearChannel(String channelId) {
        channelPlayers.remove(channelId);
    }

    public void messageReceived() {
        messagesIncoming.inc();
    }

    public void messageSent() {
        messagesOutgoing.inc();
    }

    public void connectionTerminated(Termination reason) {
        switch (reason) {
            case HOST_CONFLICT:
                terminatedHost.inc();
                break;
            case SPAM:
                terminatedSpam.inc();
                break;
            case TIMEOUT:
                terminatedTimeout.inc();
                break;
        }
    }

}
