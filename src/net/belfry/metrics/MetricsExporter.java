package net.belfry.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.HTTPServer;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.logging.Logger;

/**
 * Serves the relay's metrics for scraping on a dedicated port.
 */
public class MetricsExporter {

    private static final Logger LOGGER = Logger.getLogger("Metrics");

    private final InetSocketAddress address;
    private final CollectorRegistry registry;
    private HTTPServer server;

    public MetricsExporter(InetSocketAddress address,
                           CollectorRegistry registry) {
        this.address = address;
        this.registry = registry;
    }
    public MetricsExporter(int port) {
        this(new InetSocketAddress(port), CollectorRegistry.defaultRegistry);
    }

    public InetSocketAddress getAddress() {
        return address;
    }

    public synchronized boolean isRunning() {
        return server != null;
    }

    public synchronized void start() throws IOException {
        if (server != null)
            throw new IllegalStateException("Metrics exporter already " +
                                            "started");
        server = new HTTPServer(address, registry, true);
        LOGGER.info("Exposing metrics on port " + server.getPort() + "...");
    }

    public synchronized void stop() {
        if (server == null) return;
        server.close();
        server = null;
    }

}
