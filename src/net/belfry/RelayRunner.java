package net.belfry;

import io.prometheus.client.CollectorRegistry;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.belfry.api.AdmissionPolicy;
import net.belfry.metrics.MetricsExporter;
import net.belfry.metrics.PrometheusRelayMetrics;
import net.belfry.proto.ChannelReaper;
import net.belfry.proto.ChannelRegistry;
import net.belfry.proto.HeartbeatMonitor;
import net.belfry.proto.MessageRouter;
import net.belfry.util.Logging;
import net.belfry.util.config.ConfigurationException;
import net.belfry.util.config.DynamicConfiguration;
import net.belfry.util.config.PropertiesConfiguration;
import net.belfry.util.config.RelayConfig;
import net.belfry.ws.OriginWhitelist;
import net.belfry.ws.RelayWebSocketServer;

public class RelayRunner {

    private static final Logger LOGGER = Logger.getLogger("RelayRunner");

    public static final int SHUTDOWN_TIME = 1000;

    private DynamicConfiguration config;
    private RelayConfig relayConfig;
    private CollectorRegistry collectors;
    private PrometheusRelayMetrics metrics;
    private MetricsExporter exporter;
    private ChannelRegistry registry;
    private MessageRouter router;
    private HeartbeatMonitor monitor;
    private ChannelReaper reaper;
    private AdmissionPolicy admission;
    private ScheduledExecutorService eventLoop;
    private RelayWebSocketServer server;
    private Future<?> maintenance;

    public DynamicConfiguration getConfig() {
        return config;
    }
    public void setConfig(DynamicConfiguration c) {
        config = c;
    }
    public DynamicConfiguration makeConfig() {
        if (config == null) {
            config = DynamicConfiguration.makeDefault();
        }
        return config;
    }

    public RelayConfig makeRelayConfig() {
        if (relayConfig == null) {
            relayConfig = new RelayConfig(makeConfig());
        }
        return relayConfig;
    }

    public void addConfigFile(File path) {
        makeConfig().prependSource(new PropertiesConfiguration(path));
    }

    public CollectorRegistry getCollectors() {
        return collectors;
    }
    public void setCollectors(CollectorRegistry c) {
        collectors = c;
    }
    public CollectorRegistry makeCollectors() {
        if (collectors == null) {
            collectors = CollectorRegistry.defaultRegistry;
        }
        return collectors;
    }

    public PrometheusRelayMetrics makeMetrics() {
        if (metrics == null) {
            metrics = new PrometheusRelayMetrics(makeCollectors());
        }
        return metrics;
    }

    public MetricsExporter makeExporter() {
        if (exporter == null) {
            int port = makeRelayConfig().getMetricsPort();
            if (port <= 0) return null;
            exporter = new MetricsExporter(new InetSocketAddress(port),
                                           makeCollectors());
        }
        return exporter;
    }

    public ChannelRegistry getRegistry() {
        return registry;
    }
    public void setRegistry(ChannelRegistry r) {
        registry = r;
    }
    public ChannelRegistry makeRegistry() {
        if (registry == null) {
            registry = new ChannelRegistry(makeMetrics());
        }
        return registry;
    }

    public MessageRouter makeRouter() {
        if (router == null) {
            router = new MessageRouter(makeRegistry(),
                                       makeRelayConfig().getMessageBudget());
        }
        return router;
    }

    public HeartbeatMonitor makeMonitor() {
        if (monitor == null) {
            monitor = new HeartbeatMonitor(makeRegistry(),
                makeRelayConfig().getHeartbeatInterval());
        }
        return monitor;
    }

    public ChannelReaper makeReaper() {
        if (reaper == null) {
            reaper = new ChannelReaper(makeRegistry());
        }
        return reaper;
    }

    public AdmissionPolicy getAdmissionPolicy() {
        return admission;
    }
    public void setAdmissionPolicy(AdmissionPolicy p) {
        admission = p;
    }
    public AdmissionPolicy makeAdmissionPolicy() {
        if (admission == null) {
            String origins = makeRelayConfig().getOrigins();
            if (origins == null) {
                admission = OriginWhitelist.makeDefault();
            } else {
                admission = new OriginWhitelist(origins);
            }
        }
        return admission;
    }

    public ScheduledExecutorService makeEventLoop() {
        if (eventLoop == null) {
            eventLoop = Executors.newSingleThreadScheduledExecutor();
        }
        return eventLoop;
    }

    public RelayWebSocketServer getServer() {
        return server;
    }
    public RelayWebSocketServer makeServer() {
        if (server == null) {
            RelayConfig cfg = makeRelayConfig();
            InetSocketAddress addr;
            if (cfg.getHost() == null) {
                addr = new InetSocketAddress(cfg.getPort());
            } else {
                addr = new InetSocketAddress(cfg.getHost(), cfg.getPort());
            }
            server = new RelayWebSocketServer(addr, makeRegistry(),
                makeRouter(), makeMonitor(), makeEventLoop());
            server.setAdmissionPolicy(makeAdmissionPolicy());
        }
        return server;
    }

    /**
     * The periodic job: a heartbeat round followed by a reaper sweep.
     */
    public Runnable makeMaintenanceJob() {
        final HeartbeatMonitor m = makeMonitor();
        final ChannelReaper r = makeReaper();
        return new Runnable() {
            public void run() {
                try {
                    m.run();
                    r.run();
                } catch (RuntimeException exc) {
                    // Keep the schedule alive.
                    LOGGER.log(Level.SEVERE, "Exception in maintenance " +
                               "job", exc);
                }
            }
        };
    }

    public Future<?> scheduleJob(Runnable callback, long delay,
                                 long period) {
        return makeEventLoop().scheduleAtFixedRate(callback, delay, period,
                                                   TimeUnit.MILLISECONDS);
    }

    public void configureLogging() {
        RelayConfig cfg = makeRelayConfig();
        String logFile = cfg.getLogFile();
        OutputStream out;
        if (logFile == null) {
            out = System.err;
        } else {
            try {
                out = new FileOutputStream(logFile, true);
            } catch (FileNotFoundException exc) {
                throw new ConfigurationException("Cannot open log file " +
                                                 logFile, exc);
            }
        }
        Logging.redirectToStream(out);
        Logging.setLevel(cfg.getLogLevel());
    }

    public void setup() throws IOException {
        makeServer();
        long interval = makeMonitor().getInterval();
        maintenance = scheduleJob(makeMaintenanceJob(), interval, interval);
        MetricsExporter exp = makeExporter();
        if (exp != null) exp.start();
    }

    public void launch() {
        LOGGER.info("Heartbeat every " + makeMonitor().getInterval() +
                    " ms, " + makeRouter().getMessageBudget() +
                    " messages per interval");
        // The socket is bound by the server thread started here.
        makeServer().start();
    }

    public void shutdown() {
        if (maintenance != null) maintenance.cancel(false);
        if (server != null) {
            try {
                server.stop(SHUTDOWN_TIME);
            } catch (InterruptedException exc) {
                Thread.currentThread().interrupt();
            }
        }
        if (eventLoop != null) eventLoop.shutdown();
        if (exporter != null) exporter.stop();
        LOGGER.info("Relay stopped");
    }

    public void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread("Relay closer") {

            {
                setPriority(MAX_PRIORITY);
            }

            public void run() {
                shutdown();
            }

        });
    }

}
