package net.belfry.util.config;

import java.util.logging.Level;
import net.belfry.util.Util;

/**
 * Typed view of the relay's configuration keys.
 * Values are read on every call, so changes to the underlying
 * configuration are picked up.
 */
public class RelayConfig {

    public static final String K_HOST = "belfry.host";
    public static final String K_PORT = "belfry.port";
    public static final String K_HEARTBEAT_INTERVAL =
        "belfry.heartbeat.interval";
    public static final String K_SPAM_RATE = "belfry.spam.rate";
    public static final String K_ORIGINS = "belfry.origins";
    public static final String K_METRICS_PORT = "belfry.metrics.port";
    public static final String K_LOG_LEVEL = "belfry.log.level";
    public static final String K_LOG_FILE = "belfry.log.file";

    public static final int DEFAULT_PORT = 8080;
    public static final long DEFAULT_HEARTBEAT_INTERVAL = 30000;
    public static final int DEFAULT_SPAM_RATE = 5;
    public static final int DEFAULT_METRICS_PORT = 8081;

    public static final int MAX_PORT = 65535;

    private final Configuration source;

    public RelayConfig(Configuration source) {
        this.source = source;
    }

    public Configuration getSource() {
        return source;
    }

    /**
     * The address to bind to, or null for all interfaces.
     */
    public String getHost() {
        String ret = source.get(K_HOST);
        if (! Util.nonempty(ret) || ret.equals("*")) return null;
        return ret;
    }

    public int getPort() {
        return getInt(K_PORT, DEFAULT_PORT, 0, MAX_PORT);
    }

    /**
     * Heartbeat period in milliseconds.
     */
    public long getHeartbeatInterval() {
        long ret = getLong(K_HEARTBEAT_INTERVAL, DEFAULT_HEARTBEAT_INTERVAL);
        if (ret <= 0)
            throw new ConfigurationException(K_HEARTBEAT_INTERVAL +
                " must be positive, got " + ret);
        return ret;
    }

    public int getSpamRate() {
        return getInt(K_SPAM_RATE, DEFAULT_SPAM_RATE, 1, Integer.MAX_VALUE);
    }

    /**
     * The number of messages a connection may send within one heartbeat
     * interval.
     */
    public int getMessageBudget() {
        long ret = getSpamRate() * getHeartbeatInterval() / 1000;
        return (int) Math.min(ret, Integer.MAX_VALUE);
    }

    public String getOrigins() {
        return source.get(K_ORIGINS);
    }

    /**
     * The metrics port; zero or negative if the exporter is disabled.
     */
    public int getMetricsPort() {
        return getInt(K_METRICS_PORT, DEFAULT_METRICS_PORT,
                      Integer.MIN_VALUE, MAX_PORT);
    }

    public Level getLogLevel() {
        String value = source.get(K_LOG_LEVEL);
        if (! Util.nonempty(value)) return Level.INFO;
        try {
            return Level.parse(value.toUpperCase());
        } catch (IllegalArgumentException exc) {
            throw new ConfigurationException("Invalid log level " + value,
                                             exc);
        }
    }

    /**
     * The log file path, or null for standard error.
     */
    public String getLogFile() {
        String ret = source.get(K_LOG_FILE);
        if (! Util.nonempty(ret) || ret.equals("-")) return null;
        return ret;
    }

    /**
     * Read an integer that must lie in [min, max].
     */
    protected int getInt(String key, int defaultValue, int min, int max) {
        long ret = getLong(key, defaultValue);
        if (ret < min || ret > max)
            throw new ConfigurationException("Value for " + key +
                " out of range [" + min + ", " + max + "]: " + ret);
        return (int) ret;
    }

    protected long getLong(String key, long defaultValue) {
        String value = source.get(key);
        if (! Util.nonempty(value)) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException exc) {
            throw new ConfigurationException("Invalid value for " + key +
                ": " + value, exc);
        }
    }

}
