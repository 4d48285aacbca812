package net.belfry.util.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layered configuration.
 * Explicitly put values win; otherwise, the sources are consulted in the
 * order they were added. Lookups through sources are not cached, so
 * sources added later still take effect.
 */
public class DynamicConfiguration implements Configuration {

    public static final Configuration PROPERTY_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getProperty(key);
        }
    };

    public static final Configuration ENV_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getenv(toEnvName(key));
        }
    };

    private final List<Configuration> sources;
    private final Map<String, String> data;

    public DynamicConfiguration() {
        sources = new ArrayList<Configuration>();
        data = new LinkedHashMap<String, String>();
    }

    public Map<String, String> getData() {
        return data;
    }

    public String get(String key) {
        if (data.containsKey(key)) return data.get(key);
        for (Configuration src : sources) {
            String ret = src.get(key);
            if (ret != null) return ret;
        }
        return null;
    }

    public void put(String key, String value) {
        data.put(key, value);
    }

    public void remove(String key) {
        data.remove(key);
    }

    public void addSource(Configuration source) {
        sources.add(source);
    }

    /**
     * Add a source consulted before all existing ones.
     */
    public void prependSource(Configuration source) {
        sources.add(0, source);
    }

    public void removeSource(Configuration source) {
        sources.remove(source);
    }

    /**
     * The environment variable name corresponding to a configuration key,
     * e.g. BELFRY_HEARTBEAT_INTERVAL for belfry.heartbeat.interval.
     */
    public static String toEnvName(String key) {
        return key.toUpperCase().replace(".", "_");
    }

    public static DynamicConfiguration makeDefault() {
        DynamicConfiguration ret = new DynamicConfiguration();
        ret.addSource(PROPERTY_SOURCE);
        ret.addSource(ENV_SOURCE);
        return ret;
    }

}
