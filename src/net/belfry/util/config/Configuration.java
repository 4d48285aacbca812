package net.belfry.util.config;

/**
 * A source of string-valued configuration entries.
 */
public interface Configuration {

    /**
     * The value for key, or null if this source does not define it.
     */
    String get(String key);

}
