package com.mailexchange.config;

import java.util.Map;

/**
 * Dashboard endpoint configuration.
 */
public class EndpointConfig extends BasicConfig {

    /**
     * Constructs a new EndpointConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public EndpointConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets the port number for this endpoint.
     *
     * @param defaultPort Default port to use if not configured.
     * @return Port number.
     */
    public int getPort(int defaultPort) {
        return Math.toIntExact(getLongProperty("port", (long) defaultPort));
    }

    /**
     * Gets bind address.
     *
     * @return Bind address string.
     */
    public String getBind() {
        return getStringProperty("bind", "0.0.0.0");
    }

    /**
     * Checks if the endpoint should be started.
     * <p>A zero port disables it.
     *
     * @return True if enabled.
     */
    public boolean isEnabled() {
        return getPort(0) != 0;
    }
}
