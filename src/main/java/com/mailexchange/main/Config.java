package com.mailexchange.main;

import com.mailexchange.config.ForwarderConfig;

import java.io.IOException;

/**
 * Master configuration container.
 *
 * <p>Holds the forwarder configuration loaded at startup.
 *
 * @see ForwarderConfig
 */
public class Config {

    /**
     * Protected constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Forwarder configuration.
     */
    private static ForwarderConfig forwarder = new ForwarderConfig();

    /**
     * Gets forwarder config.
     *
     * @return ForwarderConfig.
     */
    public static ForwarderConfig getForwarder() {
        return forwarder;
    }

    /**
     * Sets forwarder config.
     *
     * @param config ForwarderConfig.
     */
    public static void setForwarder(ForwarderConfig config) {
        forwarder = config;
    }

    /**
     * Init forwarder config.
     *
     * @param path File path.
     * @throws IOException Unable to read file.
     */
    public static void initForwarder(String path) throws IOException {
        forwarder = new ForwarderConfig(path);
    }
}
