package com.mailexchange.config;

import java.util.Map;

/**
 * Mailbox source configuration.
 *
 * <p>This class provides type safe access to the IMAP account the forwarder listens on.
 */
public class ImapConfig extends BasicConfig {

    /**
     * Constructs a new ImapConfig instance.
     *
     * @param map Configuration map.
     */
    public ImapConfig(Map<String, Object> map) {
        super(map);
    }

    public String getHost() {
        return getStringProperty("host", "");
    }

    public int getPort() {
        return Math.toIntExact(getLongProperty("port", 993L));
    }

    public String getUser() {
        return getStringProperty("user", "");
    }

    public String getPassword() {
        return getStringProperty("password", "");
    }

    /**
     * Is implicit TLS enabled.
     *
     * @return Boolean.
     */
    public boolean isTls() {
        return getBooleanProperty("tls", true);
    }

    /**
     * Gets the folder to listen on.
     *
     * @return Folder name.
     */
    public String getFolder() {
        return getStringProperty("folder", "INBOX");
    }

    /**
     * Gets the wait before reconnecting after an error or disconnect.
     *
     * @return Seconds.
     */
    public long getReconnectDelaySeconds() {
        return getLongProperty("reconnectDelaySeconds", 5L);
    }

    /**
     * Gets the poll interval used when the server does not support IDLE.
     *
     * @return Seconds.
     */
    public long getPollIntervalSeconds() {
        return getLongProperty("pollIntervalSeconds", 60L);
    }

    /**
     * Enables Jakarta Mail protocol tracing.
     *
     * @return Boolean.
     */
    public boolean isDebug() {
        return getBooleanProperty("debug", false);
    }
}
