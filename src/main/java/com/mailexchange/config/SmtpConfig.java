package com.mailexchange.config;

import java.util.Map;

/**
 * Mail transport configuration.
 *
 * <p>This class provides type safe access to the SMTP relay used for forwards and sender reports.
 * <p>Expected layout:
 * <pre>{@code
 * smtp: {
 *   host: "smtp.example.com",
 *   port: 465,
 *   secure: true,
 *   auth: { user: "forwarder@example.com", pass: "secret" }
 * }
 * }</pre>
 */
public class SmtpConfig extends BasicConfig {

    /**
     * Constructs a new SmtpConfig instance.
     *
     * @param map Configuration map.
     */
    public SmtpConfig(Map<String, Object> map) {
        super(map);
    }

    public String getHost() {
        return getStringProperty("host", "");
    }

    public int getPort() {
        return Math.toIntExact(getLongProperty("port", 465L));
    }

    /**
     * Is implicit TLS (SMTPS) enabled.
     *
     * @return Boolean.
     */
    public boolean isSecure() {
        return getBooleanProperty("secure", true);
    }

    public String getUser() {
        return getStringProperty("auth.user", "");
    }

    public String getPassword() {
        return getStringProperty("auth.pass", "");
    }

    /**
     * Gets the envelope sender for all outgoing mail.
     * <p>Defaults to the authentication user.
     *
     * @return Address string.
     */
    public String getFrom() {
        return getStringProperty("from", getUser());
    }

    public long getConnectionTimeoutMillis() {
        return getLongProperty("connectionTimeout", 10000L);
    }

    public long getTimeoutMillis() {
        return getLongProperty("timeout", 30000L);
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
