package com.mailexchange.config;

import com.mailexchange.rules.ForwardRule;
import org.apache.commons.lang3.StringUtils;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Forwarder configuration.
 *
 * <p>This class provides type safe access to the root forwarder configuration file.
 * <p>It maps the mailbox, transport and dashboard sections to their own config objects
 * and the rule list to immutable {@link ForwardRule} instances.
 *
 * @see ImapConfig
 * @see SmtpConfig
 * @see EndpointConfig
 */
@SuppressWarnings("unchecked")
public class ForwarderConfig extends ConfigFoundation {

    /**
     * Constructs a new ForwarderConfig instance.
     */
    public ForwarderConfig() {
        super();
    }

    /**
     * Constructs a new ForwarderConfig instance.
     *
     * @param map Configuration map.
     */
    public ForwarderConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ForwarderConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ForwarderConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets mailbox source config.
     *
     * @return ImapConfig instance.
     */
    public ImapConfig getImap() {
        return new ImapConfig(getMapProperty("imap"));
    }

    /**
     * Gets mail transport config.
     *
     * @return SmtpConfig instance.
     */
    public SmtpConfig getSmtp() {
        return new SmtpConfig(getMapProperty("smtp"));
    }

    /**
     * Gets dashboard endpoint config.
     * <p>Built from the {@code webPort} and {@code webBind} root keys.
     *
     * @return EndpointConfig instance.
     */
    public EndpointConfig getDashboard() {
        return new EndpointConfig(Map.of(
                "port", getLongProperty("webPort", 3000L),
                "bind", getStringProperty("webBind", "0.0.0.0")
        ));
    }

    /**
     * Gets forwarding rules in configured order.
     *
     * @return Unmodifiable list of ForwardRule.
     */
    public List<ForwardRule> getRules() {
        List<ForwardRule> rules = new ArrayList<>();
        List<?> raw = getListProperty("rules");
        if (raw != null) {
            for (Object entry : raw) {
                if (entry instanceof Map) {
                    BasicConfig rule = new BasicConfig((Map<String, Object>) entry);
                    rules.add(new ForwardRule(
                            rule.getStringProperty("tag", ""),
                            rule.getStringListProperty("recipients")
                    ));
                }
            }
        }
        return Collections.unmodifiableList(rules);
    }

    /**
     * Gets subject prefix for forwarded mail.
     *
     * @return Prefix or null if not configured.
     */
    public String getForwardPrefix() {
        String prefix = getStringProperty("forwardPrefix");
        return StringUtils.isBlank(prefix) ? null : prefix;
    }

    /**
     * Gets sender allow-list entries.
     *
     * @return List of entries, empty means everyone is allowed.
     */
    public List<String> getAllowedSenders() {
        return getStringListProperty("allowedSenders");
    }

    /**
     * Gets maximum send attempts per recipient.
     *
     * @return Attempt count.
     */
    public int getRetryCount() {
        return Math.toIntExact(getLongProperty("retryCount", 3L));
    }

    /**
     * Gets the linear backoff unit.
     *
     * @return Milliseconds.
     */
    public long getRetryDelayMillis() {
        return getLongProperty("retryDelayMillis", 1000L);
    }

    /**
     * Gets data directory holding the dedup record and log file.
     * <p>Falls back to the DATA_DIR environment variable, then the working directory.
     *
     * @return Directory path.
     */
    public String getDataDir() {
        String env = System.getenv("DATA_DIR");
        return getStringProperty("dataDir", StringUtils.isBlank(env) ? "." : env);
    }

    /**
     * Gets log verbosity.
     *
     * @return Level name or null if not configured.
     */
    public String getLogLevel() {
        return getStringProperty("logLevel");
    }

    /**
     * Is sender notification enabled.
     *
     * @return Boolean.
     */
    public boolean isNotifySender() {
        return getBooleanProperty("notifySender", true);
    }

    /**
     * Validates the settings the forwarder cannot start without.
     *
     * @throws ConfigurationException Missing or invalid setting.
     */
    public void validate() throws ConfigurationException {
        List<String> errors = new ArrayList<>();

        ImapConfig imap = getImap();
        if (StringUtils.isBlank(imap.getHost())) errors.add("imap.host is required");
        if (StringUtils.isBlank(imap.getUser())) errors.add("imap.user is required");

        SmtpConfig smtp = getSmtp();
        if (StringUtils.isBlank(smtp.getHost())) errors.add("smtp.host is required");
        if (StringUtils.isBlank(smtp.getFrom())) errors.add("smtp.auth.user or smtp.from is required");

        List<ForwardRule> rules = getRules();
        if (rules.isEmpty()) {
            errors.add("at least one rule is required");
        }
        for (int i = 0; i < rules.size(); i++) {
            ForwardRule rule = rules.get(i);
            if (StringUtils.isBlank(rule.getTag())) errors.add("rules[" + i + "].tag is required");
            if (rule.getRecipients().isEmpty()) errors.add("rules[" + i + "].recipients must not be empty");
        }

        if (getRetryCount() < 1) errors.add("retryCount must be at least 1");
        if (getRetryDelayMillis() < 0) errors.add("retryDelayMillis must not be negative");

        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", errors));
        }
    }
}
