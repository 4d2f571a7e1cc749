package com.mailexchange.imap;

import com.mailexchange.config.ImapConfig;

import java.util.Properties;

/**
 * Jakarta Mail session properties for the mailbox connection.
 */
public final class ImapProperties {

    /**
     * Private constructor for utility class.
     */
    private ImapProperties() {
    }

    /**
     * Gets the store protocol.
     *
     * @param config ImapConfig instance.
     * @return "imaps" for implicit TLS, "imap" otherwise.
     */
    public static String getProtocol(ImapConfig config) {
        return config.isTls() ? "imaps" : "imap";
    }

    /**
     * Builds Jakarta Mail session properties for IMAP/IMAPS.
     *
     * @param config ImapConfig instance.
     * @return Properties instance.
     */
    public static Properties build(ImapConfig config) {
        Properties props = new Properties();
        String protocol = getProtocol(config);
        String host = config.getHost();
        String port = String.valueOf(config.getPort());

        props.put("mail.store.protocol", protocol);
        for (String prefix : new String[]{"mail.imap.", "mail.imaps."}) {
            props.put(prefix + "host", host);
            props.put(prefix + "port", port);
            props.put(prefix + "connectiontimeout", "10000");
            props.put(prefix + "timeout", "20000");
        }
        props.put("mail.imap.ssl.enable", String.valueOf(config.isTls()));
        props.put("mail.imaps.ssl.enable", "true");

        // Upgrade plain connections where the server offers it.
        if (!config.isTls()) {
            props.put("mail.imap.starttls.enable", "true");
        }

        props.put("mail.debug", String.valueOf(config.isDebug()));

        return props;
    }
}
