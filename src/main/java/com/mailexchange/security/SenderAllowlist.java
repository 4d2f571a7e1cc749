package com.mailexchange.security;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Sender allow-list.
 *
 * <p>An empty list allows every sender.
 * <p>Otherwise a sender is allowed when its lowercased address contains at least one lowercased entry.
 * <br>This covers full addresses ({@code "alice@example.com"}) and bare domains ({@code "@example.com"}).
 * <p>No wildcard or regex syntax is supported.
 */
public class SenderAllowlist {
    private static final Logger log = LogManager.getLogger(SenderAllowlist.class);

    private final List<String> entries;

    /**
     * Constructs a new SenderAllowlist instance.
     *
     * @param entries Allow-list entries, null or empty allows all.
     */
    public SenderAllowlist(List<String> entries) {
        List<String> normalized = new ArrayList<>();
        if (entries != null) {
            for (String entry : entries) {
                if (entry != null && !entry.isEmpty()) {
                    normalized.add(entry.toLowerCase(Locale.ROOT));
                }
            }
        }
        this.entries = List.copyOf(normalized);
    }

    /**
     * Checks if the sender is allowed.
     *
     * @param senderAddress Sender address, null is treated as empty.
     * @return True if allowed.
     */
    public boolean isAllowed(String senderAddress) {
        if (entries.isEmpty()) {
            return true;
        }

        String address = senderAddress != null ? senderAddress.toLowerCase(Locale.ROOT) : "";
        for (String entry : entries) {
            if (address.contains(entry)) {
                log.debug("Sender {} allowed by entry: {}", senderAddress, entry);
                return true;
            }
        }

        return false;
    }

    public List<String> getEntries() {
        return entries;
    }
}
