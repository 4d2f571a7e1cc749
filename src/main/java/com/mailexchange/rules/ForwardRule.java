package com.mailexchange.rules;

import java.util.List;
import java.util.Objects;

/**
 * Forwarding rule.
 *
 * <p>A tag matched case-insensitively against the subject and the recipients to forward to.
 * <p>Recipient order is kept for deterministic iteration only, it is not a priority.
 */
public final class ForwardRule {
    private final String tag;
    private final List<String> recipients;

    /**
     * Constructs a new ForwardRule instance.
     *
     * @param tag        Subject tag.
     * @param recipients Recipient addresses.
     */
    public ForwardRule(String tag, List<String> recipients) {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.recipients = List.copyOf(Objects.requireNonNull(recipients, "recipients"));
    }

    public String getTag() {
        return tag;
    }

    public List<String> getRecipients() {
        return recipients;
    }

    @Override
    public String toString() {
        return "ForwardRule{tag='" + tag + "', recipients=" + recipients + "}";
    }
}
