package com.mailexchange.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parsed inbound message.
 *
 * <p>Immutable once built. Owned by the pipeline for the duration of one run.
 *
 * <pre>
 * InboundMessage message = new InboundMessage.Builder()
 *         .setMessageId("&lt;abc@example.com&gt;")
 *         .setSubject("Order photos [PHOTO]")
 *         .setFrom("Alice &lt;alice@example.com&gt;")
 *         .setFromAddress("alice@example.com")
 *         .setText("See attached.")
 *         .build();
 * </pre>
 */
public final class InboundMessage {

    /**
     * Subject used when the source message has none.
     */
    public static final String NO_SUBJECT = "(no subject)";

    private final String messageId;
    private final String subject;
    private final String from;
    private final String fromAddress;
    private final String text;
    private final String html;
    private final List<Attachment> attachments;

    private InboundMessage(Builder builder) {
        this.messageId = Objects.requireNonNull(builder.messageId, "messageId");
        this.subject = builder.subject != null ? builder.subject : NO_SUBJECT;
        this.from = builder.from != null ? builder.from : "unknown";
        this.fromAddress = builder.fromAddress != null ? builder.fromAddress : "";
        this.text = builder.text != null ? builder.text : "";
        this.html = builder.html;
        this.attachments = Collections.unmodifiableList(new ArrayList<>(builder.attachments));
    }

    public String getMessageId() {
        return messageId;
    }

    public String getSubject() {
        return subject;
    }

    /**
     * Gets the From header display text.
     *
     * @return From text, "unknown" if absent.
     */
    public String getFrom() {
        return from;
    }

    /**
     * Gets the first From address.
     *
     * @return Address, empty if it could not be determined.
     */
    public String getFromAddress() {
        return fromAddress;
    }

    public String getText() {
        return text;
    }

    /**
     * Gets the HTML body.
     *
     * @return HTML or null if the message has none.
     */
    public String getHtml() {
        return html;
    }

    public List<Attachment> getAttachments() {
        return attachments;
    }

    /**
     * InboundMessage builder.
     */
    public static class Builder {
        private String messageId;
        private String subject;
        private String from;
        private String fromAddress;
        private String text;
        private String html;
        private final List<Attachment> attachments = new ArrayList<>();

        public Builder setMessageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder setSubject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder setFrom(String from) {
            this.from = from;
            return this;
        }

        public Builder setFromAddress(String fromAddress) {
            this.fromAddress = fromAddress;
            return this;
        }

        public Builder setText(String text) {
            this.text = text;
            return this;
        }

        public Builder setHtml(String html) {
            this.html = html;
            return this;
        }

        public Builder addAttachment(Attachment attachment) {
            this.attachments.add(attachment);
            return this;
        }

        public InboundMessage build() {
            return new InboundMessage(this);
        }
    }
}
