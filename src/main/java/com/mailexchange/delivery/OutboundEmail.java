package com.mailexchange.delivery;

import com.mailexchange.pipeline.Attachment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Message handed to a {@link MailTransport}.
 *
 * <p>Used for both forwarded mail and sender reports.
 */
public class OutboundEmail {
    private String envelopeFrom;
    private String to;
    private String subject = "";
    private String text = "";
    private String html;
    private List<Attachment> attachments = new ArrayList<>();

    public String getEnvelopeFrom() {
        return envelopeFrom;
    }

    public OutboundEmail setEnvelopeFrom(String envelopeFrom) {
        this.envelopeFrom = envelopeFrom;
        return this;
    }

    public String getTo() {
        return to;
    }

    public OutboundEmail setTo(String to) {
        this.to = to;
        return this;
    }

    public String getSubject() {
        return subject;
    }

    public OutboundEmail setSubject(String subject) {
        this.subject = subject;
        return this;
    }

    public String getText() {
        return text;
    }

    public OutboundEmail setText(String text) {
        this.text = text != null ? text : "";
        return this;
    }

    /**
     * Gets HTML body.
     *
     * @return HTML or null.
     */
    public String getHtml() {
        return html;
    }

    public OutboundEmail setHtml(String html) {
        this.html = html;
        return this;
    }

    public List<Attachment> getAttachments() {
        return Collections.unmodifiableList(attachments);
    }

    public OutboundEmail setAttachments(List<Attachment> attachments) {
        this.attachments = attachments != null ? new ArrayList<>(attachments) : new ArrayList<>();
        return this;
    }
}
