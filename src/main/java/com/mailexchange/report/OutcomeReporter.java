package com.mailexchange.report;

import com.mailexchange.delivery.MailTransport;
import com.mailexchange.delivery.OutboundEmail;
import com.mailexchange.delivery.RecipientResult;
import com.mailexchange.delivery.TransportException;
import com.mailexchange.metrics.ForwardMetrics;
import com.mailexchange.pipeline.InboundMessage;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Sender report dispatcher.
 *
 * <p>Builds a {@link ForwardReport} from delivery results, renders it and sends it back to the
 * original sender in a single best-effort attempt.
 * <ul>
 *     <li>No sender address: nothing is sent, this is not an error.</li>
 *     <li>Render or send failure: logged and counted, never thrown. Delivery has already happened.</li>
 * </ul>
 */
public class OutcomeReporter {
    private static final Logger log = LogManager.getLogger(OutcomeReporter.class);

    private final MailTransport transport;
    private final NotificationRenderer renderer;
    private final String envelopeFrom;
    private final boolean enabled;
    private final Clock clock;

    /**
     * Constructs a new OutcomeReporter instance.
     *
     * @param transport    Mail transport.
     * @param renderer     Notification renderer.
     * @param envelopeFrom Envelope sender for reports.
     * @param enabled      Send reports at all.
     */
    public OutcomeReporter(MailTransport transport, NotificationRenderer renderer, String envelopeFrom, boolean enabled) {
        this(transport, renderer, envelopeFrom, enabled, Clock.systemUTC());
    }

    /**
     * Constructs a new OutcomeReporter instance with custom clock.
     *
     * @param transport    Mail transport.
     * @param renderer     Notification renderer.
     * @param envelopeFrom Envelope sender for reports.
     * @param enabled      Send reports at all.
     * @param clock        Clock for the completion timestamp.
     */
    public OutcomeReporter(MailTransport transport, NotificationRenderer renderer, String envelopeFrom, boolean enabled, Clock clock) {
        this.transport = transport;
        this.renderer = renderer;
        this.envelopeFrom = envelopeFrom;
        this.enabled = enabled;
        this.clock = clock;
    }

    /**
     * Reports a forward outcome to the original sender.
     *
     * @param message        Inbound message.
     * @param results        Recipient results.
     * @param durationMillis Elapsed processing time.
     */
    public void report(InboundMessage message, List<RecipientResult> results, long durationMillis) {
        if (!enabled) {
            log.debug("Sender reports disabled, skipping: {}", message.getSubject());
            return;
        }

        String replyTo = message.getFromAddress();
        if (StringUtils.isBlank(replyTo)) {
            log.debug("No sender address, skipping report: {}", message.getSubject());
            return;
        }

        try {
            ForwardReport report = buildReport(message, results, durationMillis);
            OutboundEmail email = new OutboundEmail()
                    .setEnvelopeFrom(envelopeFrom)
                    .setTo(replyTo)
                    .setSubject(renderer.getSubject(report))
                    .setText(renderer.getText(report))
                    .setHtml(renderer.getHtml(report));

            transport.send(email);
            log.info("Report sent to {}: {}", replyTo, message.getSubject());
        } catch (TransportException | RuntimeException e) {
            ForwardMetrics.incrementNotificationFailure();
            log.warn("Failed to send report to {}: {} - {}", replyTo, message.getSubject(), e.getMessage());
        }
    }

    /**
     * Builds the structured report.
     *
     * @param message        Inbound message.
     * @param results        Recipient results.
     * @param durationMillis Elapsed processing time.
     * @return ForwardReport instance.
     */
    ForwardReport buildReport(InboundMessage message, List<RecipientResult> results, long durationMillis) {
        return new ForwardReport(message.getSubject(), results, durationMillis, Instant.now(clock).toString());
    }
}
