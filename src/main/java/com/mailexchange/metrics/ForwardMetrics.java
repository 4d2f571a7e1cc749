package com.mailexchange.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Forwarding Micrometer metrics.
 *
 * <p>Provides counters for processed messages, recipient outcomes, send attempts,
 * sender report failures and dedup persistence failures.
 * <p>All methods are no-ops while no registry is registered and never throw.
 */
public final class ForwardMetrics {
    private static final Logger log = LogManager.getLogger(ForwardMetrics.class);

    static final String MESSAGES = "forward.messages";
    static final String RECIPIENTS = "forward.recipients";
    static final String ATTEMPTS = "forward.send.attempts";
    static final String NOTIFICATION_FAILURES = "forward.notifications.failed";
    static final String PERSISTENCE_FAILURES = "forward.dedup.persistence.failures";

    /**
     * Private constructor for utility class.
     */
    private ForwardMetrics() {
    }

    /**
     * Initialize the untagged counters with zero values.
     * <p>This should be called during application startup to ensure metrics appear in the scrape
     * output before any mail arrives.
     */
    public static void initialize() {
        MeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
        if (registry == null) {
            log.warn("Cannot initialize forward metrics - Prometheus registry is null");
            return;
        }
        counter(registry, NOTIFICATION_FAILURES, "Sender reports that could not be sent");
        counter(registry, PERSISTENCE_FAILURES, "Processed message ids that could not be persisted");
        log.info("Forward metrics initialized");
    }

    /**
     * Increment the processed message counter.
     *
     * @param outcome Outcome tag value.
     */
    public static void incrementMessage(String outcome) {
        increment(MESSAGES, "Inbound messages by processing outcome", "outcome", outcome);
    }

    /**
     * Increment the recipient result counter.
     *
     * @param success Whether the recipient was delivered.
     */
    public static void incrementRecipientResult(boolean success) {
        increment(RECIPIENTS, "Recipient deliveries after retries", "result", success ? "success" : "failed");
    }

    /**
     * Increment the send attempt counter.
     *
     * @param success Whether the attempt was accepted.
     */
    public static void incrementSendAttempt(boolean success) {
        increment(ATTEMPTS, "Individual transport send attempts", "result", success ? "success" : "failed");
    }

    /**
     * Increment the sender report failure counter.
     */
    public static void incrementNotificationFailure() {
        increment(NOTIFICATION_FAILURES, "Sender reports that could not be sent", null, null);
    }

    /**
     * Increment the dedup persistence failure counter.
     */
    public static void incrementPersistenceFailure() {
        increment(PERSISTENCE_FAILURES, "Processed message ids that could not be persisted", null, null);
    }

    private static void increment(String name, String description, String tagKey, String tagValue) {
        try {
            MeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
            if (registry == null) {
                return;
            }

            Counter.Builder builder = Counter.builder(name).description(description);
            if (tagKey != null) {
                builder.tag(tagKey, tagValue);
            }
            builder.register(registry).increment();
        } catch (Exception e) {
            log.warn("Failed to increment {} counter: {}", name, e.getMessage());
        }
    }

    private static void counter(MeterRegistry registry, String name, String description) {
        Counter.builder(name).description(description).register(registry);
    }
}
