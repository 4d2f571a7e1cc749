package com.mailexchange.pipeline;

import com.mailexchange.dedup.DedupPersistenceException;
import com.mailexchange.dedup.DedupStore;
import com.mailexchange.delivery.DeliveryEngine;
import com.mailexchange.delivery.RecipientResult;
import com.mailexchange.history.ForwardStatus;
import com.mailexchange.history.ForwardTask;
import com.mailexchange.history.TaskHistory;
import com.mailexchange.metrics.ForwardMetrics;
import com.mailexchange.report.OutcomeReporter;
import com.mailexchange.rules.ForwardRule;
import com.mailexchange.rules.RuleMatcher;
import com.mailexchange.security.SenderAllowlist;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Forwarding pipeline.
 *
 * <p>Runs one inbound message through dedup, sender allowlist, rule matching, delivery,
 * dedup persistence, sender report and history, in that order.
 * <ul>
 *     <li>Disallowed and unmatched messages are marked processed before returning.</li>
 *     <li>Matched messages are marked processed only after delivery completes.</li>
 * </ul>
 * <p>A crash between delivery and marking may forward the same message again on restart.
 * <br>Messages are processed one at a time. Recipient delivery inside a message stays parallel.
 */
public class ForwardPipeline {
    private static final Logger log = LogManager.getLogger(ForwardPipeline.class);

    private final DedupStore dedupStore;
    private final SenderAllowlist allowlist;
    private final RuleMatcher ruleMatcher;
    private final DeliveryEngine deliveryEngine;
    private final OutcomeReporter reporter;
    private final TaskHistory history;
    private final Clock clock;

    /**
     * Constructs a new ForwardPipeline instance.
     *
     * @param dedupStore     Dedup store.
     * @param allowlist      Sender allowlist.
     * @param ruleMatcher    Rule matcher.
     * @param deliveryEngine Delivery engine.
     * @param reporter       Outcome reporter.
     * @param history        Task history.
     */
    public ForwardPipeline(DedupStore dedupStore, SenderAllowlist allowlist, RuleMatcher ruleMatcher,
                           DeliveryEngine deliveryEngine, OutcomeReporter reporter, TaskHistory history) {
        this(dedupStore, allowlist, ruleMatcher, deliveryEngine, reporter, history, Clock.systemUTC());
    }

    /**
     * Constructs a new ForwardPipeline instance with custom clock.
     *
     * @param dedupStore     Dedup store.
     * @param allowlist      Sender allowlist.
     * @param ruleMatcher    Rule matcher.
     * @param deliveryEngine Delivery engine.
     * @param reporter       Outcome reporter.
     * @param history        Task history.
     * @param clock          Clock for timing and task timestamps.
     */
    public ForwardPipeline(DedupStore dedupStore, SenderAllowlist allowlist, RuleMatcher ruleMatcher,
                           DeliveryEngine deliveryEngine, OutcomeReporter reporter, TaskHistory history, Clock clock) {
        this.dedupStore = dedupStore;
        this.allowlist = allowlist;
        this.ruleMatcher = ruleMatcher;
        this.deliveryEngine = deliveryEngine;
        this.reporter = reporter;
        this.history = history;
        this.clock = clock;
    }

    /**
     * Processes one inbound message.
     *
     * @param message Inbound message.
     * @return Terminal outcome.
     * @throws DedupPersistenceException Unable to persist the processed marker.
     */
    public synchronized ProcessingOutcome process(InboundMessage message) throws DedupPersistenceException {
        long start = clock.millis();
        String subject = message.getSubject();
        String fromAddress = message.getFromAddress();

        log.info("New mail: \"{}\" from={} size={}KB attachments={}",
                subject, fromAddress, Math.round(message.getText().length() / 1024.0), message.getAttachments().size());

        if (dedupStore.isProcessed(message.getMessageId())) {
            log.info("Already forwarded (skip): {}", subject);
            return finish(ProcessingOutcome.DUPLICATE);
        }

        if (!allowlist.isAllowed(fromAddress)) {
            log.warn("Sender not allowed: {} - {}", fromAddress, subject);
            markProcessed(message);
            return finish(ProcessingOutcome.SENDER_REJECTED);
        }

        Optional<ForwardRule> match = ruleMatcher.match(subject);
        if (match.isEmpty()) {
            log.info("No matching rule for: {}", subject);
            markProcessed(message);
            return finish(ProcessingOutcome.NO_MATCH);
        }

        ForwardRule rule = match.get();
        long id = history.nextId();
        String timestamp = Instant.now(clock).toString();

        List<RecipientResult> results = deliveryEngine.deliver(message, rule);
        long duration = clock.millis() - start;

        ForwardTask task = ForwardTask.of(id, timestamp, message, rule, results);
        int total = results.size();
        long failCount = results.stream().filter(r -> !r.isSuccess()).count();
        if (task.getStatus() == ForwardStatus.FAILED) {
            log.error("Forward completed: {} - {}/{} success, {} failed ({}ms)", subject, total - failCount, total, failCount, duration);
        } else {
            log.info("Forward completed: {} - {}/{} success ({}ms)", subject, total, total, duration);
        }

        markProcessed(message);
        reporter.report(message, results, duration);
        history.append(task);

        return finish(ProcessingOutcome.FORWARDED);
    }

    /**
     * Persists the processed marker.
     *
     * @param message Inbound message.
     * @throws DedupPersistenceException Unable to persist.
     */
    private void markProcessed(InboundMessage message) throws DedupPersistenceException {
        dedupStore.markProcessed(message.getMessageId());
        log.info("Marked as processed: {}", message.getSubject());
    }

    private ProcessingOutcome finish(ProcessingOutcome outcome) {
        ForwardMetrics.incrementMessage(outcome.getTag());
        return outcome;
    }

    public TaskHistory getHistory() {
        return history;
    }

    public RuleMatcher getRuleMatcher() {
        return ruleMatcher;
    }
}
