package com.mailexchange.delivery;

import com.mailexchange.metrics.ForwardMetrics;
import com.mailexchange.pipeline.InboundMessage;
import com.mailexchange.rules.ForwardRule;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fan-out delivery engine.
 *
 * <p>Every recipient of a matched rule gets its own task running a bounded retry loop
 * against the {@link MailTransport}. The engine waits for all tasks before returning.
 * <p>Recipient tasks share nothing but the read-only inbound message. A backoff sleep
 * suspends only its own task and a permanent failure never affects another recipient.
 * <p>There is no cancellation path: once started, every recipient runs all its attempts.
 *
 * @see RetryScheduler
 */
public class DeliveryEngine implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(DeliveryEngine.class);

    private final MailTransport transport;
    private final RetryScheduler retryScheduler;
    private final String envelopeFrom;
    private final String subjectPrefix;
    private final ExecutorService executor;

    /**
     * Constructs a new DeliveryEngine instance.
     *
     * @param transport      Mail transport.
     * @param retryScheduler Retry scheduler.
     * @param envelopeFrom   Envelope sender for forwarded mail.
     * @param subjectPrefix  Subject prefix or null.
     */
    public DeliveryEngine(MailTransport transport, RetryScheduler retryScheduler, String envelopeFrom, String subjectPrefix) {
        this.transport = transport;
        this.retryScheduler = retryScheduler;
        this.envelopeFrom = envelopeFrom;
        this.subjectPrefix = subjectPrefix;

        // Unbounded so a slow recipient never queues behind another.
        this.executor = Executors.newCachedThreadPool(new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger();

            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, "delivery-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        });
    }

    /**
     * Delivers a message to every recipient of a rule.
     *
     * @param message Inbound message.
     * @param rule    Matched rule.
     * @return One result per recipient, in rule order.
     */
    public List<RecipientResult> deliver(InboundMessage message, ForwardRule rule) {
        log.info("Forwarding from={} tag={} to={} recipients", message.getFromAddress(), rule.getTag(), rule.getRecipients().size());

        List<CompletableFuture<RecipientResult>> futures = new ArrayList<>();
        for (String recipient : rule.getRecipients()) {
            futures.add(CompletableFuture.supplyAsync(() -> sendWithRetry(message, recipient), executor));
        }

        // Barrier, waits for the slowest retry sequence.
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<RecipientResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<RecipientResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    /**
     * Sends to one recipient with bounded retry.
     * <p>Never throws, every outcome is captured in the result.
     *
     * @param message   Inbound message.
     * @param recipient Recipient address.
     * @return RecipientResult instance.
     */
    RecipientResult sendWithRetry(InboundMessage message, String recipient) {
        OutboundEmail email = buildForward(message, recipient);
        int maxAttempts = retryScheduler.getMaxAttempts();
        String lastError = "";

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                transport.send(email);
                ForwardMetrics.incrementSendAttempt(true);
                log.info("  -> {}: OK{}", recipient, attempt > 1 ? " (attempt " + attempt + ")" : "");
                ForwardMetrics.incrementRecipientResult(true);
                return RecipientResult.success(recipient, attempt);
            } catch (TransportException e) {
                lastError = errorMessage(e);
            } catch (RuntimeException e) {
                lastError = errorMessage(e);
                log.debug("Unexpected transport error for {}", recipient, e);
            }

            ForwardMetrics.incrementSendAttempt(false);
            log.warn("  -> {}: RETRY {}/{} - {}", recipient, attempt, maxAttempts, lastError);

            long wait = retryScheduler.getNextRetry(attempt);
            if (wait >= 0) {
                try {
                    retryScheduler.sleep(wait);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.error("  -> {}: interrupted after {} attempts - {}", recipient, attempt, lastError);
                    ForwardMetrics.incrementRecipientResult(false);
                    return RecipientResult.failure(recipient, attempt, lastError);
                }
            }
        }

        log.error("  -> {}: FAILED after {} attempts - {}", recipient, maxAttempts, lastError);
        ForwardMetrics.incrementRecipientResult(false);
        return RecipientResult.failure(recipient, maxAttempts, lastError);
    }

    /**
     * Builds the forwarded message for one recipient.
     * <p>Body and attachments are passed through unchanged.
     *
     * @param message   Inbound message.
     * @param recipient Recipient address.
     * @return OutboundEmail instance.
     */
    OutboundEmail buildForward(InboundMessage message, String recipient) {
        return new OutboundEmail()
                .setEnvelopeFrom(envelopeFrom)
                .setTo(recipient)
                .setSubject(subjectPrefix != null ? subjectPrefix + " " + message.getSubject() : message.getSubject())
                .setText(message.getText())
                .setHtml(message.getHtml())
                .setAttachments(message.getAttachments());
    }

    /**
     * Gets a printable error message.
     *
     * @param e Throwable.
     * @return Message, class name if the throwable has none.
     */
    private static String errorMessage(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    public RetryScheduler getRetryScheduler() {
        return retryScheduler;
    }

    /**
     * Shuts down the delivery executor.
     * <p>Running retry sequences get a grace period before being interrupted.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
