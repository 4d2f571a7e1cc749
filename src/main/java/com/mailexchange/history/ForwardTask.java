package com.mailexchange.history;

import com.mailexchange.delivery.RecipientResult;
import com.mailexchange.pipeline.InboundMessage;
import com.mailexchange.rules.ForwardRule;

import java.util.List;

/**
 * Historical record of one matched and forwarded message.
 *
 * <p>Never mutated after creation. Field names double as the dashboard JSON schema.
 */
public final class ForwardTask {
    private final long id;
    private final String timestamp;
    private final String subject;
    private final String from;
    private final String matchedTag;
    private final List<String> recipients;
    private final ForwardStatus status;
    private final String error;

    /**
     * Constructs a new ForwardTask instance.
     *
     * @param id         Sequence id.
     * @param timestamp  Creation time, ISO-8601.
     * @param subject    Original subject.
     * @param from       Sender display text.
     * @param matchedTag Tag of the matched rule.
     * @param recipients Rule recipients.
     * @param status     Aggregate status.
     * @param error      Error summary or null.
     */
    public ForwardTask(long id, String timestamp, String subject, String from, String matchedTag,
                       List<String> recipients, ForwardStatus status, String error) {
        this.id = id;
        this.timestamp = timestamp;
        this.subject = subject;
        this.from = from;
        this.matchedTag = matchedTag;
        this.recipients = List.copyOf(recipients);
        this.status = status;
        this.error = error;
    }

    /**
     * Aggregates recipient results into a task.
     * <p>Status is {@link ForwardStatus#FAILED} if any recipient failed,
     * with error summary {@code "<failed>/<total> failed"}.
     *
     * @param id        Sequence id.
     * @param timestamp Creation time, ISO-8601.
     * @param message   Inbound message.
     * @param rule      Matched rule.
     * @param results   Recipient results.
     * @return ForwardTask instance.
     */
    public static ForwardTask of(long id, String timestamp, InboundMessage message, ForwardRule rule, List<RecipientResult> results) {
        long failCount = results.stream().filter(r -> !r.isSuccess()).count();
        ForwardStatus status = failCount > 0 ? ForwardStatus.FAILED : ForwardStatus.SUCCESS;
        String error = failCount > 0 ? failCount + "/" + results.size() + " failed" : null;

        return new ForwardTask(id, timestamp, message.getSubject(), message.getFrom(), rule.getTag(),
                rule.getRecipients(), status, error);
    }

    public long getId() {
        return id;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public String getSubject() {
        return subject;
    }

    public String getFrom() {
        return from;
    }

    public String getMatchedTag() {
        return matchedTag;
    }

    public List<String> getRecipients() {
        return recipients;
    }

    public ForwardStatus getStatus() {
        return status;
    }

    /**
     * Gets error summary.
     *
     * @return Summary or null when every recipient succeeded.
     */
    public String getError() {
        return error;
    }
}
