package com.mailexchange.report;

import com.mailexchange.delivery.RecipientResult;

import java.util.List;

/**
 * Structured outcome of one forward, rendered into the sender report.
 */
public final class ForwardReport {
    private final String subject;
    private final List<RecipientResult> results;
    private final long durationMillis;
    private final String timestamp;

    /**
     * Constructs a new ForwardReport instance.
     *
     * @param subject        Original subject.
     * @param results        Recipient results.
     * @param durationMillis Elapsed processing time.
     * @param timestamp      Completion time, ISO-8601.
     */
    public ForwardReport(String subject, List<RecipientResult> results, long durationMillis, String timestamp) {
        this.subject = subject;
        this.results = List.copyOf(results);
        this.durationMillis = durationMillis;
        this.timestamp = timestamp;
    }

    public String getSubject() {
        return subject;
    }

    public List<RecipientResult> getResults() {
        return results;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public int getTotalCount() {
        return results.size();
    }

    public int getSuccessCount() {
        return (int) results.stream().filter(RecipientResult::isSuccess).count();
    }

    public int getFailCount() {
        return getTotalCount() - getSuccessCount();
    }

    public boolean isAllSuccess() {
        return getFailCount() == 0;
    }
}
