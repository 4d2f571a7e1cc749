package com.mailexchange.pipeline;

/**
 * Terminal state of one pipeline run.
 */
public enum ProcessingOutcome {
    DUPLICATE("duplicate"),
    SENDER_REJECTED("sender_rejected"),
    NO_MATCH("no_match"),
    FORWARDED("forwarded");

    private final String tag;

    ProcessingOutcome(String tag) {
        this.tag = tag;
    }

    /**
     * Gets metric tag value.
     *
     * @return Tag string.
     */
    public String getTag() {
        return tag;
    }
}
