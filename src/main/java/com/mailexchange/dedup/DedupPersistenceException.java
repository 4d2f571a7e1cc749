package com.mailexchange.dedup;

import java.io.IOException;

/**
 * Thrown when a processed message identifier could not be written to durable storage.
 */
public class DedupPersistenceException extends IOException {

    private final String messageId;

    /**
     * Constructs a new DedupPersistenceException instance.
     *
     * @param messageId Message identifier that failed to persist.
     * @param cause     Underlying I/O failure.
     */
    public DedupPersistenceException(String messageId, Throwable cause) {
        super("Unable to persist processed message id " + messageId + ": " + cause.getMessage(), cause);
        this.messageId = messageId;
    }

    public String getMessageId() {
        return messageId;
    }
}
