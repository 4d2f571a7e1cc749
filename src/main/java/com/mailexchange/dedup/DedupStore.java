package com.mailexchange.dedup;

/**
 * Record of message identifiers already processed.
 *
 * <p>Entries are never removed. An identifier present in the store must never be processed again.
 */
public interface DedupStore {

    /**
     * Checks if the message was already processed.
     *
     * @param messageId Message identifier.
     * @return True if processed.
     */
    boolean isProcessed(String messageId);

    /**
     * Marks the message as processed.
     * <p>Must not return before the identifier is durably recorded.
     * <br>The identifier counts as processed even when recording fails.
     *
     * @param messageId Message identifier.
     * @throws DedupPersistenceException Unable to record the identifier durably.
     */
    void markProcessed(String messageId) throws DedupPersistenceException;

    /**
     * Gets the number of recorded identifiers.
     *
     * @return Count.
     */
    int size();
}
