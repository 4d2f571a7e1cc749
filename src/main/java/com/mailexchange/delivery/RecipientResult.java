package com.mailexchange.delivery;

/**
 * Delivery outcome for one recipient after all attempts.
 *
 * <p>Exactly one result exists per recipient per message regardless of retries.
 */
public final class RecipientResult {
    private final String recipient;
    private final boolean success;
    private final int attempts;
    private final String error;

    private RecipientResult(String recipient, boolean success, int attempts, String error) {
        this.recipient = recipient;
        this.success = success;
        this.attempts = attempts;
        this.error = error;
    }

    /**
     * Creates a successful result.
     *
     * @param recipient Recipient address.
     * @param attempts  Attempt that succeeded, 1 based.
     * @return RecipientResult instance.
     */
    public static RecipientResult success(String recipient, int attempts) {
        return new RecipientResult(recipient, true, attempts, null);
    }

    /**
     * Creates a failed result.
     *
     * @param recipient Recipient address.
     * @param attempts  Attempts made.
     * @param error     Last error message.
     * @return RecipientResult instance.
     */
    public static RecipientResult failure(String recipient, int attempts, String error) {
        return new RecipientResult(recipient, false, attempts, error);
    }

    public String getRecipient() {
        return recipient;
    }

    public boolean isSuccess() {
        return success;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * Gets last error message.
     *
     * @return Error or null on success.
     */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "RecipientResult{recipient='" + recipient + "', success=" + success
                + ", attempts=" + attempts + (error != null ? ", error='" + error + "'" : "") + "}";
    }
}
