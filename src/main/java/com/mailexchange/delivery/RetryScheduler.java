package com.mailexchange.delivery;

/**
 * Retry scheduler for per-recipient delivery.
 * <p>Schedules retries using a linear backoff strategy.
 * <p> The wait time after a failed attempt is calculated using the formula:
 * <pre>
 *     wait_time = DELAY_MILLIS * attempt_number
 * </pre>
 * <p> Characteristics with the defaults (3 attempts, 1000 ms):
 * <ul>
 *     <li>Wait after attempt 1: 1 second</li>
 *     <li>Wait after attempt 2: 2 seconds</li>
 *     <li>No wait after the last attempt, the method returns -1 to indicate no further retries.</li>
 *     <li>Total cumulative wait time if all attempts fail: 3 seconds</li>
 * </ul>
 * <p> Example usage:
 * <pre>
 *     long wait = scheduler.getNextRetry(attempt);
 *     if (wait &gt;= 0) scheduler.sleep(wait);
 * </pre>
 */
public class RetryScheduler {

    /**
     * Default maximum attempts.
     */
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    /**
     * Default backoff unit in milliseconds.
     */
    public static final long DEFAULT_DELAY_MILLIS = 1000L;

    private final int maxAttempts;
    private final long delayMillis;
    private final Sleeper sleeper;

    /**
     * Constructs a new RetryScheduler with default settings.
     */
    public RetryScheduler() {
        this(DEFAULT_MAX_ATTEMPTS, DEFAULT_DELAY_MILLIS);
    }

    /**
     * Constructs a new RetryScheduler instance.
     *
     * @param maxAttempts Maximum attempts per recipient, at least 1.
     * @param delayMillis Backoff unit.
     */
    public RetryScheduler(int maxAttempts, long delayMillis) {
        this(maxAttempts, delayMillis, Thread::sleep);
    }

    /**
     * Constructs a new RetryScheduler instance with custom sleeper.
     *
     * @param maxAttempts Maximum attempts per recipient, at least 1.
     * @param delayMillis Backoff unit.
     * @param sleeper     Sleeper used between attempts.
     */
    public RetryScheduler(int maxAttempts, long delayMillis, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (delayMillis < 0) {
            throw new IllegalArgumentException("delayMillis must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.delayMillis = delayMillis;
        this.sleeper = sleeper;
    }

    /**
     * Get the wait before the next attempt.
     *
     * @param attempt Attempt that just failed, 1 based.
     * @return Wait time in milliseconds or -1 if no more attempts.
     */
    public long getNextRetry(int attempt) {
        if (attempt >= maxAttempts) {
            return -1; // No more retries.
        }

        return delayMillis * attempt;
    }

    /**
     * Sleeps for the given time.
     * <p>Only the calling thread is suspended.
     *
     * @param millis Milliseconds.
     * @throws InterruptedException Interrupted while waiting.
     */
    public void sleep(long millis) throws InterruptedException {
        if (millis > 0) {
            sleeper.sleep(millis);
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getDelayMillis() {
        return delayMillis;
    }

    /**
     * Sleep strategy.
     */
    @FunctionalInterface
    public interface Sleeper {

        /**
         * Suspends the calling thread.
         *
         * @param millis Milliseconds.
         * @throws InterruptedException Interrupted while waiting.
         */
        void sleep(long millis) throws InterruptedException;
    }
}
