package com.mailexchange.delivery;

/**
 * Thrown when a single send attempt fails.
 * <p>Recoverable by retrying.
 */
public class TransportException extends Exception {

    /**
     * Constructs a new TransportException instance.
     *
     * @param message Error description.
     */
    public TransportException(String message) {
        super(message);
    }

    /**
     * Constructs a new TransportException instance.
     *
     * @param message Error description.
     * @param cause   Underlying failure.
     */
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
