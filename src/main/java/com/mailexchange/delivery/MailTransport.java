package com.mailexchange.delivery;

/**
 * Mail transport interface.
 *
 * <p>Accepts one constructed message and either confirms acceptance by returning or fails.
 * <p>Implementations must be safe to call from several threads at once.
 */
public interface MailTransport {

    /**
     * Sends a message.
     *
     * @param email Message to send.
     * @throws TransportException The relay did not accept the message.
     */
    void send(OutboundEmail email) throws TransportException;
}
