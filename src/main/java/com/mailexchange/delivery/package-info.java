/**
 * Forward delivery.
 *
 * <p>{@link com.mailexchange.delivery.DeliveryEngine} sends one copy per recipient concurrently.
 * <br>Each recipient retries independently with linear backoff from
 * {@link com.mailexchange.delivery.RetryScheduler}.
 * <br>Sending goes through the {@link com.mailexchange.delivery.MailTransport} seam,
 * backed by Jakarta Mail in production.
 */
package com.mailexchange.delivery;
