/**
 * HTTP endpoints.
 *
 * <p>The dashboard serves the task history, the rules, health and Prometheus metrics.
 */
package com.mailexchange.endpoints;
