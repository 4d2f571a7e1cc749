/**
 * Micrometer counters and the shared Prometheus registry.
 */
package com.mailexchange.metrics;
