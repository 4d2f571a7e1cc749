/**
 * Durable record of processed message ids.
 */
package com.mailexchange.dedup;
