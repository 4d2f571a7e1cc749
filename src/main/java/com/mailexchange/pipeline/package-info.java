/**
 * Per-message processing.
 *
 * <p>{@link com.mailexchange.pipeline.ForwardPipeline} runs dedup, sender filtering, rule matching,
 * <br>delivery, reporting and history recording, in that order, for one message at a time.
 */
package com.mailexchange.pipeline;
