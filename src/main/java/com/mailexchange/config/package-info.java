/**
 * Configuration accessors.
 *
 * <p>The forwarder reads a single JSON5 file parsed with Gson into a map.
 * <br>{@link com.mailexchange.config.BasicConfig} offers typed getters with defaults
 * <br>and each section gets its own accessor class on top.
 *
 * @see com.mailexchange.config.ForwarderConfig
 */
package com.mailexchange.config;
