/**
 * Service bootstrap.
 *
 * <p>{@link com.mailexchange.main.Server} loads configuration, wires the pipeline and starts the listeners.
 * <br>{@link com.mailexchange.main.Factories} lets callers swap the transport and the report renderer.
 */
package com.mailexchange.main;
