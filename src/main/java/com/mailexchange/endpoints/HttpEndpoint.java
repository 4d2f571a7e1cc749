package com.mailexchange.endpoints;

import com.mailexchange.config.EndpointConfig;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;

/**
 * Abstract base class for HTTP endpoints.
 *
 * <p>Provides common functionality including:
 * <ul>
 *   <li>Response generation utilities for JSON, HTML and plain text</li>
 *   <li>Resource file loading from classpath</li>
 *   <li>Server shutdown</li>
 * </ul>
 */
public abstract class HttpEndpoint {
    private static final Logger log = LogManager.getLogger(HttpEndpoint.class);

    /**
     * Embedded HTTP server instance.
     */
    protected HttpServer server;

    /**
     * Starts the HTTP endpoint with the given configuration.
     *
     * @param config EndpointConfig containing bind address and port.
     * @throws IOException If an I/O error occurs during server startup.
     */
    public abstract void start(EndpointConfig config) throws IOException;

    /**
     * Stops the HTTP server if running.
     */
    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
            log.info("{} stopped", getClass().getSimpleName());
        }
    }

    /**
     * Gets the bound port.
     *
     * @return Port number or -1 when not running.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    /**
     * Sends a JSON response with the specified HTTP status code.
     *
     * @param exchange HTTP exchange.
     * @param code     HTTP status code.
     * @param json     JSON payload.
     * @throws IOException If an I/O error occurs.
     */
    void sendJson(HttpExchange exchange, int code, String json) throws IOException {
        sendResponse(exchange, code, "application/json; charset=utf-8", json);
    }

    /**
     * Sends an HTML response with the specified HTTP status code.
     *
     * @param exchange HTTP exchange.
     * @param code     HTTP status code.
     * @param html     HTML payload.
     * @throws IOException If an I/O error occurs.
     */
    void sendHtml(HttpExchange exchange, int code, String html) throws IOException {
        sendResponse(exchange, code, "text/html; charset=utf-8", html);
    }

    /**
     * Sends a plain text response with the specified HTTP status code.
     *
     * @param exchange HTTP exchange.
     * @param code     HTTP status code.
     * @param text     Plain text payload.
     * @throws IOException If an I/O error occurs.
     */
    void sendText(HttpExchange exchange, int code, String text) throws IOException {
        sendResponse(exchange, code, "text/plain; charset=utf-8", text);
    }

    /**
     * Sends a response with the specified HTTP status code, content type, and payload.
     *
     * @param exchange    HTTP exchange.
     * @param code        HTTP status code.
     * @param contentType Content-Type header value.
     * @param response    Response payload.
     * @throws IOException If an I/O error occurs.
     */
    protected void sendResponse(HttpExchange exchange, int code, String contentType, String response) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
        log.trace("Sent response: status={}, contentType={}, bytes={}", code, contentType, bytes.length);
    }

    /**
     * Reads a resource file from the classpath into a string.
     *
     * @param path The path to the resource file.
     * @return The content of the file as a string.
     * @throws IOException If the resource is not found or cannot be read.
     */
    String readResourceFile(String path) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is == null) {
                throw new IOException("Resource not found: " + path);
            }
            try (InputStreamReader isr = new InputStreamReader(is, StandardCharsets.UTF_8);
                 BufferedReader reader = new BufferedReader(isr)) {
                return reader.lines().collect(Collectors.joining("\n"));
            }
        }
    }
}
