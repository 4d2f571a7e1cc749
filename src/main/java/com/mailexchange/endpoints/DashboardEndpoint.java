package com.mailexchange.endpoints;

import com.google.gson.Gson;
import com.mailexchange.config.EndpointConfig;
import com.mailexchange.history.TaskHistory;
import com.mailexchange.metrics.MetricsRegistry;
import com.mailexchange.rules.ForwardRule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Operator dashboard.
 *
 * <p>Read-only HTTP surface over the task history, the configured rules and the metrics.
 * <ul>
 *   <li><b>GET /</b> - HTML dashboard, rendered client side from /api/tasks.</li>
 *   <li><b>GET /api/tasks</b> - task history snapshot, newest first.</li>
 *   <li><b>GET /api/rules</b> - configured rules.</li>
 *   <li><b>GET /health</b> - liveness.</li>
 *   <li><b>GET /metrics</b> - Prometheus scrape output.</li>
 * </ul>
 */
public class DashboardEndpoint extends HttpEndpoint {
    private static final Logger log = LogManager.getLogger(DashboardEndpoint.class);

    private final Gson gson = new Gson();
    private final TaskHistory history;
    private final List<ForwardRule> rules;
    private ExecutorService executor;

    /**
     * Constructs a new DashboardEndpoint instance.
     *
     * @param history TaskHistory instance.
     * @param rules   Configured rules.
     */
    public DashboardEndpoint(TaskHistory history, List<ForwardRule> rules) {
        this.history = history;
        this.rules = List.copyOf(rules);
    }

    @Override
    public void start(EndpointConfig config) throws IOException {
        start(config.getBind(), config.getPort(0));
    }

    /**
     * Starts the endpoint on the given address.
     *
     * @param bind Bind address.
     * @param port Port, 0 for an ephemeral port.
     * @throws IOException If an I/O error occurs during server startup.
     */
    public void start(String bind, int port) throws IOException {
        server = HttpServer.create(new InetSocketAddress(bind, port), 10);

        server.createContext("/", get(this::handleIndex));
        server.createContext("/api/tasks", get(this::handleTasks));
        server.createContext("/api/rules", get(this::handleRules));
        server.createContext("/health", get(this::handleHealth));
        server.createContext("/metrics", get(this::handleMetrics));

        executor = Executors.newFixedThreadPool(2, new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger();

            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, "dashboard-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        });
        server.setExecutor(executor);
        server.start();

        log.info("Web interface: http://localhost:{}/", getPort());
    }

    /**
     * Stops the server and its request executor.
     */
    @Override
    public void stop() {
        super.stop();
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    /**
     * Gets the request executor.
     *
     * @return ExecutorService instance or null when not running.
     */
    ExecutorService getExecutor() {
        return executor;
    }

    /**
     * Wraps a handler with method checking and error handling.
     *
     * @param handler Handler.
     * @return HttpHandler instance.
     */
    private HttpHandler get(HttpHandler handler) {
        return exchange -> {
            log.debug("Handling {}: method={}, remote={}",
                    exchange.getRequestURI(), exchange.getRequestMethod(), exchange.getRemoteAddress());
            try {
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    exchange.getResponseHeaders().set("Allow", "GET");
                    sendText(exchange, 405, "Method Not Allowed");
                    return;
                }
                handler.handle(exchange);
            } catch (IOException e) {
                log.error("Error handling {}: {}", exchange.getRequestURI(), e.getMessage());
                sendText(exchange, 500, "Internal Server Error");
            } finally {
                exchange.close();
            }
        };
    }

    private void handleIndex(HttpExchange exchange) throws IOException {
        if (!"/".equals(exchange.getRequestURI().getPath())) {
            sendText(exchange, 404, "Not Found");
            return;
        }
        sendHtml(exchange, 200, readResourceFile("dashboard.html"));
    }

    private void handleTasks(HttpExchange exchange) throws IOException {
        sendJson(exchange, 200, gson.toJson(history.snapshot()));
    }

    private void handleRules(HttpExchange exchange) throws IOException {
        sendJson(exchange, 200, gson.toJson(rules));
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        sendJson(exchange, 200, "{\"status\":\"UP\"}");
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        PrometheusMeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
        if (registry == null) {
            sendText(exchange, 503, "Metrics not available");
            return;
        }
        sendResponse(exchange, 200, "text/plain; version=0.0.4; charset=utf-8", registry.scrape());
    }
}
