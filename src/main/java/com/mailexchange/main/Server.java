package com.mailexchange.main;

import com.mailexchange.config.EndpointConfig;
import com.mailexchange.config.ForwarderConfig;
import com.mailexchange.dedup.FileDedupStore;
import com.mailexchange.delivery.DeliveryEngine;
import com.mailexchange.delivery.MailTransport;
import com.mailexchange.delivery.RetryScheduler;
import com.mailexchange.endpoints.DashboardEndpoint;
import com.mailexchange.history.TaskHistory;
import com.mailexchange.imap.ImapListener;
import com.mailexchange.imap.InboundMessageParser;
import com.mailexchange.metrics.ForwardMetrics;
import com.mailexchange.metrics.MetricsRegistry;
import com.mailexchange.pipeline.ForwardPipeline;
import com.mailexchange.report.OutcomeReporter;
import com.mailexchange.rules.RuleMatcher;
import com.mailexchange.security.SenderAllowlist;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configurator;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.nio.file.Paths;

/**
 * Main server class for the mail forwarder.
 *
 * <p>This class is responsible for initializing and managing the service lifecycle.
 * <p>It loads configuration, wires the forwarding pipeline and starts the dashboard and the
 * IMAP listener.
 *
 * <p>The server is started by calling the static {@link #run(String)} method with the path
 * to the configuration file or directory.
 *
 * @see ForwardPipeline
 * @see Foundation
 */
public class Server extends Foundation {

    private static ImapListener listener;
    private static DashboardEndpoint dashboard;
    private static DeliveryEngine deliveryEngine;

    /**
     * Initializes and starts the forwarder.
     *
     * @param path Configuration file or directory path, may be null.
     * @throws ConfigurationException If there is an issue with the configuration.
     */
    public static void run(String path) throws ConfigurationException {
        init(path); // Load and validate configuration.

        ForwarderConfig config = Config.getForwarder();
        configureLogging(config);
        startMetrics();

        FileDedupStore dedupStore;
        try {
            dedupStore = new FileDedupStore(Paths.get(config.getDataDir(), FileDedupStore.FILE_NAME));
        } catch (IOException e) {
            ConfigurationException ce = new ConfigurationException("Unable to load forwarded ids: " + e.getMessage());
            ce.setRootCause(e);
            throw ce;
        }

        TaskHistory history = new TaskHistory();
        ForwardPipeline pipeline = buildPipeline(config, dedupStore, history);

        log.info("Loaded {} rules, {} forwarded IDs", config.getRules().size(), dedupStore.size());

        registerShutdownHook();
        startDashboard(config.getDashboard(), history, pipeline.getRuleMatcher());

        listener = new ImapListener(config.getImap(), pipeline, new InboundMessageParser());
        listener.start();
    }

    /**
     * Wires the forwarding pipeline.
     *
     * @param config     ForwarderConfig instance.
     * @param dedupStore Loaded dedup store.
     * @param history    Task history.
     * @return ForwardPipeline instance.
     */
    static ForwardPipeline buildPipeline(ForwarderConfig config, FileDedupStore dedupStore, TaskHistory history) {
        String from = config.getSmtp().getFrom();
        MailTransport transport = Factories.getMailTransport();

        deliveryEngine = new DeliveryEngine(
                transport,
                new RetryScheduler(config.getRetryCount(), config.getRetryDelayMillis()),
                from,
                config.getForwardPrefix()
        );

        OutcomeReporter reporter = new OutcomeReporter(
                transport,
                Factories.getNotificationRenderer(),
                from,
                config.isNotifySender()
        );

        return new ForwardPipeline(
                dedupStore,
                new SenderAllowlist(config.getAllowedSenders()),
                new RuleMatcher(config.getRules()),
                deliveryEngine,
                reporter,
                history
        );
    }

    /**
     * Points the log file at the data directory and applies the configured level.
     *
     * @param config ForwarderConfig instance.
     */
    private static void configureLogging(ForwarderConfig config) {
        System.setProperty("dataDir", config.getDataDir());
        ((LoggerContext) LogManager.getContext(false)).reconfigure();

        String level = config.getLogLevel();
        if (StringUtils.isNotBlank(level)) {
            Configurator.setLevel("com.mailexchange", Level.toLevel(level, Level.INFO));
        }
    }

    /**
     * Registers the Prometheus registry and binds JVM metrics.
     */
    private static void startMetrics() {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        MetricsRegistry.register(registry);
        ForwardMetrics.initialize();
    }

    /**
     * Starts the dashboard unless disabled.
     *
     * @param config      EndpointConfig instance.
     * @param history     Task history.
     * @param ruleMatcher Rule matcher holding the configured rules.
     */
    private static void startDashboard(EndpointConfig config, TaskHistory history, RuleMatcher ruleMatcher) {
        if (!config.isEnabled()) {
            log.info("Dashboard disabled");
            return;
        }

        try {
            dashboard = new DashboardEndpoint(history, ruleMatcher.getRules());
            dashboard.start(config);
        } catch (IOException e) {
            log.error("Unable to start dashboard: {}", e.getMessage());
        }
    }

    /**
     * Registers a shutdown hook to ensure graceful termination.
     * This hook will be called by the JVM on shutdown.
     */
    private static void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");

            if (listener != null) {
                listener.stop();
            }

            if (dashboard != null) {
                dashboard.stop();
            }

            if (deliveryEngine != null) {
                deliveryEngine.close();
            }

            log.info("Shutdown complete.");
        }));
    }
}
