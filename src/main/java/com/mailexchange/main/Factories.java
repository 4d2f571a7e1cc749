package com.mailexchange.main;

import com.mailexchange.delivery.JakartaMailTransport;
import com.mailexchange.delivery.MailTransport;
import com.mailexchange.report.DefaultNotificationRenderer;
import com.mailexchange.report.NotificationRenderer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.Callable;

/**
 * Factories for pluggable components.
 *
 * <p>This is a factories container for extensible components.
 * <br>Set a callable before {@link Server#run(String)} to inject your own.
 */
public class Factories {
    private static final Logger log = LogManager.getLogger(Factories.class);

    /**
     * Mail transport.
     * <p>Used for forwards and sender reports.
     */
    private static Callable<MailTransport> mailTransport;

    /**
     * Sender report renderer.
     */
    private static Callable<NotificationRenderer> notificationRenderer;

    /**
     * Protected constructor.
     */
    private Factories() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Sets MailTransport.
     *
     * @param callable MailTransport callable.
     */
    public static void setMailTransport(Callable<MailTransport> callable) {
        mailTransport = callable;
    }

    /**
     * Gets MailTransport.
     *
     * @return MailTransport instance.
     */
    public static MailTransport getMailTransport() {
        if (mailTransport != null) {
            try {
                return mailTransport.call();
            } catch (Exception e) {
                log.error("Error calling mail transport: {}", e.getMessage());
            }
        }

        return new JakartaMailTransport(Config.getForwarder().getSmtp());
    }

    /**
     * Sets NotificationRenderer.
     *
     * @param callable NotificationRenderer callable.
     */
    public static void setNotificationRenderer(Callable<NotificationRenderer> callable) {
        notificationRenderer = callable;
    }

    /**
     * Gets NotificationRenderer.
     *
     * @return NotificationRenderer instance.
     */
    public static NotificationRenderer getNotificationRenderer() {
        if (notificationRenderer != null) {
            try {
                return notificationRenderer.call();
            } catch (Exception e) {
                log.error("Error calling notification renderer: {}", e.getMessage());
            }
        }

        return new DefaultNotificationRenderer();
    }
}
