package com.mailexchange.imap;

import com.mailexchange.config.ImapConfig;
import com.mailexchange.dedup.DedupPersistenceException;
import com.mailexchange.metrics.ForwardMetrics;
import com.mailexchange.pipeline.ForwardPipeline;
import com.mailexchange.pipeline.InboundMessage;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.search.FlagTerm;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.angus.mail.imap.IMAPFolder;
import org.eclipse.angus.mail.imap.IMAPStore;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * IMAP mailbox listener.
 *
 * <p>Connects to the configured mailbox, processes every unseen message through the
 * {@link ForwardPipeline} and then waits for new mail using IMAP IDLE, or polling when the
 * server does not support it.
 * <p>A message is flagged as seen only after the pipeline returned normally. Messages that
 * could not be parsed or whose processed marker could not be persisted stay unseen and are
 * offered again on the next pass.
 * <p>Any connection error or disconnect leads to a reconnect after the configured delay.
 * <br>The listener only exits when stopped.
 */
public class ImapListener implements Runnable {
    private static final Logger log = LogManager.getLogger(ImapListener.class);

    private final ImapConfig config;
    private final ForwardPipeline pipeline;
    private final InboundMessageParser parser;

    private volatile boolean running = false;
    private volatile Store store;
    private Thread thread;

    /**
     * Constructs a new ImapListener instance.
     *
     * @param config   ImapConfig instance.
     * @param pipeline Forward pipeline.
     * @param parser   Inbound message parser.
     */
    public ImapListener(ImapConfig config, ForwardPipeline pipeline, InboundMessageParser parser) {
        this.config = config;
        this.pipeline = pipeline;
        this.parser = parser;
    }

    /**
     * Starts listening on a dedicated thread.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        thread = new Thread(this, "imap-listener");
        thread.start();
    }

    /**
     * Stops listening.
     * <p>Closing the store aborts any pending IDLE.
     */
    public synchronized void stop() {
        running = false;
        closeStore();
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(TimeUnit.SECONDS.toMillis(config.getReconnectDelaySeconds() + 5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            thread = null;
        }
        log.info("IMAP listener stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Connection loop.
     */
    @Override
    public void run() {
        while (running) {
            try {
                listen();
            } catch (MessagingException | RuntimeException e) {
                if (running) {
                    log.error("IMAP error: {}", e.getMessage());
                }
            } finally {
                closeStore();
            }

            if (!running) {
                break;
            }

            log.warn("IMAP disconnected, reconnecting in {}s...", config.getReconnectDelaySeconds());
            try {
                Thread.sleep(TimeUnit.SECONDS.toMillis(config.getReconnectDelaySeconds()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    /**
     * Connects, opens the folder and processes mail until the connection drops.
     *
     * @throws MessagingException Connection or protocol error.
     */
    private void listen() throws MessagingException {
        Session session = Session.getInstance(ImapProperties.build(config));
        Store connected = session.getStore(ImapProperties.getProtocol(config));
        store = connected;
        connected.connect(config.getHost(), config.getPort(), config.getUser(), config.getPassword());
        log.info("IMAP connected");

        Folder folder = connected.getFolder(config.getFolder());
        try {
            folder.open(Folder.READ_WRITE);
        } catch (MessagingException e) {
            log.error("Failed to open {}: {}", config.getFolder(), e.getMessage());
            throw e;
        }
        log.info("Listening for new emails...");

        boolean idle = connected instanceof IMAPStore imapStore && imapStore.hasCapability("IDLE");
        if (!idle) {
            log.warn("IDLE not supported, polling every {}s", config.getPollIntervalSeconds());
        }

        watch(folder, idle);
    }

    /**
     * Processes unseen mail and waits for more until stopped or the folder closes.
     * <p>Mail announced while the previous batch was processing is searched for again
     * straight away, as IDLE would not report it a second time.
     *
     * @param folder Open folder.
     * @param idle   Whether to wait with IDLE instead of polling.
     * @throws MessagingException Connection or protocol error.
     */
    void watch(Folder folder, boolean idle) throws MessagingException {
        while (running && folder.isOpen()) {
            if (processUnseen(folder)) {
                log.debug("New mail arrived while processing, searching again");
                continue;
            }

            if (idle && folder instanceof IMAPFolder imapFolder) {
                imapFolder.idle(true);
            } else {
                try {
                    Thread.sleep(TimeUnit.SECONDS.toMillis(config.getPollIntervalSeconds()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    /**
     * Processes every unseen message in the folder.
     *
     * @param folder Open folder.
     * @return True if the folder grew while processing.
     * @throws MessagingException Unable to search the folder.
     */
    boolean processUnseen(Folder folder) throws MessagingException {
        Message[] messages = folder.search(new FlagTerm(new Flags(Flags.Flag.SEEN), false));
        int count = folder.getMessageCount();
        if (messages != null) {
            for (Message message : messages) {
                if (!running) {
                    return false;
                }
                handle(message);
            }
        }
        return running && folder.getMessageCount() > count;
    }

    /**
     * Processes one message and flags it as seen on success.
     *
     * @param message Jakarta Mail message.
     * @return True if the message was flagged as seen.
     */
    boolean handle(Message message) {
        InboundMessage inbound;
        try {
            inbound = parser.parse(message);
        } catch (MessagingException | IOException e) {
            log.error("Unable to parse message {}: {}", message.getMessageNumber(), e.getMessage());
            return false;
        }

        try {
            pipeline.process(inbound);
        } catch (DedupPersistenceException e) {
            ForwardMetrics.incrementPersistenceFailure();
            log.error("Unable to persist processed id {} for: {} - {}", e.getMessageId(), inbound.getSubject(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Processing failed for: {}", inbound.getSubject(), e);
            return false;
        }

        try {
            message.setFlag(Flags.Flag.SEEN, true);
            return true;
        } catch (MessagingException e) {
            log.warn("Failed to mark as seen: {}", inbound.getSubject());
            return false;
        }
    }

    private void closeStore() {
        Store current = store;
        store = null;
        if (current != null && current.isConnected()) {
            try {
                current.close();
            } catch (MessagingException e) {
                log.debug("Error closing IMAP store: {}", e.getMessage());
            }
        }
    }

    /**
     * Marks the listener as running without starting a thread.
     */
    void setRunning(boolean running) {
        this.running = running;
    }
}
