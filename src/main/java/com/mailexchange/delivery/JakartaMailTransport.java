package com.mailexchange.delivery;

import com.mailexchange.config.SmtpConfig;
import com.mailexchange.pipeline.Attachment;
import jakarta.activation.DataHandler;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Part;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.util.ByteArrayDataSource;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Properties;

/**
 * SMTP mail transport using Jakarta Mail.
 *
 * <p>Builds a MIME message per {@link OutboundEmail} and hands it to the configured relay.
 * <ul>
 *     <li>Text only: a single {@code text/plain} body.</li>
 *     <li>With HTML: {@code multipart/alternative} of text and HTML.</li>
 *     <li>With attachments: {@code multipart/mixed} wrapping the body followed by one part per attachment.</li>
 * </ul>
 * <p>The Jakarta Mail session is thread safe, every send opens its own connection.
 */
public class JakartaMailTransport implements MailTransport {
    private static final Logger log = LogManager.getLogger(JakartaMailTransport.class);

    private static final String CHARSET = StandardCharsets.UTF_8.name();

    private final SmtpConfig config;
    private final Session session;

    /**
     * Constructs a new JakartaMailTransport instance.
     *
     * @param config SMTP configuration.
     */
    public JakartaMailTransport(SmtpConfig config) {
        this.config = config;

        Authenticator authenticator = null;
        if (StringUtils.isNotBlank(config.getUser())) {
            authenticator = new Authenticator() {
                @Override
                protected PasswordAuthentication getPasswordAuthentication() {
                    return new PasswordAuthentication(config.getUser(), config.getPassword());
                }
            };
        }
        this.session = Session.getInstance(buildProperties(), authenticator);
    }

    /**
     * Builds Jakarta Mail session properties for SMTP/SMTPS.
     */
    Properties buildProperties() {
        Properties props = new Properties();
        boolean ssl = config.isSecure();

        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.host", config.getHost());
        props.put("mail.smtp.port", String.valueOf(config.getPort()));
        props.put("mail.smtp.auth", String.valueOf(StringUtils.isNotBlank(config.getUser())));
        props.put("mail.smtp.from", config.getFrom());

        // Implicit TLS when secure, otherwise opportunistic STARTTLS.
        props.put("mail.smtp.ssl.enable", String.valueOf(ssl));
        props.put("mail.smtp.starttls.enable", String.valueOf(!ssl));

        props.put("mail.smtp.connectiontimeout", String.valueOf(config.getConnectionTimeoutMillis()));
        props.put("mail.smtp.timeout", String.valueOf(config.getTimeoutMillis()));
        props.put("mail.smtp.writetimeout", String.valueOf(config.getTimeoutMillis()));

        props.put("mail.debug", String.valueOf(config.isDebug()));

        return props;
    }

    @Override
    public void send(OutboundEmail email) throws TransportException {
        try {
            MimeMessage message = buildMessage(email);
            Transport.send(message);
            log.debug("Relay accepted message for {}", email.getTo());
        } catch (MessagingException e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw new TransportException(error, e);
        }
    }

    /**
     * Builds the MIME message.
     *
     * @param email Outbound email.
     * @return MimeMessage instance.
     * @throws MessagingException Invalid address or content.
     */
    MimeMessage buildMessage(OutboundEmail email) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(email.getEnvelopeFrom()));
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(email.getTo()));
        message.setSubject(email.getSubject(), CHARSET);
        message.setSentDate(new Date());

        boolean hasHtml = email.getHtml() != null;
        boolean hasAttachments = !email.getAttachments().isEmpty();

        if (!hasHtml && !hasAttachments) {
            message.setText(email.getText(), CHARSET);
            message.saveChanges();
            return message;
        }

        MimeBodyPart textPart = new MimeBodyPart();
        textPart.setText(email.getText(), CHARSET);

        MimeMultipart alternative = null;
        if (hasHtml) {
            MimeBodyPart htmlPart = new MimeBodyPart();
            htmlPart.setText(email.getHtml(), CHARSET, "html");

            alternative = new MimeMultipart("alternative");
            alternative.addBodyPart(textPart);
            alternative.addBodyPart(htmlPart);
        }

        if (!hasAttachments) {
            message.setContent(alternative);
            message.saveChanges();
            return message;
        }

        MimeMultipart mixed = new MimeMultipart("mixed");
        if (alternative != null) {
            MimeBodyPart bodyPart = new MimeBodyPart();
            bodyPart.setContent(alternative);
            mixed.addBodyPart(bodyPart);
        } else {
            mixed.addBodyPart(textPart);
        }

        for (Attachment attachment : email.getAttachments()) {
            MimeBodyPart part = new MimeBodyPart();
            part.setDataHandler(new DataHandler(new ByteArrayDataSource(attachment.getContent(), attachment.getContentType())));
            if (attachment.getFilename() != null) {
                part.setFileName(attachment.getFilename());
            }
            part.setDisposition(Part.ATTACHMENT);
            mixed.addBodyPart(part);
        }

        message.setContent(mixed);
        message.saveChanges();
        return message;
    }
}
