package com.mailexchange.imap;

import com.mailexchange.pipeline.Attachment;
import com.mailexchange.pipeline.InboundMessage;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.util.ByteArrayDataSource;
import jakarta.activation.DataHandler;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class InboundMessageParserTest {

    private final Session session = Session.getInstance(new Properties());
    private final InboundMessageParser parser = new InboundMessageParser();

    /**
     * Serializes and parses back, the way a message arrives from the store.
     */
    private MimeMessage roundTrip(MimeMessage message, String messageId) throws MessagingException, IOException {
        message.saveChanges();
        if (messageId != null) {
            message.setHeader("Message-ID", messageId);
        } else {
            message.removeHeader("Message-ID");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        message.writeTo(out);
        return new MimeMessage(session, new ByteArrayInputStream(out.toByteArray()));
    }

    @Test
    void plainMessage() throws MessagingException, IOException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress("alice@example.com", "Alice"));
        message.setRecipients(Message.RecipientType.TO, "inbox@test.local");
        message.setSubject("Order photos [PHOTO]");
        message.setText("See attached.", "UTF-8");

        InboundMessage parsed = parser.parse(roundTrip(message, "<abc@example.com>"));

        assertEquals("<abc@example.com>", parsed.getMessageId());
        assertEquals("Order photos [PHOTO]", parsed.getSubject());
        assertEquals("Alice <alice@example.com>", parsed.getFrom());
        assertEquals("alice@example.com", parsed.getFromAddress());
        assertEquals("See attached.", parsed.getText().trim());
        assertNull(parsed.getHtml());
        assertTrue(parsed.getAttachments().isEmpty());
    }

    @Test
    void missingHeadersFallBack() throws MessagingException, IOException {
        MimeMessage message = new MimeMessage(session);
        message.setText("Hello", "UTF-8");

        InboundMessage parsed = parser.parse(roundTrip(message, null));

        assertTrue(parsed.getMessageId().matches("\\d+-\\d+"), parsed.getMessageId());
        assertEquals(InboundMessage.NO_SUBJECT, parsed.getSubject());
        assertEquals("unknown", parsed.getFrom());
        assertEquals("", parsed.getFromAddress());
    }

    @Test
    void synthesizedIdsDiffer() throws MessagingException, IOException {
        MimeMessage message = new MimeMessage(session);
        message.setText("Hello", "UTF-8");
        MimeMessage parsed = roundTrip(message, null);

        assertNotEquals(parser.getMessageId(parsed), parser.getMessageId(parsed));
    }

    @Test
    void multipartWithAttachments() throws MessagingException, IOException {
        MimeBodyPart text = new MimeBodyPart();
        text.setText("Plain body", "UTF-8");
        MimeBodyPart html = new MimeBodyPart();
        html.setText("<p>Html body</p>", "UTF-8", "html");
        MimeMultipart alternative = new MimeMultipart("alternative");
        alternative.addBodyPart(text);
        alternative.addBodyPart(html);
        MimeBodyPart body = new MimeBodyPart();
        body.setContent(alternative);

        MimeBodyPart pdf = new MimeBodyPart();
        pdf.setDataHandler(new DataHandler(new ByteArrayDataSource(new byte[]{1, 2, 3}, "application/pdf")));
        pdf.setFileName("invoice.pdf");
        pdf.setDisposition(Part.ATTACHMENT);

        MimeBodyPart notes = new MimeBodyPart();
        notes.setText("not the body", "UTF-8");
        notes.setFileName("notes.txt");
        notes.setDisposition(Part.ATTACHMENT);

        MimeMultipart mixed = new MimeMultipart("mixed");
        mixed.addBodyPart(body);
        mixed.addBodyPart(pdf);
        mixed.addBodyPart(notes);

        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress("bob@example.com"));
        message.setSubject("Invoice [DOC]");
        message.setContent(mixed);

        InboundMessage parsed = parser.parse(roundTrip(message, "<m@example.com>"));

        assertEquals("Plain body", parsed.getText().trim());
        assertEquals("<p>Html body</p>", parsed.getHtml().trim());
        assertEquals("bob@example.com", parsed.getFrom());
        assertEquals(2, parsed.getAttachments().size());

        Attachment first = parsed.getAttachments().get(0);
        assertEquals("invoice.pdf", first.getFilename());
        assertEquals("application/pdf", first.getContentType());
        assertArrayEquals(new byte[]{1, 2, 3}, first.getContent());

        Attachment second = parsed.getAttachments().get(1);
        assertEquals("notes.txt", second.getFilename());
        assertEquals("not the body", new String(second.getContent(), StandardCharsets.UTF_8));
    }
}
