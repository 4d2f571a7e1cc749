package com.mailexchange.imap;

import com.mailexchange.pipeline.Attachment;
import com.mailexchange.pipeline.InboundMessage;
import jakarta.mail.Address;
import jakarta.mail.BodyPart;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.ParseException;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.StringJoiner;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Converts a Jakarta Mail message into an {@link InboundMessage}.
 *
 * <p>The first plain text part becomes the text body and the first HTML part the HTML body.
 * Every part with an attachment disposition or a filename becomes an attachment.
 * <p>Messages without a Message-ID header get a synthesized id of the form
 * {@code <epochMillis>-<random>}, so their dedup is only probabilistic.
 */
public class InboundMessageParser {

    /**
     * Parses a message.
     *
     * @param message Jakarta Mail message.
     * @return InboundMessage instance.
     * @throws MessagingException Unable to read headers or structure.
     * @throws IOException        Unable to read content.
     */
    public InboundMessage parse(Message message) throws MessagingException, IOException {
        InboundMessage.Builder builder = new InboundMessage.Builder()
                .setMessageId(getMessageId(message))
                .setSubject(StringUtils.isEmpty(message.getSubject()) ? null : message.getSubject());

        Address[] from = message.getFrom();
        if (from != null && from.length > 0) {
            StringJoiner text = new StringJoiner(", ");
            for (Address address : from) {
                text.add(address instanceof InternetAddress ia ? ia.toUnicodeString() : address.toString());
            }
            builder.setFrom(text.toString());
            if (from[0] instanceof InternetAddress first) {
                builder.setFromAddress(first.getAddress());
            }
        }

        walk(message, builder, new Bodies());
        return builder.build();
    }

    /**
     * Gets the Message-ID header or synthesizes one.
     *
     * @param message Jakarta Mail message.
     * @return Message id.
     * @throws MessagingException Unable to read headers.
     */
    String getMessageId(Message message) throws MessagingException {
        String[] headers = message.getHeader("Message-ID");
        if (headers != null && headers.length > 0 && StringUtils.isNotBlank(headers[0])) {
            return headers[0].trim();
        }
        return System.currentTimeMillis() + "-" + ThreadLocalRandom.current().nextLong(Long.MAX_VALUE);
    }

    private void walk(Part part, InboundMessage.Builder builder, Bodies bodies) throws MessagingException, IOException {
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart child = multipart.getBodyPart(i);
                walk(child, builder, bodies);
            }
            return;
        }

        boolean attachment = Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition()) || part.getFileName() != null;
        if (!attachment && part.isMimeType("text/plain") && !bodies.text) {
            builder.setText(String.valueOf(part.getContent()));
            bodies.text = true;
        } else if (!attachment && part.isMimeType("text/html") && !bodies.html) {
            builder.setHtml(String.valueOf(part.getContent()));
            bodies.html = true;
        } else if (attachment) {
            byte[] content;
            try (InputStream stream = part.getInputStream()) {
                content = stream.readAllBytes();
            }
            builder.addAttachment(new Attachment(part.getFileName(), content, baseType(part.getContentType())));
        }
    }

    /**
     * Strips parameters from a content type.
     *
     * @param contentType Raw content type header.
     * @return Base type or null.
     */
    private static String baseType(String contentType) {
        if (contentType == null) {
            return null;
        }
        try {
            return new ContentType(contentType).getBaseType();
        } catch (ParseException e) {
            return contentType;
        }
    }

    /**
     * Body discovery state.
     */
    private static class Bodies {
        boolean text;
        boolean html;
    }
}
