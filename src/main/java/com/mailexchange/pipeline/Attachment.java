package com.mailexchange.pipeline;

import java.util.Objects;

/**
 * Inbound message attachment.
 * <p>Passed through to forwarded mail unchanged.
 */
public final class Attachment {
    private final String filename;
    private final byte[] content;
    private final String contentType;

    /**
     * Constructs a new Attachment instance.
     *
     * @param filename    File name, may be null.
     * @param content     Raw bytes.
     * @param contentType MIME content type, defaults to application/octet-stream.
     */
    public Attachment(String filename, byte[] content, String contentType) {
        this.filename = filename;
        this.content = Objects.requireNonNull(content, "content").clone();
        this.contentType = contentType != null ? contentType : "application/octet-stream";
    }

    public String getFilename() {
        return filename;
    }

    public byte[] getContent() {
        return content.clone();
    }

    public String getContentType() {
        return contentType;
    }

    public int getSize() {
        return content.length;
    }
}
