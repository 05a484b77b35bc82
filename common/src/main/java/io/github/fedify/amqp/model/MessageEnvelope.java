package io.github.fedify.amqp.model;

import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * An encoded message body together with the marker that identifies its encoding.
 */
@Getter
public class MessageEnvelope {

    public static final String APPLICATION_JSON = "application/json";

    private static final int PREVIEW_BYTES = 64;

    private final byte[] body;
    private final String contentType;

    public MessageEnvelope(byte[] body, String contentType) {
        if (body == null) {
            throw new IllegalArgumentException("body must not be null");
        }
        this.body = body;
        this.contentType = contentType;
    }

    public static MessageEnvelope json(byte[] body) {
        return new MessageEnvelope(body, APPLICATION_JSON);
    }

    public int size() {
        return body.length;
    }

    @Override
    public String toString() {
        // Only the preview is decoded; a multi-byte character cut at the boundary shows as U+FFFD
        String text = new String(body, 0, Math.min(body.length, PREVIEW_BYTES), StandardCharsets.UTF_8);
        if (body.length > PREVIEW_BYTES) {
            text = text + "...";
        }
        return "MessageEnvelope[" + contentType + ", " + body.length + " bytes: " + text + "]";
    }
}
