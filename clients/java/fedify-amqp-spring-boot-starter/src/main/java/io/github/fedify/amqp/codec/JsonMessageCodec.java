package io.github.fedify.amqp.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.fedify.amqp.exception.EncodingException;
import io.github.fedify.amqp.model.MessageEnvelope;

import java.io.IOException;

/**
 * Encodes payloads as UTF-8 JSON. Decoded payloads are plain Java values:
 * {@code String}, {@code Number}, {@code Boolean}, {@code List}, {@code Map} or {@code null}.
 */
public class JsonMessageCodec {

    private final ObjectMapper objectMapper;

    public JsonMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public MessageEnvelope encode(Object payload) {
        try {
            // Jackson writes JSON as UTF-8 bytes
            return MessageEnvelope.json(objectMapper.writeValueAsBytes(payload));
        } catch (JsonProcessingException e) {
            throw new EncodingException("Failed to encode payload of type "
                    + (payload == null ? "null" : payload.getClass().getName()), e);
        }
    }

    public Object decode(byte[] body) {
        try {
            return objectMapper.readValue(body, Object.class);
        } catch (IOException e) {
            throw new EncodingException("Failed to decode a " + body.length + "-byte message body", e);
        }
    }

    /**
     * Converts a decoded payload to a concrete type, e.g. a listener method's parameter type.
     */
    public <T> T convert(Object payload, Class<T> type) {
        try {
            return objectMapper.convertValue(payload, type);
        } catch (IllegalArgumentException e) {
            throw new EncodingException("Failed to convert payload to " + type.getName(), e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
