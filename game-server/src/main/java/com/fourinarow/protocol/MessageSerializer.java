package com.fourinarow.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON codec for protocol envelopes.
 *
 * Thread-safe: the ObjectMapper is configured once and shared.
 */
public class MessageSerializer {

    private static final Logger logger = LoggerFactory.getLogger(MessageSerializer.class);

    private final ObjectMapper objectMapper;

    public MessageSerializer() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String serialize(Message message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize message: {}", message, e);
            throw new IllegalStateException("Serialization failed", e);
        }
    }

    /**
     * @throws ValidationException if the text is not a well-formed envelope
     */
    public Message deserialize(String json) {
        try {
            Message message = objectMapper.readValue(json, Message.class);
            if (message == null) {
                throw new ValidationException("Empty message");
            }
            return message;
        } catch (JsonProcessingException e) {
            logger.warn("Failed to deserialize message: {}", json);
            throw new ValidationException("Invalid message format", e);
        }
    }

    /**
     * Builds and serializes an outbound envelope in one step.
     */
    public String serialize(MessageType type, Object payload) {
        return serialize(Message.builder()
                .type(type)
                .payload(toTree(payload))
                .build());
    }

    public JsonNode toTree(Object value) {
        return value instanceof JsonNode ? (JsonNode) value : objectMapper.valueToTree(value);
    }

    public ObjectNode createObjectNode() {
        return objectMapper.createObjectNode();
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
