package com.fourinarow.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The protocol envelope.
 *
 * JSON format:
 * {
 *     "type": "makeMove",
 *     "payload": { "sessionId": "...", "col": 3 },
 *     "timestamp": 1234567890
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    private MessageType type;
    private JsonNode payload;
    private Long timestamp;

    // Default constructor for Jackson deserialization
    public Message() {
    }

    private Message(MessageType type, JsonNode payload, Long timestamp) {
        this.type = type;
        this.payload = payload;
        this.timestamp = timestamp;
    }

    public MessageType getType() {
        return type;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public Long getTimestamp() {
        return timestamp;
    }

    public void setType(MessageType type) {
        this.type = type;
    }

    public void setPayload(JsonNode payload) {
        this.payload = payload;
    }

    public void setTimestamp(Long timestamp) {
        this.timestamp = timestamp;
    }

    /**
     * Text value of a payload field. Only call after validation.
     */
    public String text(String field) {
        return payload.get(field).asText();
    }

    public int integer(String field) {
        return payload.get(field).intValue();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MessageType type;
        private JsonNode payload;
        private Long timestamp;

        public Builder type(MessageType type) {
            this.type = type;
            return this;
        }

        public Builder payload(JsonNode payload) {
            this.payload = payload;
            return this;
        }

        public Builder timestamp(Long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Message build() {
            return new Message(type, payload,
                    timestamp != null ? timestamp : System.currentTimeMillis());
        }
    }

    @Override
    public String toString() {
        return "Message{" +
                "type=" + type +
                ", payload=" + payload +
                '}';
    }
}
