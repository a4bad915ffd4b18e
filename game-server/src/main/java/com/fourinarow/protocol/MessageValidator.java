package com.fourinarow.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks an inbound message against the required fields of its kind.
 */
public class MessageValidator {

    public void validate(Message message) {
        MessageType type = message.getType();
        if (type == null) {
            throw new ValidationException("Unknown message type");
        }
        if (type.getDirection() != Direction.INBOUND) {
            throw new ValidationException("Message type " + type.getWireName() + " cannot be sent by clients");
        }

        List<FieldSpec> required = type.getRequiredFields();
        if (required.isEmpty()) {
            return;
        }

        JsonNode payload = message.getPayload();
        if (payload == null || !payload.isObject()) {
            throw new ValidationException(type.getWireName() + " requires a payload object");
        }

        List<String> invalid = new ArrayList<>();
        for (FieldSpec field : required) {
            if (!field.accepts(payload.get(field.getName()))) {
                invalid.add(field.toString());
            }
        }
        if (!invalid.isEmpty()) {
            throw new ValidationException(type.getWireName() + " has missing or invalid fields: " + invalid);
        }
    }
}
