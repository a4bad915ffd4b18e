package com.fourinarow.challenge;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fourinarow.protocol.MessageType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single-target notification about a challenge handshake. Serializes as
 * its field map.
 */
public final class ChallengeEvent {

    private final MessageType type;
    private final Map<String, String> fields;

    private ChallengeEvent(MessageType type, Map<String, String> fields) {
        this.type = type;
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static ChallengeEvent received(Challenge challenge) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("from", challenge.getFromConnectionId());
        fields.put("fromUsername", challenge.getFromUsername());
        fields.put("challengeId", challenge.getId());
        return new ChallengeEvent(MessageType.CHALLENGE_RECEIVED, fields);
    }

    public static ChallengeEvent accepted(String sessionId) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("sessionId", sessionId);
        return new ChallengeEvent(MessageType.CHALLENGE_ACCEPTED, fields);
    }

    public static ChallengeEvent declined(String username) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("username", username);
        return new ChallengeEvent(MessageType.CHALLENGE_DECLINED, fields);
    }

    public static ChallengeEvent timeout() {
        return new ChallengeEvent(MessageType.CHALLENGE_TIMEOUT, new LinkedHashMap<>());
    }

    public MessageType getType() {
        return type;
    }

    @JsonValue
    public Map<String, String> getFields() {
        return fields;
    }

    public String get(String field) {
        return fields.get(field);
    }

    @Override
    public String toString() {
        return type.getWireName() + fields;
    }
}
