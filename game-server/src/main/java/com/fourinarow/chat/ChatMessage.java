package com.fourinarow.chat;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A relayed chat line. The id is globally unique; clients use it to drop
 * duplicate deliveries.
 */
@JsonPropertyOrder({"id", "userId", "username", "text", "timestamp", "scope", "system"})
public final class ChatMessage {

    public static final String LOBBY_SCOPE = "lobby";
    public static final String SYSTEM_USER_ID = "system";
    public static final String SYSTEM_USERNAME = "System";

    private final String id;
    private final String userId;
    private final String username;
    private final String text;
    private final String timestamp;
    private final String scope;
    private final boolean system;

    public ChatMessage(String id, String userId, String username, String text,
                       String timestamp, String scope, boolean system) {
        this.id = Objects.requireNonNull(id, "id");
        this.userId = userId;
        this.username = username;
        this.text = text;
        this.timestamp = timestamp;
        this.scope = Objects.requireNonNull(scope, "scope");
        this.system = system;
    }

    /**
     * Stamps a new message with a fresh id and the current time (ISO-8601).
     */
    public static ChatMessage create(String userId, String username, String text, String scope) {
        return new ChatMessage(UUID.randomUUID().toString(), userId, username, text,
                Instant.now().toString(), scope, false);
    }

    public static ChatMessage system(String text) {
        return new ChatMessage(UUID.randomUUID().toString(), SYSTEM_USER_ID, SYSTEM_USERNAME, text,
                Instant.now().toString(), LOBBY_SCOPE, true);
    }

    public String getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public String getUsername() {
        return username;
    }

    public String getText() {
        return text;
    }

    public String getTimestamp() {
        return timestamp;
    }

    /**
     * {@value #LOBBY_SCOPE} or a session id.
     */
    public String getScope() {
        return scope;
    }

    public boolean isSystem() {
        return system;
    }

    public boolean isLobby() {
        return LOBBY_SCOPE.equals(scope);
    }

    @Override
    public String toString() {
        return "ChatMessage{" +
                "id='" + id + '\'' +
                ", username='" + username + '\'' +
                ", scope='" + scope + '\'' +
                '}';
    }
}
