package com.fourinarow.presence;

import java.util.Objects;

/**
 * A lobby-joined user bound to exactly one connection. Immutable: a
 * reconnection produces a new instance.
 */
public final class ConnectedUser {

    private final String connectionId;
    private final String userId;
    private final String username;

    public ConnectedUser(String connectionId, String userId, String username) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.username = Objects.requireNonNull(username, "username");
    }

    public String getConnectionId() {
        return connectionId;
    }

    public String getUserId() {
        return userId;
    }

    public String getUsername() {
        return username;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConnectedUser)) {
            return false;
        }
        ConnectedUser that = (ConnectedUser) o;
        return connectionId.equals(that.connectionId)
                && userId.equals(that.userId)
                && username.equals(that.username);
    }

    @Override
    public int hashCode() {
        return Objects.hash(connectionId, userId, username);
    }

    @Override
    public String toString() {
        return "ConnectedUser{" +
                "connectionId='" + connectionId + '\'' +
                ", userId='" + userId + '\'' +
                ", username='" + username + '\'' +
                '}';
    }
}
