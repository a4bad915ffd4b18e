package com.fourinarow.game;

import java.util.Objects;

/**
 * A seated player. Immutable: rebinding a seat to a new connection replaces
 * the instance.
 */
public final class Player {

    private final String connectionId;
    private final String userId;
    private final String username;

    public Player(String connectionId, String userId, String username) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.username = username;
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

    Player withConnection(String newConnectionId) {
        return new Player(newConnectionId, userId, username);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Player)) {
            return false;
        }
        Player player = (Player) o;
        return Objects.equals(connectionId, player.connectionId)
                && Objects.equals(userId, player.userId)
                && Objects.equals(username, player.username);
    }

    @Override
    public int hashCode() {
        return Objects.hash(connectionId, userId, username);
    }

    @Override
    public String toString() {
        return username + "(" + userId + "@" + connectionId + ")";
    }
}
