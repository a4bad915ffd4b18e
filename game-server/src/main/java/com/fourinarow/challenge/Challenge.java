package com.fourinarow.challenge;

import com.fourinarow.presence.ConnectedUser;
import io.netty.util.Timeout;

import java.time.Instant;

/**
 * A pending proposal from one online user to another. Lives from creation
 * until exactly one of accept, decline, timeout or a party's disconnect.
 */
public final class Challenge {

    private final String id;
    private final String fromUserId;
    private final String fromConnectionId;
    private final String fromUsername;
    private final String toUserId;
    private final String toConnectionId;
    private final String toUsername;
    private final Instant expiresAt;

    // Armed after the challenge is registered; null until then
    private volatile Timeout expiry;

    public Challenge(String id, ConnectedUser from, ConnectedUser to, Instant expiresAt) {
        this.id = id;
        this.fromUserId = from.getUserId();
        this.fromConnectionId = from.getConnectionId();
        this.fromUsername = from.getUsername();
        this.toUserId = to.getUserId();
        this.toConnectionId = to.getConnectionId();
        this.toUsername = to.getUsername();
        this.expiresAt = expiresAt;
    }

    public String getId() {
        return id;
    }

    public String getFromUserId() {
        return fromUserId;
    }

    public String getFromConnectionId() {
        return fromConnectionId;
    }

    public String getFromUsername() {
        return fromUsername;
    }

    public String getToUserId() {
        return toUserId;
    }

    public String getToConnectionId() {
        return toConnectionId;
    }

    public String getToUsername() {
        return toUsername;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public boolean involves(String connectionId) {
        return fromConnectionId.equals(connectionId) || toConnectionId.equals(connectionId);
    }

    /**
     * The other party's connection id.
     */
    public String counterpartOf(String connectionId) {
        return fromConnectionId.equals(connectionId) ? toConnectionId : fromConnectionId;
    }

    void armExpiry(Timeout timeout) {
        this.expiry = timeout;
    }

    void cancelExpiry() {
        Timeout timeout = expiry;
        if (timeout != null) {
            timeout.cancel();
        }
    }

    @Override
    public String toString() {
        return "Challenge{" +
                "id='" + id + '\'' +
                ", from='" + fromUsername + '\'' +
                ", to='" + toUsername + '\'' +
                ", expiresAt=" + expiresAt +
                '}';
    }
}
