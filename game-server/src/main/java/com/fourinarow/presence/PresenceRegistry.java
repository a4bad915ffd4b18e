package com.fourinarow.presence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Maps online users to their single active connection.
 *
 * Thread Safety:
 * - The per-user index is mutated only inside {@code compute}, which locks
 *   that user's bin, so two joins for the same user cannot both insert
 * - The connection index is only written from inside those compute blocks
 *   or by {@link #leave(String)}, which removes the user mapping with
 *   {@code remove(key, value)} so a newer connection is never unmapped
 * - Listener notifications are serialized; the last list delivered is
 *   always taken after the last mutation
 */
public class PresenceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(PresenceRegistry.class);

    private final Map<String, ConnectedUser> usersByConnectionId;
    private final Map<String, ConnectedUser> usersByUserId;
    private final List<PresenceListener> listeners;
    private final Object notifyLock = new Object();

    public PresenceRegistry() {
        this.usersByConnectionId = new ConcurrentHashMap<>();
        this.usersByUserId = new ConcurrentHashMap<>();
        this.listeners = new CopyOnWriteArrayList<>();
    }

    public void addListener(PresenceListener listener) {
        listeners.add(listener);
    }

    /**
     * Registers {@code connectionId} as the live connection of {@code userId}.
     * A previous live connection of the same user is evicted first.
     *
     * @return the evicted entry, if there was one
     */
    public Optional<ConnectedUser> join(String userId, String username, String connectionId) {
        ConnectedUser joined = new ConnectedUser(connectionId, userId, username);
        ConnectedUser[] evicted = new ConnectedUser[1];

        usersByUserId.compute(userId, (id, stale) -> {
            if (stale != null && !stale.getConnectionId().equals(connectionId)) {
                usersByConnectionId.remove(stale.getConnectionId(), stale);
                evicted[0] = stale;
            }
            usersByConnectionId.put(connectionId, joined);
            return joined;
        });

        if (evicted[0] != null) {
            logger.info("Evicted stale connection {} for user {}", evicted[0].getConnectionId(), username);
        }
        logger.info("{} joined the lobby ({} online)", username, usersByConnectionId.size());

        notifyListeners();
        return Optional.ofNullable(evicted[0]);
    }

    /**
     * Removes the entry bound to {@code connectionId}. Unknown ids are a no-op.
     *
     * @return the removed entry, if there was one
     */
    public Optional<ConnectedUser> leave(String connectionId) {
        ConnectedUser removed = usersByConnectionId.remove(connectionId);
        if (removed == null) {
            return Optional.empty();
        }
        usersByUserId.remove(removed.getUserId(), removed);

        logger.info("{} left the lobby ({} online)", removed.getUsername(), usersByConnectionId.size());
        notifyListeners();
        return Optional.of(removed);
    }

    /**
     * Snapshot of the online users. Order carries no meaning.
     */
    public List<ConnectedUser> list() {
        return new ArrayList<>(usersByConnectionId.values());
    }

    public Optional<ConnectedUser> find(String connectionId) {
        return Optional.ofNullable(usersByConnectionId.get(connectionId));
    }

    public boolean isOnline(String connectionId) {
        return usersByConnectionId.containsKey(connectionId);
    }

    public int getOnlineCount() {
        return usersByConnectionId.size();
    }

    private void notifyListeners() {
        synchronized (notifyLock) {
            List<ConnectedUser> snapshot = list();
            for (PresenceListener listener : listeners) {
                try {
                    listener.onPresenceChanged(snapshot);
                } catch (RuntimeException e) {
                    logger.error("Presence listener failed", e);
                }
            }
        }
    }
}
