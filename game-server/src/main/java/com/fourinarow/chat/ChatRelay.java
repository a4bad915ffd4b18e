package com.fourinarow.chat;

import com.fourinarow.broadcast.BroadcastGateway;
import com.fourinarow.game.GameSessionManager;
import com.fourinarow.game.GameSnapshot;
import com.fourinarow.game.Player;
import com.fourinarow.presence.ConnectedUser;
import com.fourinarow.presence.PresenceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Sanitizes and relays lobby and game chat.
 *
 * Delivery is always attempted; durability is best effort. The store write
 * is handed to a separate executor and the broadcast goes out right after,
 * without waiting. A failed write is logged and nothing else happens.
 */
public class ChatRelay {

    private static final Logger logger = LoggerFactory.getLogger(ChatRelay.class);

    private final PresenceRegistry presenceRegistry;
    private final GameSessionManager sessionManager;
    private final BroadcastGateway gateway;
    private final ChatStore store;
    private final Executor storeExecutor;
    private final MarkupSanitizer sanitizer;
    private final int lobbyHistoryLimit;

    public ChatRelay(PresenceRegistry presenceRegistry,
                     GameSessionManager sessionManager,
                     BroadcastGateway gateway,
                     ChatStore store,
                     Executor storeExecutor,
                     int lobbyHistoryLimit) {
        this.presenceRegistry = presenceRegistry;
        this.sessionManager = sessionManager;
        this.gateway = gateway;
        this.store = store;
        this.storeExecutor = storeExecutor;
        this.sanitizer = new MarkupSanitizer();
        this.lobbyHistoryLimit = lobbyHistoryLimit;
    }

    public String sanitize(String text) {
        return sanitizer.sanitize(text);
    }

    /**
     * Relays a lobby message from a lobby-joined connection.
     *
     * @return the relayed message; empty if the sender is not in the lobby
     *         or nothing is left after sanitizing
     */
    public Optional<ChatMessage> relayLobbyMessage(String connectionId, String text) {
        Optional<ConnectedUser> sender = presenceRegistry.find(connectionId);
        if (sender.isEmpty()) {
            logger.warn("Lobby message from connection {} that has not joined the lobby", connectionId);
            return Optional.empty();
        }
        String clean = sanitize(text);
        if (clean.isEmpty()) {
            return Optional.empty();
        }

        ChatMessage message = ChatMessage.create(sender.get().getUserId(), sender.get().getUsername(),
                clean, ChatMessage.LOBBY_SCOPE);
        persist(message);
        gateway.publishLobbyMessage(message);
        return Optional.of(message);
    }

    /**
     * Relays a game message from a connection seated in {@code sessionId}.
     *
     * @return the relayed message; empty if the session is gone, the sender
     *         is not seated, or nothing is left after sanitizing
     */
    public Optional<ChatMessage> relayGameMessage(String connectionId, String sessionId, String text) {
        Optional<GameSnapshot> scope = sessionManager.snapshot(sessionId);
        if (scope.isEmpty()) {
            logger.debug("Game message for unknown session {}", sessionId);
            return Optional.empty();
        }
        Optional<Player> sender = scope.get().seatOf(connectionId);
        if (sender.isEmpty()) {
            logger.warn("Connection {} is not seated in game {}, message dropped", connectionId, sessionId);
            return Optional.empty();
        }
        String clean = sanitize(text);
        if (clean.isEmpty()) {
            return Optional.empty();
        }

        ChatMessage message = ChatMessage.create(sender.get().getUserId(), sender.get().getUsername(),
                clean, sessionId);
        persist(message);
        gateway.publishGameMessage(scope.get(), message);
        return Optional.of(message);
    }

    /**
     * Posts a system line to the lobby, e.g. join and leave notices.
     */
    public ChatMessage announce(String text) {
        ChatMessage message = ChatMessage.system(text);
        persist(message);
        gateway.publishLobbyMessage(message);
        return message;
    }

    public CompletableFuture<List<ChatMessage>> sendLobbyHistory(String connectionId) {
        return CompletableFuture
                .supplyAsync(() -> store.recentLobbyMessages(lobbyHistoryLimit), storeExecutor)
                .whenComplete((messages, error) -> {
                    if (error != null) {
                        logger.error("Failed to load lobby history", error);
                        gateway.sendError(connectionId, "Failed to fetch messages");
                    } else {
                        gateway.sendLobbyHistory(connectionId, messages);
                    }
                });
    }

    public CompletableFuture<List<ChatMessage>> sendGameHistory(String connectionId, String sessionId) {
        return CompletableFuture
                .supplyAsync(() -> store.sessionMessages(sessionId), storeExecutor)
                .whenComplete((messages, error) -> {
                    if (error != null) {
                        logger.error("Failed to load history of game {}", sessionId, error);
                        gateway.sendError(connectionId, "Failed to fetch messages");
                    } else {
                        gateway.sendGameHistory(connectionId, sessionId, messages);
                    }
                });
    }

    private void persist(ChatMessage message) {
        try {
            CompletableFuture.runAsync(() -> store.append(message), storeExecutor)
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            logger.error("Failed to store chat message {}", message.getId(), error);
                        }
                    });
        } catch (RejectedExecutionException e) {
            logger.error("Chat store executor rejected message {}", message.getId(), e);
        }
    }
}
