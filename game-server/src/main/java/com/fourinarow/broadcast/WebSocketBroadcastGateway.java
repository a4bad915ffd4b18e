package com.fourinarow.broadcast;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fourinarow.challenge.ChallengeEvent;
import com.fourinarow.chat.ChatMessage;
import com.fourinarow.connection.ClientConnection;
import com.fourinarow.connection.ConnectionManager;
import com.fourinarow.game.GameSnapshot;
import com.fourinarow.presence.ConnectedUser;
import com.fourinarow.presence.PresenceRegistry;
import com.fourinarow.protocol.MessageSerializer;
import com.fourinarow.protocol.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

/**
 * Delivers events as WebSocket text frames.
 *
 * Each event is serialized once and the same string is written to every
 * target. Writes go through Netty's channel queue, so this never blocks the
 * caller.
 */
public class WebSocketBroadcastGateway implements BroadcastGateway {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketBroadcastGateway.class);

    private final ConnectionManager connectionManager;
    private final PresenceRegistry presenceRegistry;
    private final MessageSerializer serializer;

    public WebSocketBroadcastGateway(ConnectionManager connectionManager,
                                     PresenceRegistry presenceRegistry,
                                     MessageSerializer serializer) {
        this.connectionManager = connectionManager;
        this.presenceRegistry = presenceRegistry;
        this.serializer = serializer;
    }

    @Override
    public void publishPresence(List<ConnectedUser> onlineUsers) {
        ObjectNode payload = serializer.createObjectNode();
        payload.set("users", serializer.toTree(onlineUsers));
        toLobby(MessageType.ONLINE_USERS, payload);
    }

    @Override
    public void publishLobbyMessage(ChatMessage message) {
        toLobby(MessageType.NEW_LOBBY_MESSAGE, wrap("msg", message));
    }

    @Override
    public void publishGameState(GameSnapshot snapshot) {
        toSession(snapshot, MessageType.GAME_STATE, snapshot);
    }

    @Override
    public void publishGameOver(GameSnapshot snapshot) {
        ObjectNode payload = serializer.createObjectNode();
        payload.set("winner", serializer.toTree(snapshot.getWinner()));
        payload.set("winningCells", serializer.toTree(snapshot.getWinningCells()));
        toSession(snapshot, MessageType.GAME_OVER, payload);
    }

    @Override
    public void publishGameMessage(GameSnapshot scope, ChatMessage message) {
        toSession(scope, MessageType.NEW_GAME_MESSAGE, wrap("msg", message));
    }

    @Override
    public void publishChallengeEvent(String targetConnectionId, ChallengeEvent event) {
        sendTo(targetConnectionId, event.getType(), event);
    }

    @Override
    public void sendOpponentForfeited(String targetConnectionId, String forfeiterUsername) {
        ObjectNode payload = serializer.createObjectNode();
        payload.put("username", forfeiterUsername);
        sendTo(targetConnectionId, MessageType.OPPONENT_FORFEITED, payload);
    }

    @Override
    public void sendInvalidMove(String targetConnectionId, String message) {
        ObjectNode payload = serializer.createObjectNode();
        payload.put("message", message);
        sendTo(targetConnectionId, MessageType.INVALID_MOVE, payload);
    }

    @Override
    public void sendLobbyHistory(String targetConnectionId, List<ChatMessage> messages) {
        sendTo(targetConnectionId, MessageType.LOBBY_HISTORY, wrap("messages", messages));
    }

    @Override
    public void sendGameHistory(String targetConnectionId, String sessionId, List<ChatMessage> messages) {
        ObjectNode payload = wrap("messages", messages);
        payload.put("sessionId", sessionId);
        sendTo(targetConnectionId, MessageType.GAME_HISTORY, payload);
    }

    @Override
    public void sendConnected(String targetConnectionId) {
        ObjectNode payload = serializer.createObjectNode();
        payload.put("connectionId", targetConnectionId);
        sendTo(targetConnectionId, MessageType.CONNECTED, payload);
    }

    @Override
    public void sendError(String targetConnectionId, String message) {
        ObjectNode payload = serializer.createObjectNode();
        payload.put("message", message);
        sendTo(targetConnectionId, MessageType.ERROR, payload);
    }

    // === Delivery ===

    private void toLobby(MessageType type, Object payload) {
        String json = serializer.serialize(type, payload);
        int delivered = 0;
        for (ConnectedUser user : presenceRegistry.list()) {
            if (write(user.getConnectionId(), json)) {
                delivered++;
            }
        }
        logger.debug("Broadcast {} to lobby ({} recipients)", type.getWireName(), delivered);
    }

    private void toSession(GameSnapshot scope, MessageType type, Object payload) {
        String json = serializer.serialize(type, payload);
        deliver(scope.getConnectionIds(), json);
        logger.debug("Broadcast {} to session {}", type.getWireName(), scope.getSessionId());
    }

    private void sendTo(String connectionId, MessageType type, Object payload) {
        if (!write(connectionId, serializer.serialize(type, payload))) {
            logger.debug("Dropped {} for inactive connection {}", type.getWireName(), connectionId);
        }
    }

    private void deliver(Collection<String> connectionIds, String json) {
        for (String connectionId : connectionIds) {
            write(connectionId, json);
        }
    }

    private boolean write(String connectionId, String json) {
        ClientConnection connection = connectionManager.getById(connectionId);
        if (connection == null || !connection.isActive()) {
            return false;
        }
        connection.send(json);
        return true;
    }

    private ObjectNode wrap(String field, Object value) {
        ObjectNode payload = serializer.createObjectNode();
        payload.set(field, serializer.toTree(value));
        return payload;
    }
}
