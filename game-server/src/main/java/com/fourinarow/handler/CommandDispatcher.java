package com.fourinarow.handler;

import com.fourinarow.broadcast.BroadcastGateway;
import com.fourinarow.challenge.ChallengeCoordinator;
import com.fourinarow.chat.ChatRelay;
import com.fourinarow.game.GameSessionManager;
import com.fourinarow.game.InvalidMoveException;
import com.fourinarow.game.SessionNotFoundException;
import com.fourinarow.presence.ConnectedUser;
import com.fourinarow.presence.PresenceRegistry;
import com.fourinarow.protocol.Message;
import com.fourinarow.protocol.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes validated inbound messages to the owning component.
 *
 * Transport-free: the Netty handler calls in here on the channel's event
 * loop, so the events of one connection arrive in order. Error categories
 * are mapped as follows:
 * - invalid moves are reported to the acting connection only
 * - unknown or already-removed sessions and challenges are ignored
 * - actions on a challenge or session the caller is not part of are
 *   ignored by the component and logged there
 */
public class CommandDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    private final PresenceRegistry presenceRegistry;
    private final ChallengeCoordinator challengeCoordinator;
    private final GameSessionManager sessionManager;
    private final ChatRelay chatRelay;
    private final BroadcastGateway gateway;
    // Connections that sent joinLobby once; kept after eviction until disconnect
    private final Set<String> joinedConnections = ConcurrentHashMap.newKeySet();

    public CommandDispatcher(PresenceRegistry presenceRegistry,
                             ChallengeCoordinator challengeCoordinator,
                             GameSessionManager sessionManager,
                             ChatRelay chatRelay,
                             BroadcastGateway gateway) {
        this.presenceRegistry = presenceRegistry;
        this.challengeCoordinator = challengeCoordinator;
        this.sessionManager = sessionManager;
        this.chatRelay = chatRelay;
        this.gateway = gateway;
    }

    public void onConnected(String connectionId) {
        gateway.sendConnected(connectionId);
    }

    /**
     * Handles one inbound message. The message must already have passed
     * {@link com.fourinarow.protocol.MessageValidator}.
     */
    public void dispatch(String connectionId, Message message) {
        logger.debug("Received {} from {}", message.getType(), connectionId);

        switch (message.getType()) {
            case JOIN_LOBBY -> joinLobby(connectionId, message.text("userId"), message.text("username"));
            case SEND_LOBBY_MESSAGE -> chatRelay.relayLobbyMessage(connectionId, message.text("text"));
            case REQUEST_LOBBY_HISTORY -> chatRelay.sendLobbyHistory(connectionId);
            case SEND_CHALLENGE -> challengeCoordinator.sendChallenge(connectionId, message.text("toConnectionId"));
            case ACCEPT_CHALLENGE -> challengeCoordinator.acceptChallenge(message.text("challengeId"), connectionId);
            case DECLINE_CHALLENGE -> challengeCoordinator.declineChallenge(message.text("challengeId"), connectionId);
            case JOIN_GAME -> joinGame(connectionId, message.text("sessionId"), message.text("userId"));
            case MAKE_MOVE -> makeMove(connectionId, message.text("sessionId"), message.integer("col"));
            case FORFEIT_GAME -> forfeit(connectionId, message.text("sessionId"));
            case SEND_GAME_MESSAGE -> chatRelay.relayGameMessage(connectionId,
                    message.text("sessionId"), message.text("text"));
            case REQUEST_GAME_HISTORY -> chatRelay.sendGameHistory(connectionId, message.text("sessionId"));
            default -> throw new ValidationException("Unsupported message type: " + message.getType().getWireName());
        }
    }

    /**
     * Cleans up after a closed connection: leaves the lobby and resolves any
     * challenge the connection was party to.
     */
    public void onDisconnect(String connectionId) {
        // Leave first so a challenge registered concurrently sees the party as gone
        joinedConnections.remove(connectionId);
        Optional<ConnectedUser> left = presenceRegistry.leave(connectionId);
        challengeCoordinator.cancelChallengesFor(connectionId);
        left.ifPresent(user -> chatRelay.announce(user.getUsername() + " left the lobby"));
    }

    private void joinLobby(String connectionId, String userId, String username) {
        if (!joinedConnections.add(connectionId)) {
            logger.debug("Connection {} already joined the lobby", connectionId);
            return;
        }
        presenceRegistry.join(userId, username, connectionId)
                .ifPresent(stale -> challengeCoordinator.cancelChallengesFor(stale.getConnectionId()));
        chatRelay.announce(username + " joined the lobby");
    }

    private void joinGame(String connectionId, String sessionId, String userId) {
        try {
            sessionManager.rebind(sessionId, userId, connectionId);
        } catch (SessionNotFoundException e) {
            logger.debug("joinGame for missing session {}", sessionId);
        }
    }

    private void makeMove(String connectionId, String sessionId, int col) {
        try {
            sessionManager.applyMove(sessionId, connectionId, col);
        } catch (InvalidMoveException e) {
            logger.debug("Rejected move in {} from {}: {}", sessionId, connectionId, e.getReason());
            gateway.sendInvalidMove(connectionId, e.getMessage());
        } catch (SessionNotFoundException e) {
            logger.debug("Move for missing session {}", sessionId);
        }
    }

    private void forfeit(String connectionId, String sessionId) {
        try {
            sessionManager.forfeit(sessionId, connectionId);
        } catch (SessionNotFoundException e) {
            logger.debug("Forfeit for missing session {}", sessionId);
        }
    }
}
