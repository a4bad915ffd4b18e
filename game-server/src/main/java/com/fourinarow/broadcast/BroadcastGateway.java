package com.fourinarow.broadcast;

import com.fourinarow.challenge.ChallengeEvent;
import com.fourinarow.chat.ChatMessage;
import com.fourinarow.game.GameSnapshot;
import com.fourinarow.presence.ConnectedUser;

import java.util.List;

/**
 * Fans events out to a scope.
 *
 * Scopes:
 * - lobby: every connection currently in the presence registry
 * - session: the connections seated in a {@link GameSnapshot}
 * - single target: one connection id
 *
 * Implementations must not block; callers may hold a session monitor.
 */
public interface BroadcastGateway {

    // Lobby scope

    void publishPresence(List<ConnectedUser> onlineUsers);

    void publishLobbyMessage(ChatMessage message);

    // Session scope

    void publishGameState(GameSnapshot snapshot);

    void publishGameOver(GameSnapshot snapshot);

    void publishGameMessage(GameSnapshot scope, ChatMessage message);

    // Single target

    void publishChallengeEvent(String targetConnectionId, ChallengeEvent event);

    void sendOpponentForfeited(String targetConnectionId, String forfeiterUsername);

    void sendInvalidMove(String targetConnectionId, String message);

    void sendLobbyHistory(String targetConnectionId, List<ChatMessage> messages);

    void sendGameHistory(String targetConnectionId, String sessionId, List<ChatMessage> messages);

    void sendConnected(String targetConnectionId);

    void sendError(String targetConnectionId, String message);
}
