package com.fourinarow.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

import static com.fourinarow.protocol.FieldSpec.integer;
import static com.fourinarow.protocol.FieldSpec.string;
import static com.fourinarow.protocol.FieldSpec.text;

/**
 * The closed set of message kinds, with the payload fields each inbound kind
 * requires.
 *
 * Client → Server:
 * - joinLobby, sendLobbyMessage, requestLobbyHistory
 * - sendChallenge, acceptChallenge, declineChallenge
 * - joinGame, makeMove, forfeitGame, sendGameMessage, requestGameHistory
 *
 * Server → Client:
 * - connected, onlineUsers, newLobbyMessage, lobbyHistory
 * - challengeReceived, challengeAccepted, challengeDeclined, challengeTimeout
 * - gameState, gameOver, opponentForfeited, invalidMove, newGameMessage, gameHistory
 * - error
 */
public enum MessageType {
    // Client → Server
    JOIN_LOBBY("joinLobby", Direction.INBOUND, text("userId"), text("username")),
    SEND_LOBBY_MESSAGE("sendLobbyMessage", Direction.INBOUND, string("text")),
    REQUEST_LOBBY_HISTORY("requestLobbyHistory", Direction.INBOUND),
    SEND_CHALLENGE("sendChallenge", Direction.INBOUND, text("toConnectionId")),
    ACCEPT_CHALLENGE("acceptChallenge", Direction.INBOUND, text("challengeId")),
    DECLINE_CHALLENGE("declineChallenge", Direction.INBOUND, text("challengeId")),
    JOIN_GAME("joinGame", Direction.INBOUND, text("sessionId"), text("userId"), text("username")),
    MAKE_MOVE("makeMove", Direction.INBOUND, text("sessionId"), integer("col")),
    FORFEIT_GAME("forfeitGame", Direction.INBOUND, text("sessionId")),
    SEND_GAME_MESSAGE("sendGameMessage", Direction.INBOUND, text("sessionId"), string("text")),
    REQUEST_GAME_HISTORY("requestGameHistory", Direction.INBOUND, text("sessionId")),

    // Server → Client
    CONNECTED("connected", Direction.OUTBOUND),
    ONLINE_USERS("onlineUsers", Direction.OUTBOUND),
    NEW_LOBBY_MESSAGE("newLobbyMessage", Direction.OUTBOUND),
    LOBBY_HISTORY("lobbyHistory", Direction.OUTBOUND),
    CHALLENGE_RECEIVED("challengeReceived", Direction.OUTBOUND),
    CHALLENGE_ACCEPTED("challengeAccepted", Direction.OUTBOUND),
    CHALLENGE_DECLINED("challengeDeclined", Direction.OUTBOUND),
    CHALLENGE_TIMEOUT("challengeTimeout", Direction.OUTBOUND),
    GAME_STATE("gameState", Direction.OUTBOUND),
    GAME_OVER("gameOver", Direction.OUTBOUND),
    OPPONENT_FORFEITED("opponentForfeited", Direction.OUTBOUND),
    INVALID_MOVE("invalidMove", Direction.OUTBOUND),
    NEW_GAME_MESSAGE("newGameMessage", Direction.OUTBOUND),
    GAME_HISTORY("gameHistory", Direction.OUTBOUND),
    ERROR("error", Direction.OUTBOUND);

    private final String wireName;
    private final Direction direction;
    private final List<FieldSpec> requiredFields;

    MessageType(String wireName, Direction direction, FieldSpec... requiredFields) {
        this.wireName = wireName;
        this.direction = direction;
        this.requiredFields = List.of(requiredFields);
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public Direction getDirection() {
        return direction;
    }

    public List<FieldSpec> getRequiredFields() {
        return requiredFields;
    }

    /**
     * Resolves a wire name. Unknown names map to null and are rejected by
     * {@link MessageValidator}.
     */
    @JsonCreator
    public static MessageType fromWireName(String wireName) {
        for (MessageType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        return null;
    }
}
