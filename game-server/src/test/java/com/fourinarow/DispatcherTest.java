package com.fourinarow;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fourinarow.challenge.ChallengeCoordinator;
import com.fourinarow.challenge.ChallengeEvent;
import com.fourinarow.chat.ChatMessage;
import com.fourinarow.chat.ChatRelay;
import com.fourinarow.chat.InMemoryChatStore;
import com.fourinarow.game.GameSessionManager;
import com.fourinarow.game.GameSnapshot;
import com.fourinarow.game.Winner;
import com.fourinarow.handler.CommandDispatcher;
import com.fourinarow.presence.PresenceRegistry;
import com.fourinarow.protocol.Message;
import com.fourinarow.protocol.MessageSerializer;
import com.fourinarow.protocol.MessageType;
import io.netty.util.HashedWheelTimer;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end flows through the command dispatcher, without a network:
 * - Lobby join, rejoin and disconnect
 * - Challenge to game over
 * - Error routing
 */
@DisplayName("Command Dispatcher Tests")
class DispatcherTest {

    private final MessageSerializer serializer = new MessageSerializer();

    private RecordingGateway gateway;
    private HashedWheelTimer timer;
    private ExecutorService storeExecutor;
    private PresenceRegistry presence;
    private GameSessionManager sessions;
    private ChallengeCoordinator challenges;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        gateway = new RecordingGateway();
        timer = new HashedWheelTimer(10, TimeUnit.MILLISECONDS);
        storeExecutor = Executors.newSingleThreadExecutor();
        presence = new PresenceRegistry();
        presence.addListener(gateway::publishPresence);
        sessions = new GameSessionManager(gateway, timer, Duration.ofSeconds(30));
        challenges = new ChallengeCoordinator(presence, sessions, gateway, timer, Duration.ofSeconds(10));
        ChatRelay relay = new ChatRelay(presence, sessions, gateway, new InMemoryChatStore(100), storeExecutor, 50);
        dispatcher = new CommandDispatcher(presence, challenges, sessions, relay, gateway);
    }

    @AfterEach
    void tearDown() {
        storeExecutor.shutdownNow();
        timer.stop();
    }

    // ==========================================
    // Test: Lobby
    // ==========================================

    @Test
    @DisplayName("Connecting sends the connection id")
    void testConnected() {
        dispatcher.onConnected("c1");
        assertEquals("c1", gateway.last(MessageType.CONNECTED, "c1").payload(String.class));
    }

    @Test
    @DisplayName("Joining the lobby publishes presence and announces the user")
    void testJoinLobby() {
        joinLobby("c-alice", "alice", "Alice");

        List<?> online = gateway.last(MessageType.ONLINE_USERS, RecordingGateway.LOBBY).payload(List.class);
        assertEquals(1, online.size());
        ChatMessage notice = gateway.last(MessageType.NEW_LOBBY_MESSAGE, RecordingGateway.LOBBY).payload(ChatMessage.class);
        assertTrue(notice.isSystem());
        assertEquals("Alice joined the lobby", notice.getText());
    }

    @Test
    @DisplayName("Repeated join on the same connection is ignored")
    void testDuplicateJoinIgnored() {
        joinLobby("c-alice", "alice", "Alice");
        joinLobby("c-alice", "alice", "Alice");

        assertEquals(1, gateway.count(MessageType.ONLINE_USERS, RecordingGateway.LOBBY));
        assertEquals(1, gateway.count(MessageType.NEW_LOBBY_MESSAGE, RecordingGateway.LOBBY));
    }

    @Test
    @DisplayName("Rejoining from another connection evicts the old one and cancels its challenges")
    void testRejoinEvictsStaleConnection() {
        joinLobby("c-alice", "alice", "Alice");
        joinLobby("c-bob", "bob", "Bob");
        dispatch("c-alice", MessageType.SEND_CHALLENGE, payload().put("toConnectionId", "c-bob"));
        assertEquals(1, challenges.getPendingCount());

        joinLobby("c-alice-2", "alice", "Alice");

        assertEquals(0, challenges.getPendingCount());
        assertEquals(1, gateway.count(MessageType.CHALLENGE_TIMEOUT, "c-bob"));
        assertFalse(presence.isOnline("c-alice"));
        assertTrue(presence.isOnline("c-alice-2"));
        assertEquals(2, presence.getOnlineCount());
    }

    @Test
    @DisplayName("Evicted connection cannot join again and take the seat back")
    void testEvictedConnectionRejoinIgnored() {
        joinLobby("c-alice", "alice", "Alice");
        joinLobby("c-alice-2", "alice", "Alice");
        gateway.clear();

        joinLobby("c-alice", "alice", "Alice");

        assertTrue(presence.isOnline("c-alice-2"));
        assertFalse(presence.isOnline("c-alice"));
        assertTrue(gateway.all().isEmpty(), "Unexpected events: " + gateway.all());
    }

    @Test
    @DisplayName("A connection may join again after it disconnected")
    void testJoinAfterDisconnect() {
        joinLobby("c-alice", "alice", "Alice");
        dispatcher.onDisconnect("c-alice");

        joinLobby("c-alice", "alice", "Alice");

        assertTrue(presence.isOnline("c-alice"));
    }

    @Test
    @DisplayName("Disconnect leaves the lobby, cancels challenges and announces it")
    void testDisconnect() {
        joinLobby("c-alice", "alice", "Alice");
        joinLobby("c-bob", "bob", "Bob");
        dispatch("c-alice", MessageType.SEND_CHALLENGE, payload().put("toConnectionId", "c-bob"));

        dispatcher.onDisconnect("c-bob");

        assertFalse(presence.isOnline("c-bob"));
        assertEquals(1, gateway.count(MessageType.CHALLENGE_TIMEOUT, "c-alice"));
        ChatMessage notice = gateway.last(MessageType.NEW_LOBBY_MESSAGE, RecordingGateway.LOBBY).payload(ChatMessage.class);
        assertEquals("Bob left the lobby", notice.getText());

        // Unknown connection: no presence change, no announcement
        int before = gateway.all().size();
        dispatcher.onDisconnect("c-never-joined");
        assertEquals(before, gateway.all().size());
    }

    // ==========================================
    // Test: Game Flow
    // ==========================================

    @Test
    @DisplayName("Challenge, accept and play to a win")
    void testFullFlow() {
        String sessionId = startGame();

        int[] columns = {0, 1, 0, 1, 0, 1, 0};
        for (int i = 0; i < columns.length; i++) {
            move(i % 2 == 0 ? "c-alice" : "c-bob", sessionId, columns[i]);
        }

        GameSnapshot over = gateway.last(MessageType.GAME_OVER, "c-bob").payload(GameSnapshot.class);
        assertEquals(Winner.RED, over.getWinner());
        assertEquals(7, gateway.count(MessageType.GAME_STATE, "c-alice"));
        assertTrue(gateway.find(MessageType.INVALID_MOVE).isEmpty());
    }

    @Test
    @DisplayName("Invalid move is reported only to the mover")
    void testInvalidMove() {
        String sessionId = startGame();

        move("c-bob", sessionId, 3);

        assertEquals("It's not your turn!", gateway.last(MessageType.INVALID_MOVE, "c-bob").payload(String.class));
        assertEquals(0, gateway.count(MessageType.INVALID_MOVE, "c-alice"));
        assertTrue(gateway.find(MessageType.GAME_STATE).isEmpty());
    }

    @Test
    @DisplayName("Actions on unknown sessions are silently ignored")
    void testUnknownSessionIgnored() {
        joinLobby("c-alice", "alice", "Alice");
        gateway.clear();

        move("c-alice", "no-such-game", 3);
        dispatch("c-alice", MessageType.FORFEIT_GAME, payload().put("sessionId", "no-such-game"));
        dispatch("c-alice", MessageType.JOIN_GAME, payload()
                .put("sessionId", "no-such-game").put("userId", "alice").put("username", "Alice"));
        dispatch("c-alice", MessageType.ACCEPT_CHALLENGE, payload().put("challengeId", "no-such-challenge"));

        assertTrue(gateway.all().isEmpty(), "Unexpected events: " + gateway.all());
    }

    @Test
    @DisplayName("Forfeit tells the opponent and ends the session")
    void testForfeit() {
        String sessionId = startGame();

        dispatch("c-bob", MessageType.FORFEIT_GAME, payload().put("sessionId", sessionId));

        assertEquals("Bob", gateway.last(MessageType.OPPONENT_FORFEITED, "c-alice").payload(String.class));
        assertFalse(sessions.hasSession(sessionId));
    }

    @Test
    @DisplayName("Declined challenge creates no session")
    void testDecline() {
        joinLobby("c-alice", "alice", "Alice");
        joinLobby("c-bob", "bob", "Bob");
        dispatch("c-alice", MessageType.SEND_CHALLENGE, payload().put("toConnectionId", "c-bob"));
        String challengeId = gateway.last(MessageType.CHALLENGE_RECEIVED, "c-bob")
                .payload(ChallengeEvent.class).get("challengeId");

        dispatch("c-bob", MessageType.DECLINE_CHALLENGE, payload().put("challengeId", challengeId));

        assertEquals("Bob", gateway.last(MessageType.CHALLENGE_DECLINED, "c-alice")
                .payload(ChallengeEvent.class).get("username"));
        assertEquals(0, sessions.getSessionCount());
    }

    private String startGame() {
        joinLobby("c-alice", "alice", "Alice");
        joinLobby("c-bob", "bob", "Bob");
        dispatch("c-alice", MessageType.SEND_CHALLENGE, payload().put("toConnectionId", "c-bob"));
        String challengeId = gateway.last(MessageType.CHALLENGE_RECEIVED, "c-bob")
                .payload(ChallengeEvent.class).get("challengeId");
        dispatch("c-bob", MessageType.ACCEPT_CHALLENGE, payload().put("challengeId", challengeId));

        String sessionId = gateway.last(MessageType.CHALLENGE_ACCEPTED, "c-alice")
                .payload(ChallengeEvent.class).get("sessionId");
        gateway.clear();
        return sessionId;
    }

    private void joinLobby(String connectionId, String userId, String username) {
        dispatch(connectionId, MessageType.JOIN_LOBBY, payload().put("userId", userId).put("username", username));
    }

    private void move(String connectionId, String sessionId, int col) {
        dispatch(connectionId, MessageType.MAKE_MOVE, payload().put("sessionId", sessionId).put("col", col));
    }

    private void dispatch(String connectionId, MessageType type, ObjectNode payload) {
        dispatcher.dispatch(connectionId, Message.builder().type(type).payload(payload).build());
    }

    private ObjectNode payload() {
        return serializer.createObjectNode();
    }
}
