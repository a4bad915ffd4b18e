package com.fourinarow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fourinarow.server.GameServer;
import com.fourinarow.server.ServerConfig;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.handshake.ServerHandshake;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests against a running server over real WebSocket connections:
 * - Connection handshake
 * - Lobby presence and chat
 * - A full game from challenge to gameOver
 * - Protocol errors
 */
@DisplayName("Networking Tests")
class NetworkingTest {

    private static GameServer server;
    private static final int TEST_PORT = 9191;
    private static final String WS_URL = "ws://localhost:" + TEST_PORT + "/game";
    private static ExecutorService serverExecutor;
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final List<TestClient> clients = new CopyOnWriteArrayList<>();

    @BeforeAll
    static void startServer() throws Exception {
        server = new GameServer(ServerConfig.builder().port(TEST_PORT).build());
        serverExecutor = Executors.newSingleThreadExecutor();
        serverExecutor.submit(() -> {
            try {
                server.start();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        // Wait for server to start
        Thread.sleep(1000);
    }

    @AfterAll
    static void stopServer() {
        if (server != null) {
            server.shutdown();
        }
        if (serverExecutor != null) {
            serverExecutor.shutdownNow();
        }
    }

    @AfterEach
    void closeClients() {
        clients.forEach(WebSocketClient::close);
    }

    // ==========================================
    // Test: Connection
    // ==========================================

    @Test
    @DisplayName("Server sends the connection id after the handshake")
    void testConnected() throws Exception {
        TestClient client = connect();

        assertNotNull(client.getConnectionId());
        assertFalse(client.getConnectionId().isBlank());
        System.out.println("✓ Connected as " + client.getConnectionId());
    }

    // ==========================================
    // Test: Lobby
    // ==========================================

    @Test
    @DisplayName("Joining the lobby broadcasts the online list")
    void testJoinLobby() throws Exception {
        TestClient alice = connect();
        alice.send("joinLobby", payload().put("userId", "net-alice").put("username", "NetAlice"));

        JsonNode online = alice.await("onlineUsers", m -> contains(m, alice.getConnectionId()));
        assertNotNull(online);

        JsonNode notice = alice.await("newLobbyMessage",
                m -> m.get("payload").get("msg").get("text").asText().equals("NetAlice joined the lobby"));
        assertTrue(notice.get("payload").get("msg").get("system").asBoolean());
        System.out.println("✓ Lobby join broadcast received");
    }

    @Test
    @DisplayName("Lobby chat is stripped of markup before relay")
    void testLobbyChat() throws Exception {
        TestClient alice = joined("chat-alice", "ChatAlice");
        TestClient bob = joined("chat-bob", "ChatBob");

        alice.send("sendLobbyMessage", payload().put("text", "<b>hello</b> <script>x()</script>bob"));

        JsonNode message = bob.await("newLobbyMessage",
                m -> m.get("payload").get("msg").get("userId").asText().equals("chat-alice"));
        assertEquals("hello bob", message.get("payload").get("msg").get("text").asText());
        assertEquals("ChatAlice", message.get("payload").get("msg").get("username").asText());
        System.out.println("✓ Sanitized chat relayed");
    }

    // ==========================================
    // Test: Game Over The Wire
    // ==========================================

    @Test
    @DisplayName("Challenge, accept and play a game to a win")
    void testFullGame() throws Exception {
        TestClient alice = joined("game-alice", "GameAlice");
        TestClient bob = joined("game-bob", "GameBob");

        alice.send("sendChallenge", payload().put("toConnectionId", bob.getConnectionId()));
        JsonNode received = bob.await("challengeReceived", m -> true);
        assertEquals(alice.getConnectionId(), received.get("payload").get("from").asText());
        assertEquals("GameAlice", received.get("payload").get("fromUsername").asText());

        bob.send("acceptChallenge", payload().put("challengeId", received.get("payload").get("challengeId").asText()));
        String sessionId = alice.await("challengeAccepted", m -> true).get("payload").get("sessionId").asText();
        assertEquals(sessionId, bob.await("challengeAccepted", m -> true).get("payload").get("sessionId").asText());

        // Bob moving first is rejected
        bob.send("makeMove", payload().put("sessionId", sessionId).put("col", 0));
        assertEquals("It's not your turn!",
                bob.await("invalidMove", m -> true).get("payload").get("message").asText());

        int[] columns = {0, 1, 0, 1, 0, 1, 0};
        for (int i = 0; i < columns.length; i++) {
            TestClient mover = i % 2 == 0 ? alice : bob;
            int expectedStates = i + 1;
            mover.send("makeMove", payload().put("sessionId", sessionId).put("col", columns[i]));
            // Wait for the move to land before the next one is sent
            alice.awaitCount("gameState", expectedStates);
        }

        JsonNode over = bob.await("gameOver", m -> true);
        assertEquals("red", over.get("payload").get("winner").asText());
        JsonNode cells = over.get("payload").get("winningCells");
        assertEquals(4, cells.size());
        assertEquals(2, cells.get(0).get(0).asInt());
        assertEquals(0, cells.get(0).get(1).asInt());

        System.out.println("✓ Full game played over WebSocket, session " + sessionId);
    }

    // ==========================================
    // Test: Protocol Errors
    // ==========================================

    @Test
    @DisplayName("Malformed or incomplete messages get an error reply")
    void testProtocolErrors() throws Exception {
        TestClient client = connect();

        client.sendRaw("{this is not json");
        assertEquals("Invalid message format",
                client.await("error", m -> true).get("payload").get("message").asText());

        client.send("makeMove", payload().put("sessionId", "s"));
        client.awaitCount("error", 2);

        client.send("teleport", payload());
        client.awaitCount("error", 3);

        assertTrue(client.isOpen(), "Connection stays open after protocol errors");
        System.out.println("✓ Protocol errors reported without closing the connection");
    }

    // ==========================================
    // Helpers
    // ==========================================

    private ObjectNode payload() {
        return objectMapper.createObjectNode();
    }

    private static boolean contains(JsonNode onlineUsers, String connectionId) {
        for (JsonNode user : onlineUsers.get("payload").get("users")) {
            if (user.get("connectionId").asText().equals(connectionId)) {
                return true;
            }
        }
        return false;
    }

    private TestClient joined(String userId, String username) throws Exception {
        TestClient client = connect();
        client.send("joinLobby", payload().put("userId", userId).put("username", username));
        client.await("onlineUsers", m -> contains(m, client.getConnectionId()));
        return client;
    }

    private TestClient connect() throws Exception {
        TestClient client = new TestClient(new URI(WS_URL));
        clients.add(client);
        assertTrue(client.connectBlocking(5, TimeUnit.SECONDS), "Should connect within timeout");
        client.await("connected", m -> true);
        return client;
    }

    /**
     * Collects every inbound message and lets tests wait for one.
     */
    private static class TestClient extends WebSocketClient {

        private final List<JsonNode> received = new CopyOnWriteArrayList<>();

        TestClient(URI uri) {
            super(uri);
        }

        @Override
        public void onOpen(ServerHandshake handshake) {}

        @Override
        public void onMessage(String message) {
            try {
                received.add(objectMapper.readTree(message));
            } catch (Exception e) {
                fail("Server sent invalid JSON: " + message);
            }
        }

        @Override
        public void onClose(int code, String reason, boolean remote) {}

        @Override
        public void onError(Exception ex) {
            ex.printStackTrace();
        }

        void send(String type, ObjectNode payload) {
            ObjectNode envelope = objectMapper.createObjectNode();
            envelope.put("type", type);
            envelope.set("payload", payload);
            envelope.put("timestamp", System.currentTimeMillis());
            send(envelope.toString());
        }

        void sendRaw(String text) {
            send(text);
        }

        String getConnectionId() {
            return find("connected", m -> true)
                    .map(m -> m.get("payload").get("connectionId").asText())
                    .orElse(null);
        }

        JsonNode await(String type, Predicate<JsonNode> match) throws InterruptedException {
            long deadline = System.currentTimeMillis() + 5000;
            while (System.currentTimeMillis() < deadline) {
                Optional<JsonNode> found = find(type, match);
                if (found.isPresent()) {
                    return found.get();
                }
                Thread.sleep(10);
            }
            throw new AssertionError("No " + type + " received; got " + received);
        }

        void awaitCount(String type, int count) throws InterruptedException {
            long deadline = System.currentTimeMillis() + 5000;
            while (System.currentTimeMillis() < deadline) {
                if (received.stream().filter(m -> type.equals(m.get("type").asText())).count() >= count) {
                    return;
                }
                Thread.sleep(10);
            }
            throw new AssertionError("Expected " + count + " " + type + " messages; got " + received);
        }

        private Optional<JsonNode> find(String type, Predicate<JsonNode> match) {
            return received.stream()
                    .filter(m -> type.equals(m.get("type").asText()))
                    .filter(match)
                    .findFirst();
        }
    }
}
