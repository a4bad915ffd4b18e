package com.fourinarow;

import com.fourinarow.presence.ConnectedUser;
import com.fourinarow.presence.PresenceRegistry;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the presence registry:
 * - One live connection per user
 * - Idempotent leave
 * - Listener notification
 */
@DisplayName("Presence Registry Tests")
class PresenceTest {

    private PresenceRegistry registry;
    private List<List<ConnectedUser>> notifications;

    @BeforeEach
    void setUp() {
        registry = new PresenceRegistry();
        notifications = new ArrayList<>();
        registry.addListener(notifications::add);
    }

    @Test
    @DisplayName("Joined users are listed and findable by connection")
    void testJoin() {
        Optional<ConnectedUser> evicted = registry.join("alice", "Alice", "c1");
        registry.join("bob", "Bob", "c2");

        assertTrue(evicted.isEmpty());
        assertEquals(2, registry.getOnlineCount());
        assertEquals("Alice", registry.find("c1").orElseThrow().getUsername());
        assertTrue(registry.isOnline("c2"));
        assertFalse(registry.isOnline("c3"));
    }

    @Test
    @DisplayName("Rejoining from a new connection evicts the old one")
    void testEviction() {
        registry.join("alice", "Alice", "c1");
        Optional<ConnectedUser> evicted = registry.join("alice", "Alice", "c2");

        assertEquals("c1", evicted.orElseThrow().getConnectionId());
        assertEquals(1, registry.getOnlineCount());
        assertFalse(registry.isOnline("c1"));
        assertEquals("alice", registry.find("c2").orElseThrow().getUserId());
    }

    @Test
    @DisplayName("Late leave of an evicted connection does not remove the new one")
    void testLateLeaveAfterEviction() {
        registry.join("alice", "Alice", "c1");
        registry.join("alice", "Alice", "c2");

        assertTrue(registry.leave("c1").isEmpty());
        assertTrue(registry.isOnline("c2"));
    }

    @Test
    @DisplayName("Leave is idempotent and unknown ids are ignored")
    void testLeaveIdempotent() {
        registry.join("alice", "Alice", "c1");

        assertTrue(registry.leave("c1").isPresent());
        assertTrue(registry.leave("c1").isEmpty());
        assertTrue(registry.leave("never-joined").isEmpty());
        assertEquals(0, registry.getOnlineCount());
    }

    @Test
    @DisplayName("Listeners receive the full list after every change")
    void testListenerNotified() {
        registry.join("alice", "Alice", "c1");
        registry.join("bob", "Bob", "c2");
        registry.leave("c1");
        registry.leave("c1");

        assertEquals(3, notifications.size(), "No-op leave must not notify");
        assertEquals(1, notifications.get(0).size());
        assertEquals(2, notifications.get(1).size());
        assertEquals(List.of(new ConnectedUser("c2", "bob", "Bob")), notifications.get(2));
    }

    @Test
    @DisplayName("A failing listener does not stop the others")
    void testFailingListener() {
        PresenceRegistry isolated = new PresenceRegistry();
        List<Integer> sizes = new ArrayList<>();
        isolated.addListener(users -> {
            throw new IllegalStateException("boom");
        });
        isolated.addListener(users -> sizes.add(users.size()));

        isolated.join("alice", "Alice", "c1");

        assertEquals(List.of(1), sizes);
        assertTrue(isolated.isOnline("c1"));
    }
}
