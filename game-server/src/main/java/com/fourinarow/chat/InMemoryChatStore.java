package com.fourinarow.chat;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Heap-backed {@link ChatStore}. Every transcript is capped: the lobby and
 * each session keep only their newest messages, and only the most recently
 * started sessions are retained.
 */
public class InMemoryChatStore implements ChatStore {

    public static final int DEFAULT_SESSION_LIMIT = 1000;
    public static final int DEFAULT_SESSION_CAPACITY = 200;

    private final int lobbyCapacity;
    private final int sessionCapacity;
    private final int sessionLimit;
    private final Deque<ChatMessage> lobby = new ArrayDeque<>();
    // Insertion order, eldest session first
    private final Map<String, Deque<ChatMessage>> sessions = new LinkedHashMap<>();
    private final Set<String> ids = new HashSet<>();

    public InMemoryChatStore(int lobbyCapacity) {
        this(lobbyCapacity, DEFAULT_SESSION_CAPACITY, DEFAULT_SESSION_LIMIT);
    }

    public InMemoryChatStore(int lobbyCapacity, int sessionCapacity, int sessionLimit) {
        if (lobbyCapacity <= 0 || sessionCapacity <= 0 || sessionLimit <= 0) {
            throw new IllegalArgumentException("Capacities must be positive");
        }
        this.lobbyCapacity = lobbyCapacity;
        this.sessionCapacity = sessionCapacity;
        this.sessionLimit = sessionLimit;
    }

    @Override
    public synchronized void append(ChatMessage message) {
        if (!ids.add(message.getId())) {
            return;
        }
        if (message.isLobby()) {
            appendCapped(lobby, message, lobbyCapacity);
            return;
        }

        Deque<ChatMessage> transcript = sessions.get(message.getScope());
        if (transcript == null) {
            transcript = new ArrayDeque<>();
            sessions.put(message.getScope(), transcript);
            evictOldestSessions();
        }
        appendCapped(transcript, message, sessionCapacity);
    }

    @Override
    public synchronized List<ChatMessage> recentLobbyMessages(int limit) {
        List<ChatMessage> recent = new ArrayList<>(Math.min(limit, lobby.size()));
        Iterator<ChatMessage> newestFirst = lobby.descendingIterator();
        while (newestFirst.hasNext() && recent.size() < limit) {
            recent.add(0, newestFirst.next());
        }
        return recent;
    }

    @Override
    public synchronized List<ChatMessage> sessionMessages(String sessionId) {
        Deque<ChatMessage> transcript = sessions.get(sessionId);
        return transcript == null ? new ArrayList<>() : new ArrayList<>(transcript);
    }

    public synchronized int getSessionCount() {
        return sessions.size();
    }

    private void appendCapped(Deque<ChatMessage> transcript, ChatMessage message, int capacity) {
        transcript.addLast(message);
        if (transcript.size() > capacity) {
            ids.remove(transcript.removeFirst().getId());
        }
    }

    private void evictOldestSessions() {
        Iterator<Map.Entry<String, Deque<ChatMessage>>> eldestFirst = sessions.entrySet().iterator();
        while (sessions.size() > sessionLimit && eldestFirst.hasNext()) {
            for (ChatMessage dropped : eldestFirst.next().getValue()) {
                ids.remove(dropped.getId());
            }
            eldestFirst.remove();
        }
    }
}
