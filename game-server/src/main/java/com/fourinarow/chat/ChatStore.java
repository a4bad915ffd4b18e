package com.fourinarow.chat;

import java.util.List;

/**
 * Durable chat transcript storage. Implementations may block; the relay only
 * calls them from its own executor, never from a Netty event loop.
 */
public interface ChatStore {

    /**
     * Appends a message. Appending the same id twice must not create a
     * second entry.
     *
     * @throws ChatStoreException if the write fails
     */
    void append(ChatMessage message);

    /**
     * The most recent lobby messages, oldest first.
     */
    List<ChatMessage> recentLobbyMessages(int limit);

    /**
     * Every message of one session, oldest first.
     */
    List<ChatMessage> sessionMessages(String sessionId);
}
