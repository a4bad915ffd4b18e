package com.fourinarow.connection;

import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import java.util.UUID;

/**
 * One live WebSocket connection.
 *
 * The connection id is what every other component refers to: presence
 * entries, challenge parties and game seats all store it instead of the
 * channel itself.
 *
 * Thread Safety:
 * - Id and channel are immutable after creation
 * - {@link #send(String)} may be called from any thread, Netty queues the
 *   write onto the channel's event loop
 */
public class ClientConnection {

    private final String connectionId;
    private final Channel channel;

    public ClientConnection(Channel channel) {
        this.connectionId = UUID.randomUUID().toString();
        this.channel = channel;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public Channel getChannel() {
        return channel;
    }

    /**
     * Sends a text frame. Frames for a closed channel are dropped.
     */
    public void send(String message) {
        if (channel.isActive()) {
            channel.writeAndFlush(new TextWebSocketFrame(message));
        }
    }

    public boolean isActive() {
        return channel != null && channel.isActive();
    }

    @Override
    public String toString() {
        return "ClientConnection{" +
                "connectionId='" + connectionId + '\'' +
                ", active=" + isActive() +
                '}';
    }
}
