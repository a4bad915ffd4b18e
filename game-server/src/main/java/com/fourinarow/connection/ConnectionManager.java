package com.fourinarow.connection;

import io.netty.channel.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks every open WebSocket channel, whether or not it joined the lobby.
 *
 * Lookup by channel id serves the Netty handler; lookup by connection id
 * serves the broadcast gateway.
 */
public class ConnectionManager {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    private final Map<String, ClientConnection> connectionsByChannelId;
    private final Map<String, ClientConnection> connectionsById;

    public ConnectionManager() {
        this.connectionsByChannelId = new ConcurrentHashMap<>();
        this.connectionsById = new ConcurrentHashMap<>();
    }

    public ClientConnection register(Channel channel) {
        ClientConnection connection = new ClientConnection(channel);
        String channelId = channel.id().asLongText();

        connectionsByChannelId.put(channelId, connection);
        connectionsById.put(connection.getConnectionId(), connection);

        logger.debug("Connection registered: {} (channel: {}, open: {})",
                connection.getConnectionId(), channelId, connectionsById.size());
        return connection;
    }

    /**
     * @return the removed connection, or null if the channel was never registered
     */
    public ClientConnection unregister(Channel channel) {
        String channelId = channel.id().asLongText();
        ClientConnection connection = connectionsByChannelId.remove(channelId);

        if (connection != null) {
            connectionsById.remove(connection.getConnectionId());
            logger.debug("Connection unregistered: {} (open: {})",
                    connection.getConnectionId(), connectionsById.size());
        }
        return connection;
    }

    public ClientConnection getByChannel(Channel channel) {
        return connectionsByChannelId.get(channel.id().asLongText());
    }

    public ClientConnection getById(String connectionId) {
        return connectionsById.get(connectionId);
    }

    public int getConnectionCount() {
        return connectionsById.size();
    }
}
