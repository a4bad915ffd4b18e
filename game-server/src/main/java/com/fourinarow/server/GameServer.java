package com.fourinarow.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.HashedWheelTimer;
import io.netty.util.concurrent.DefaultThreadFactory;

import com.fourinarow.broadcast.BroadcastGateway;
import com.fourinarow.broadcast.WebSocketBroadcastGateway;
import com.fourinarow.challenge.ChallengeCoordinator;
import com.fourinarow.chat.ChatRelay;
import com.fourinarow.chat.ChatStore;
import com.fourinarow.chat.InMemoryChatStore;
import com.fourinarow.connection.ConnectionManager;
import com.fourinarow.game.GameSessionManager;
import com.fourinarow.handler.CommandDispatcher;
import com.fourinarow.handler.WebSocketFrameHandler;
import com.fourinarow.presence.PresenceRegistry;
import com.fourinarow.protocol.MessageSerializer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket game server on Netty NIO.
 *
 * Threading Model:
 * - Boss group: 1 thread accepting connections
 * - Worker group: handles I/O and message dispatch, one thread per channel
 * - Timer: one HashedWheelTimer thread for challenge expiry and post-game cleanup
 * - Chat store: one thread for transcript reads and writes
 */
public class GameServer {

    private static final Logger logger = LoggerFactory.getLogger(GameServer.class);

    // Transcript entries kept by the bundled store, a multiple of what history requests return
    private static final int LOBBY_TRANSCRIPT_FACTOR = 5;

    private final ServerConfig config;
    private final MessageSerializer serializer;
    private final ConnectionManager connectionManager;
    private final PresenceRegistry presenceRegistry;
    private final BroadcastGateway gateway;
    private final HashedWheelTimer timer;
    private final ExecutorService chatStoreExecutor;
    private final GameSessionManager sessionManager;
    private final ChallengeCoordinator challengeCoordinator;
    private final ChatRelay chatRelay;
    private final CommandDispatcher dispatcher;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public GameServer(ServerConfig config) {
        this(config, new InMemoryChatStore(config.getLobbyHistoryLimit() * LOBBY_TRANSCRIPT_FACTOR));
    }

    public GameServer(ServerConfig config, ChatStore chatStore) {
        this.config = config;
        this.serializer = new MessageSerializer();
        this.connectionManager = new ConnectionManager();
        this.presenceRegistry = new PresenceRegistry();
        this.gateway = new WebSocketBroadcastGateway(connectionManager, presenceRegistry, serializer);
        this.presenceRegistry.addListener(gateway::publishPresence);

        this.timer = new HashedWheelTimer(new DefaultThreadFactory("game-timer", true),
                10, TimeUnit.MILLISECONDS);
        this.chatStoreExecutor = Executors.newSingleThreadExecutor(new DefaultThreadFactory("chat-store", true));

        this.sessionManager = new GameSessionManager(gateway, timer, config.getGameRetention());
        this.challengeCoordinator = new ChallengeCoordinator(presenceRegistry, sessionManager, gateway,
                timer, config.getChallengeTimeout());
        this.chatRelay = new ChatRelay(presenceRegistry, sessionManager, gateway, chatStore,
                chatStoreExecutor, config.getLobbyHistoryLimit());
        this.dispatcher = new CommandDispatcher(presenceRegistry, challengeCoordinator, sessionManager,
                chatRelay, gateway);
    }

    /**
     * Starts the server and blocks until it is shut down.
     */
    public void start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_BACKLOG, 128)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline pipeline = ch.pipeline();

                            // Reader idle closes the channel; writer idle sends a ping
                            pipeline.addLast(new IdleStateHandler(config.getIdleTimeoutSeconds(),
                                    config.getPingIntervalSeconds(), 0, TimeUnit.SECONDS));
                            pipeline.addLast(new HttpServerCodec());
                            pipeline.addLast(new HttpObjectAggregator(65536));
                            pipeline.addLast(new WebSocketServerCompressionHandler());
                            pipeline.addLast(new WebSocketServerProtocolHandler(
                                    config.getWebsocketPath(),
                                    null,      // subprotocols
                                    true,      // allow extensions
                                    65536,     // max frame size
                                    false,     // allow mask mismatch
                                    true,      // check starting slash
                                    10000L     // handshake timeout ms
                            ));
                            pipeline.addLast(new WebSocketFrameHandler(connectionManager, dispatcher,
                                    gateway, serializer));
                        }
                    });

            serverChannel = bootstrap.bind(config.getPort()).sync().channel();

            logger.info("Server started, WebSocket endpoint: ws://localhost:{}{}",
                    config.getPort(), config.getWebsocketPath());

            serverChannel.closeFuture().sync();
        } finally {
            shutdown();
        }
    }

    /**
     * Stops accepting connections, closes open ones and releases all threads.
     * Safe to call more than once.
     */
    public synchronized void shutdown() {
        if (serverChannel != null) {
            logger.info("Shutting down server...");
            serverChannel.close();
            serverChannel = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        timer.stop();
        chatStoreExecutor.shutdown();
    }

    public ServerConfig getConfig() {
        return config;
    }

    public PresenceRegistry getPresenceRegistry() {
        return presenceRegistry;
    }

    public GameSessionManager getSessionManager() {
        return sessionManager;
    }

    public ChallengeCoordinator getChallengeCoordinator() {
        return challengeCoordinator;
    }

    public ConnectionManager getConnectionManager() {
        return connectionManager;
    }
}
