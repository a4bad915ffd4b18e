package com.fourinarow.handler;

import com.fourinarow.broadcast.BroadcastGateway;
import com.fourinarow.connection.ClientConnection;
import com.fourinarow.connection.ConnectionManager;
import com.fourinarow.protocol.Message;
import com.fourinarow.protocol.MessageSerializer;
import com.fourinarow.protocol.MessageValidator;
import com.fourinarow.protocol.ValidationException;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-channel WebSocket handler: decodes and validates frames, then hands
 * them to the {@link CommandDispatcher}.
 *
 * Threading Model:
 * - Each channel is served by a single Netty worker thread, so one
 *   connection's events are processed strictly in arrival order
 * - Different channels run in parallel; the components they call into do
 *   their own per-entity locking
 *
 * Idle channels get a ping on writer idle and are closed on reader idle.
 *
 * Never block in this handler. Chat persistence already runs elsewhere.
 */
public class WebSocketFrameHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketFrameHandler.class);

    private final ConnectionManager connectionManager;
    private final CommandDispatcher dispatcher;
    private final BroadcastGateway gateway;
    private final MessageSerializer serializer;
    private final MessageValidator validator;

    public WebSocketFrameHandler(ConnectionManager connectionManager,
                                 CommandDispatcher dispatcher,
                                 BroadcastGateway gateway,
                                 MessageSerializer serializer) {
        this.connectionManager = connectionManager;
        this.dispatcher = dispatcher;
        this.gateway = gateway;
        this.serializer = serializer;
        this.validator = new MessageValidator();
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        ClientConnection connection = connectionManager.register(ctx.channel());
        logger.info("New connection: {}", connection.getConnectionId());
    }

    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) {
        ClientConnection connection = connectionManager.unregister(ctx.channel());
        if (connection != null) {
            dispatcher.onDisconnect(connection.getConnectionId());
            logger.info("Connection {} closed", connection.getConnectionId());
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (!(frame instanceof TextWebSocketFrame)) {
            logger.warn("Unsupported frame type: {}", frame.getClass().getName());
            return;
        }

        ClientConnection connection = connectionManager.getByChannel(ctx.channel());
        if (connection == null) {
            logger.error("Received message from unknown channel");
            return;
        }

        String json = ((TextWebSocketFrame) frame).text();
        String connectionId = connection.getConnectionId();
        try {
            Message message = serializer.deserialize(json);
            validator.validate(message);
            dispatcher.dispatch(connectionId, message);
        } catch (ValidationException e) {
            logger.warn("Rejected message from {}: {}", connectionId, e.getMessage());
            gateway.sendError(connectionId, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Failed to process message from {}: {}", connectionId, json, e);
            gateway.sendError(connectionId, "Internal server error");
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            ClientConnection connection = connectionManager.getByChannel(ctx.channel());
            if (connection != null) {
                dispatcher.onConnected(connection.getConnectionId());
            }
        } else if (evt instanceof IdleStateEvent) {
            IdleStateEvent e = (IdleStateEvent) evt;
            if (e.state() == IdleState.READER_IDLE) {
                logger.warn("Connection idle timeout, closing: {}", ctx.channel().id());
                ctx.close();
            } else if (e.state() == IdleState.WRITER_IDLE) {
                // Browsers answer pings automatically; the pong resets the reader timer
                ctx.writeAndFlush(new PingWebSocketFrame());
            }
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("WebSocket error", cause);
        ctx.close();
    }
}
