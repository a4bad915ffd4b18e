package com.fourinarow.game;

import com.fourinarow.board.Disc;
import com.fourinarow.broadcast.BroadcastGateway;
import com.fourinarow.challenge.Challenge;
import io.netty.util.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Owns every active game session.
 *
 * Thread Safety Strategy:
 * 1. ConcurrentHashMap for the session registry
 * 2. Each operation locks the one session it targets, so moves and forfeits
 *    on a board never interleave while unrelated sessions run in parallel
 * 3. A session is flagged closed before it leaves the registry; a caller
 *    that fetched it just before removal sees the flag under the lock and
 *    treats the session as missing
 *
 * Broadcasts are issued while the session lock is held so that every
 * participant observes state updates in the order they were applied.
 */
public class GameSessionManager {

    private static final Logger logger = LoggerFactory.getLogger(GameSessionManager.class);

    private final Map<String, GameSession> sessions;
    private final BroadcastGateway gateway;
    private final Timer timer;
    private final Duration retention;

    public GameSessionManager(BroadcastGateway gateway, Timer timer, Duration retention) {
        this.sessions = new ConcurrentHashMap<>();
        this.gateway = gateway;
        this.timer = timer;
        this.retention = retention;
    }

    /**
     * Starts a game for an accepted challenge. The initiator plays red and
     * moves first.
     */
    public GameSnapshot createSession(Challenge challenge) {
        Player red = new Player(challenge.getFromConnectionId(),
                challenge.getFromUserId(), challenge.getFromUsername());
        Player yellow = new Player(challenge.getToConnectionId(),
                challenge.getToUserId(), challenge.getToUsername());

        GameSession session = new GameSession(UUID.randomUUID().toString(), red, yellow);
        sessions.put(session.getId(), session);

        logger.info("Game {} created: {} (red) vs {} (yellow)",
                session.getId(), red.getUsername(), yellow.getUsername());

        synchronized (session) {
            return session.snapshot();
        }
    }

    /**
     * Points the seat of {@code userId} at a new connection and pushes the
     * current state to the session. Users who are not seated are ignored.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    public void rebind(String sessionId, String userId, String connectionId) {
        GameSession session = require(sessionId);
        synchronized (session) {
            ensureOpen(session);
            Optional<Disc> color = session.colorOfUser(userId);
            if (color.isEmpty()) {
                logger.warn("User {} is not part of game {}", userId, sessionId);
                return;
            }
            session.rebind(color.get(), connectionId);
            logger.info("User {} joined game {} as {}", userId, sessionId, color.get().getWireName());
            gateway.publishGameState(session.snapshot());
        }
    }

    /**
     * Drops a disc for the player seated on {@code connectionId}.
     *
     * @throws SessionNotFoundException if the session does not exist
     * @throws InvalidMoveException if the move conflicts with the session state
     */
    public void applyMove(String sessionId, String connectionId, int col) {
        GameSession session = require(sessionId);
        synchronized (session) {
            ensureOpen(session);
            Optional<Disc> color = session.colorOf(connectionId);
            if (color.isEmpty()) {
                logger.warn("Connection {} is not seated in game {}, move ignored", connectionId, sessionId);
                return;
            }

            MoveOutcome outcome = session.play(color.get(), col);
            GameSnapshot snapshot = session.snapshot();
            gateway.publishGameState(snapshot);

            switch (outcome) {
                case WIN -> {
                    logger.info("Game {} won by {}", sessionId, snapshot.getWinner().getWireName());
                    finish(session, snapshot);
                }
                case DRAW -> {
                    logger.info("Game {} ended in a draw", sessionId);
                    finish(session, snapshot);
                }
                default -> logger.debug("Game {}: {} played column {}", sessionId, color.get(), col);
            }
        }
    }

    /**
     * Ends the game in favour of the opponent. Only the opponent is notified
     * and the session is removed immediately.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    public void forfeit(String sessionId, String connectionId) {
        GameSession session = require(sessionId);
        synchronized (session) {
            ensureOpen(session);
            Optional<Disc> color = session.colorOf(connectionId);
            if (color.isEmpty()) {
                logger.warn("Connection {} is not seated in game {}, forfeit ignored", connectionId, sessionId);
                return;
            }

            Player forfeiter = session.player(color.get());
            Player opponent = session.player(color.get().opposite());

            session.close();
            sessions.remove(sessionId, session);

            gateway.sendOpponentForfeited(opponent.getConnectionId(), forfeiter.getUsername());
            logger.info("{} forfeited game {}", forfeiter.getUsername(), sessionId);
        }
    }

    public Optional<GameSnapshot> snapshot(String sessionId) {
        GameSession session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        synchronized (session) {
            return session.isClosed() ? Optional.empty() : Optional.of(session.snapshot());
        }
    }

    public boolean hasSession(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public int getSessionCount() {
        return sessions.size();
    }

    // Caller holds the session monitor
    private void finish(GameSession session, GameSnapshot snapshot) {
        gateway.publishGameOver(snapshot);
        timer.newTimeout(timeout -> discard(session), retention.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void discard(GameSession session) {
        synchronized (session) {
            if (session.isClosed()) {
                return;
            }
            session.close();
        }
        if (sessions.remove(session.getId(), session)) {
            logger.info("Game {} cleaned up", session.getId());
        }
    }

    private GameSession require(String sessionId) {
        GameSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    private static void ensureOpen(GameSession session) {
        if (session.isClosed()) {
            throw new SessionNotFoundException(session.getId());
        }
    }
}
