package com.fourinarow.challenge;

import com.fourinarow.broadcast.BroadcastGateway;
import com.fourinarow.game.GameSessionManager;
import com.fourinarow.game.GameSnapshot;
import com.fourinarow.presence.ConnectedUser;
import com.fourinarow.presence.PresenceRegistry;
import io.netty.util.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs the challenge handshake.
 *
 * Every resolution path (accept, decline, expiry, disconnect) goes through
 * {@link #take(Challenge)}, an atomic {@code remove(key, value)}. Whichever
 * path removes the entry owns the resolution; every other path finds it gone
 * and does nothing. That is what keeps an expiry firing in the same instant
 * as an accept from resolving the challenge twice.
 *
 * A connection can be party to at most one pending challenge at a time, as
 * sender or target. Claims on both parties are taken with
 * {@code putIfAbsent} before the challenge is registered.
 */
public class ChallengeCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(ChallengeCoordinator.class);

    private final Map<String, Challenge> challenges;
    // connection id -> id of the pending challenge it is party to
    private final Map<String, String> pendingByConnection;

    private final PresenceRegistry presenceRegistry;
    private final GameSessionManager sessionManager;
    private final BroadcastGateway gateway;
    private final Timer timer;
    private final Duration timeout;

    public ChallengeCoordinator(PresenceRegistry presenceRegistry,
                                GameSessionManager sessionManager,
                                BroadcastGateway gateway,
                                Timer timer,
                                Duration timeout) {
        this.challenges = new ConcurrentHashMap<>();
        this.pendingByConnection = new ConcurrentHashMap<>();
        this.presenceRegistry = presenceRegistry;
        this.sessionManager = sessionManager;
        this.gateway = gateway;
        this.timer = timer;
        this.timeout = timeout;
    }

    /**
     * Proposes a game from one online connection to another.
     *
     * @return the pending challenge, or empty if the request was ignored
     */
    public Optional<Challenge> sendChallenge(String fromConnectionId, String toConnectionId) {
        Optional<ConnectedUser> from = presenceRegistry.find(fromConnectionId);
        Optional<ConnectedUser> to = presenceRegistry.find(toConnectionId);

        if (from.isEmpty() || to.isEmpty()) {
            logger.info("Challenge ignored: {} -> {} (party not online)", fromConnectionId, toConnectionId);
            return Optional.empty();
        }
        if (from.get().getUserId().equals(to.get().getUserId())) {
            logger.info("Challenge ignored: {} tried to challenge themselves", from.get().getUsername());
            return Optional.empty();
        }

        Challenge challenge = new Challenge(UUID.randomUUID().toString(), from.get(), to.get(),
                Instant.now().plus(timeout));

        if (!claim(fromConnectionId, challenge.getId())) {
            logger.info("Challenge ignored: {} already has a pending challenge", from.get().getUsername());
            return Optional.empty();
        }
        if (!claim(toConnectionId, challenge.getId())) {
            pendingByConnection.remove(fromConnectionId, challenge.getId());
            logger.info("Challenge ignored: {} already has a pending challenge", to.get().getUsername());
            return Optional.empty();
        }

        challenges.put(challenge.getId(), challenge);
        challenge.armExpiry(timer.newTimeout(t -> expire(challenge.getId()),
                timeout.toMillis(), TimeUnit.MILLISECONDS));

        // A party may have left between the presence lookup and registration
        if (!presenceRegistry.isOnline(fromConnectionId) || !presenceRegistry.isOnline(toConnectionId)) {
            String gone = presenceRegistry.isOnline(fromConnectionId) ? toConnectionId : fromConnectionId;
            cancelChallengesFor(gone);
            return Optional.empty();
        }

        gateway.publishChallengeEvent(toConnectionId, ChallengeEvent.received(challenge));
        logger.info("{} challenged {} ({})", challenge.getFromUsername(), challenge.getToUsername(), challenge.getId());
        return Optional.of(challenge);
    }

    /**
     * Accepts a challenge on behalf of its target and starts the game.
     *
     * @return the new session, or empty if the challenge was unknown,
     *         already resolved, or addressed to someone else
     */
    public Optional<GameSnapshot> acceptChallenge(String challengeId, String requesterConnectionId) {
        Challenge challenge = challenges.get(challengeId);
        if (challenge == null) {
            logger.debug("Accept for unknown or resolved challenge {}", challengeId);
            return Optional.empty();
        }
        if (!challenge.getToConnectionId().equals(requesterConnectionId)) {
            logger.warn("Connection {} tried to accept challenge {} addressed to someone else",
                    requesterConnectionId, challengeId);
            return Optional.empty();
        }
        if (!take(challenge)) {
            logger.debug("Challenge {} was resolved concurrently, accept dropped", challengeId);
            return Optional.empty();
        }

        GameSnapshot session = sessionManager.createSession(challenge);
        ChallengeEvent accepted = ChallengeEvent.accepted(session.getSessionId());
        gateway.publishChallengeEvent(challenge.getToConnectionId(), accepted);
        gateway.publishChallengeEvent(challenge.getFromConnectionId(), accepted);

        logger.info("{} accepted challenge from {}", challenge.getToUsername(), challenge.getFromUsername());
        return Optional.of(session);
    }

    /**
     * Declines a challenge on behalf of its target and tells the originator.
     *
     * @return true if this call resolved the challenge
     */
    public boolean declineChallenge(String challengeId, String requesterConnectionId) {
        Challenge challenge = challenges.get(challengeId);
        if (challenge == null) {
            logger.debug("Decline for unknown or resolved challenge {}", challengeId);
            return false;
        }
        if (!challenge.getToConnectionId().equals(requesterConnectionId)) {
            logger.warn("Connection {} tried to decline challenge {} addressed to someone else",
                    requesterConnectionId, challengeId);
            return false;
        }
        if (!take(challenge)) {
            return false;
        }

        gateway.publishChallengeEvent(challenge.getFromConnectionId(),
                ChallengeEvent.declined(challenge.getToUsername()));
        logger.info("{} declined challenge from {}", challenge.getToUsername(), challenge.getFromUsername());
        return true;
    }

    /**
     * Resolves every pending challenge involving {@code connectionId}, telling
     * the other party it timed out. Called on disconnect and on eviction.
     *
     * @return the number of challenges resolved by this call
     */
    public int cancelChallengesFor(String connectionId) {
        List<Challenge> involved = new ArrayList<>();
        for (Challenge challenge : challenges.values()) {
            if (challenge.involves(connectionId)) {
                involved.add(challenge);
            }
        }

        int cancelled = 0;
        for (Challenge challenge : involved) {
            if (take(challenge)) {
                gateway.publishChallengeEvent(challenge.counterpartOf(connectionId), ChallengeEvent.timeout());
                logger.info("Challenge {} cancelled, connection {} left", challenge.getId(), connectionId);
                cancelled++;
            }
        }
        return cancelled;
    }

    public Optional<Challenge> find(String challengeId) {
        return Optional.ofNullable(challenges.get(challengeId));
    }

    public int getPendingCount() {
        return challenges.size();
    }

    private void expire(String challengeId) {
        Challenge challenge = challenges.get(challengeId);
        if (challenge == null || !take(challenge)) {
            return;
        }
        ChallengeEvent timedOut = ChallengeEvent.timeout();
        gateway.publishChallengeEvent(challenge.getFromConnectionId(), timedOut);
        gateway.publishChallengeEvent(challenge.getToConnectionId(), timedOut);
        logger.info("Challenge {} timed out", challengeId);
    }

    private boolean claim(String connectionId, String challengeId) {
        return pendingByConnection.putIfAbsent(connectionId, challengeId) == null;
    }

    /**
     * Atomically removes a pending challenge. Only the caller that gets true
     * may act on the resolution.
     */
    private boolean take(Challenge challenge) {
        if (!challenges.remove(challenge.getId(), challenge)) {
            return false;
        }
        challenge.cancelExpiry();
        pendingByConnection.remove(challenge.getFromConnectionId(), challenge.getId());
        pendingByConnection.remove(challenge.getToConnectionId(), challenge.getId());
        return true;
    }
}
