package com.fourinarow.server;

import java.time.Duration;

/**
 * Server settings.
 *
 * Defaults can be overridden with system properties:
 * - fourinarow.port (8080)
 * - fourinarow.path (/game)
 * - fourinarow.challengeTimeoutMs (10000)
 * - fourinarow.gameRetentionMs (30000)
 * - fourinarow.lobbyHistoryLimit (100)
 * - fourinarow.idleTimeoutSeconds (60)
 */
public final class ServerConfig {

    public static final int DEFAULT_PORT = 8080;
    public static final String DEFAULT_PATH = "/game";
    public static final Duration DEFAULT_CHALLENGE_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_GAME_RETENTION = Duration.ofSeconds(30);
    public static final int DEFAULT_LOBBY_HISTORY_LIMIT = 100;
    public static final int DEFAULT_IDLE_TIMEOUT_SECONDS = 60;

    private static final String PREFIX = "fourinarow.";

    private final int port;
    private final String websocketPath;
    private final Duration challengeTimeout;
    private final Duration gameRetention;
    private final int lobbyHistoryLimit;
    private final int idleTimeoutSeconds;

    private ServerConfig(Builder builder) {
        this.port = builder.port;
        this.websocketPath = builder.websocketPath;
        this.challengeTimeout = builder.challengeTimeout;
        this.gameRetention = builder.gameRetention;
        this.lobbyHistoryLimit = builder.lobbyHistoryLimit;
        this.idleTimeoutSeconds = builder.idleTimeoutSeconds;
    }

    public static ServerConfig defaults() {
        return builder().build();
    }

    public static ServerConfig fromSystemProperties() {
        return builder()
                .port(Integer.getInteger(PREFIX + "port", DEFAULT_PORT))
                .websocketPath(System.getProperty(PREFIX + "path", DEFAULT_PATH))
                .challengeTimeout(Duration.ofMillis(
                        Long.getLong(PREFIX + "challengeTimeoutMs", DEFAULT_CHALLENGE_TIMEOUT.toMillis())))
                .gameRetention(Duration.ofMillis(
                        Long.getLong(PREFIX + "gameRetentionMs", DEFAULT_GAME_RETENTION.toMillis())))
                .lobbyHistoryLimit(Integer.getInteger(PREFIX + "lobbyHistoryLimit", DEFAULT_LOBBY_HISTORY_LIMIT))
                .idleTimeoutSeconds(Integer.getInteger(PREFIX + "idleTimeoutSeconds", DEFAULT_IDLE_TIMEOUT_SECONDS))
                .build();
    }

    public int getPort() {
        return port;
    }

    public String getWebsocketPath() {
        return websocketPath;
    }

    public Duration getChallengeTimeout() {
        return challengeTimeout;
    }

    public Duration getGameRetention() {
        return gameRetention;
    }

    public int getLobbyHistoryLimit() {
        return lobbyHistoryLimit;
    }

    public int getIdleTimeoutSeconds() {
        return idleTimeoutSeconds;
    }

    /**
     * Seconds without an outbound frame before the server pings the client.
     * Always shorter than the idle timeout.
     */
    public int getPingIntervalSeconds() {
        return idleTimeoutSeconds / 2;
    }

    public Builder toBuilder() {
        return builder()
                .port(port)
                .websocketPath(websocketPath)
                .challengeTimeout(challengeTimeout)
                .gameRetention(gameRetention)
                .lobbyHistoryLimit(lobbyHistoryLimit)
                .idleTimeoutSeconds(idleTimeoutSeconds);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int port = DEFAULT_PORT;
        private String websocketPath = DEFAULT_PATH;
        private Duration challengeTimeout = DEFAULT_CHALLENGE_TIMEOUT;
        private Duration gameRetention = DEFAULT_GAME_RETENTION;
        private int lobbyHistoryLimit = DEFAULT_LOBBY_HISTORY_LIMIT;
        private int idleTimeoutSeconds = DEFAULT_IDLE_TIMEOUT_SECONDS;

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder websocketPath(String websocketPath) {
            this.websocketPath = websocketPath;
            return this;
        }

        public Builder challengeTimeout(Duration challengeTimeout) {
            this.challengeTimeout = challengeTimeout;
            return this;
        }

        public Builder gameRetention(Duration gameRetention) {
            this.gameRetention = gameRetention;
            return this;
        }

        public Builder lobbyHistoryLimit(int lobbyHistoryLimit) {
            this.lobbyHistoryLimit = lobbyHistoryLimit;
            return this;
        }

        public Builder idleTimeoutSeconds(int idleTimeoutSeconds) {
            this.idleTimeoutSeconds = idleTimeoutSeconds;
            return this;
        }

        public ServerConfig build() {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Invalid port: " + port);
            }
            if (!websocketPath.startsWith("/")) {
                throw new IllegalArgumentException("WebSocket path must start with '/': " + websocketPath);
            }
            if (challengeTimeout.isNegative() || challengeTimeout.isZero()) {
                throw new IllegalArgumentException("Challenge timeout must be positive");
            }
            if (gameRetention.isNegative()) {
                throw new IllegalArgumentException("Game retention must not be negative");
            }
            if (lobbyHistoryLimit <= 0) {
                throw new IllegalArgumentException("Lobby history limit must be positive");
            }
            if (idleTimeoutSeconds < 2) {
                throw new IllegalArgumentException("Idle timeout must be at least 2 seconds");
            }
            return new ServerConfig(this);
        }
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "port=" + port +
                ", websocketPath='" + websocketPath + '\'' +
                ", challengeTimeout=" + challengeTimeout +
                ", gameRetention=" + gameRetention +
                ", lobbyHistoryLimit=" + lobbyHistoryLimit +
                ", idleTimeoutSeconds=" + idleTimeoutSeconds +
                '}';
    }
}
