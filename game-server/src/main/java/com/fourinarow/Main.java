package com.fourinarow;

import com.fourinarow.server.GameServer;
import com.fourinarow.server.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the Four-in-a-Row game server.
 *
 * Usage: {@code java -jar game-server.jar [port]}. Other settings are read
 * from {@code -Dfourinarow.*} system properties, see {@link ServerConfig}.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        ServerConfig config = ServerConfig.fromSystemProperties();

        if (args.length > 0) {
            try {
                config = config.toBuilder().port(Integer.parseInt(args[0])).build();
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid port argument '{}', using port {}", args[0], config.getPort());
            }
        }

        logger.info("===========================================");
        logger.info("  Four-in-a-Row Game Server");
        logger.info("  Starting on port {}", config.getPort());
        logger.info("===========================================");
        logger.debug("Configuration: {}", config);

        GameServer server = new GameServer(config);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping server...");
            server.shutdown();
        }));

        try {
            server.start();
        } catch (Exception e) {
            logger.error("Failed to start server", e);
            System.exit(1);
        }
    }
}
