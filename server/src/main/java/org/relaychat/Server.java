package org.relaychat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;

public class Server {
    private static final Logger log = LoggerFactory.getLogger(Server.class);

    private static final String USAGE = "Usage: Server [host] [port]   (default " + ChatProtocol.DEFAULT_HOST + " "
            + ChatProtocol.DEFAULT_PORT + ")";

    public static void main(String[] args) throws InterruptedException {
        ServerConfig config;
        try {
            config = ServerConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            System.err.println(USAGE);
            System.exit(1);
            return;
        }

        ChatServer server = new ChatServer(config);
        try {
            server.start();
        } catch (IOException e) {
            log.error("Cannot listen on {}:{}", config.host(), config.port(), e);
            System.exit(1);
            return;
        }

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.close();
            log.info("Server shut down gracefully.");
            latch.countDown();
        }, "chat-shutdown"));

        log.info("Server running. Press CTRL+C to stop.");
        latch.await();
    }
}
