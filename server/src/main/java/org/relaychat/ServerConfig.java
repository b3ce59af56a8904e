package org.relaychat;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for {@link ChatServer}. Positional arguments choose the endpoint; the tuning values can be overridden
 * with {@code relaychat.*} system properties.
 */
public record ServerConfig(String host,
                           int port,
                           Duration handshakeTimeout,
                           Duration writeTimeout,
                           int outboxCapacity,
                           int maxFrameBytes,
                           int maxClients) {

    public static final Duration DEFAULT_HANDSHAKE_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofSeconds(5);
    public static final int DEFAULT_OUTBOX_CAPACITY = 256;
    public static final int DEFAULT_MAX_CLIENTS = 1000;

    public ServerConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
        Objects.requireNonNull(writeTimeout, "writeTimeout");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        if (handshakeTimeout.isNegative() || handshakeTimeout.isZero()) {
            throw new IllegalArgumentException("Handshake timeout must be positive");
        }
        if (writeTimeout.isNegative() || writeTimeout.isZero()) {
            throw new IllegalArgumentException("Write timeout must be positive");
        }
        if (outboxCapacity < 1) {
            throw new IllegalArgumentException("Outbox capacity must be at least 1");
        }
        if (maxFrameBytes < 1) {
            throw new IllegalArgumentException("Frame limit must be at least 1 byte");
        }
        if (maxClients < 0) {
            throw new IllegalArgumentException("Client limit must not be negative");
        }
    }

    public static ServerConfig defaults() {
        return new ServerConfig(ChatProtocol.DEFAULT_HOST, ChatProtocol.DEFAULT_PORT, DEFAULT_HANDSHAKE_TIMEOUT,
                DEFAULT_WRITE_TIMEOUT, DEFAULT_OUTBOX_CAPACITY, ChatProtocol.MAX_FRAME_BYTES, DEFAULT_MAX_CLIENTS);
    }

    /**
     * Accepts {@code []}, {@code [port]} or {@code [host, port]}.
     */
    public static ServerConfig fromArgs(String[] args) {
        String host = ChatProtocol.DEFAULT_HOST;
        int port = ChatProtocol.DEFAULT_PORT;
        if (args.length == 1) {
            port = ChatProtocol.parsePort(args[0]);
        } else if (args.length == 2) {
            host = args[0];
            port = ChatProtocol.parsePort(args[1]);
        } else if (args.length > 2) {
            throw new IllegalArgumentException("Expected at most a host and a port, got " + args.length + " arguments");
        }

        Duration handshakeTimeout = Duration.ofMillis(
                Long.getLong("relaychat.handshakeTimeoutMs", DEFAULT_HANDSHAKE_TIMEOUT.toMillis()));
        Duration writeTimeout = Duration.ofMillis(
                Long.getLong("relaychat.writeTimeoutMs", DEFAULT_WRITE_TIMEOUT.toMillis()));
        int maxClients = Integer.getInteger("relaychat.maxClients", DEFAULT_MAX_CLIENTS);
        return new ServerConfig(host, port, handshakeTimeout, writeTimeout, DEFAULT_OUTBOX_CAPACITY,
                ChatProtocol.MAX_FRAME_BYTES, maxClients);
    }

    public ServerConfig withPort(int port) {
        return new ServerConfig(host, port, handshakeTimeout, writeTimeout, outboxCapacity, maxFrameBytes, maxClients);
    }

    public ServerConfig withHandshakeTimeout(Duration timeout) {
        return new ServerConfig(host, port, timeout, writeTimeout, outboxCapacity, maxFrameBytes, maxClients);
    }

    public ServerConfig withWriteTimeout(Duration timeout, int capacity) {
        return new ServerConfig(host, port, handshakeTimeout, timeout, capacity, maxFrameBytes, maxClients);
    }

    public ServerConfig withMaxClients(int limit) {
        return new ServerConfig(host, port, handshakeTimeout, writeTimeout, outboxCapacity, maxFrameBytes, limit);
    }
}
