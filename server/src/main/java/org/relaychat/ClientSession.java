package org.relaychat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Server side of one client connection, from handshake to teardown. Runs on its own session thread, which is the
 * only reader of the connection; outgoing traffic goes through the session's {@link Outbox}.
 */
public class ClientSession implements Peer, Runnable {
    private static final Logger log = LoggerFactory.getLogger(ClientSession.class);

    // Frame header, body length prefix and the "and N more" tail of an online listing
    private static final int LISTING_OVERHEAD_BYTES = 64;

    private final Connection connection;
    private final ClientRegistry registry;
    private final Broadcaster broadcaster;
    private final ClientId.Generator ids;
    private final ServerConfig config;

    private volatile SessionState state = SessionState.CONNECTING;
    private volatile ClientId id;
    private volatile String displayName;
    private volatile Outbox outbox;

    public ClientSession(Connection connection, ClientRegistry registry, Broadcaster broadcaster,
                         ClientId.Generator ids, ServerConfig config) {
        this.connection = connection;
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.ids = ids;
        this.config = config;
    }

    @Override
    public void run() {
        log.info("New connection from {}", connection.remoteAddress());
        try {
            state = SessionState.HANDSHAKING;
            Optional<Message> joined = handshake();
            if (joined.isEmpty()) {
                return;
            }
            state = SessionState.ACTIVE;
            log.info("{} joined as '{}' from {}", id, displayName, connection.remoteAddress());
            broadcaster.broadcast(joined.get(), id);
            receiveLoop();
        } catch (FramingException e) {
            log.warn("Dropping {}: {}", this, e.getMessage());
        } catch (IOException e) {
            if (connection.isOpen()) {
                log.info("Connection to {} lost: {}", this, e.getMessage());
            } else {
                log.debug("Connection to {} was closed locally", this);
            }
        } catch (RuntimeException e) {
            log.error("Unexpected failure in {}", this, e);
        } finally {
            teardown();
        }
    }

    /**
     * @return the join announcement for the other clients, or empty when the client was turned away
     */
    private Optional<Message> handshake() throws IOException {
        connection.setReadTimeout(config.handshakeTimeout());

        Optional<Message> first;
        try {
            first = connection.readMessage();
        } catch (SocketTimeoutException e) {
            reject("no handshake within " + config.handshakeTimeout().toMillis() + " ms");
            return Optional.empty();
        } catch (FramingException e) {
            reject("malformed handshake");
            return Optional.empty();
        }
        if (first.isEmpty()) {
            log.info("{} closed the connection before the handshake", connection.remoteAddress());
            return Optional.empty();
        }

        Message hello = first.get();
        if (hello.kind() != MessageKind.HANDSHAKE) {
            reject("expected a handshake, got " + hello.kind());
            return Optional.empty();
        }

        String name;
        try {
            name = DisplayNames.validate(hello.body());
        } catch (IllegalArgumentException e) {
            reject(e.getMessage());
            return Optional.empty();
        }

        ClientId newId = ids.next();
        displayName = name;
        id = newId;
        Message joined = Message.join(newId, name);
        Outbox newOutbox = new Outbox(connection, config.outboxCapacity(), config.writeTimeout(), newId.toString(), this::close);
        // Queued ahead of anything broadcast once the client is registered
        newOutbox.offer(joined);
        outbox = newOutbox;

        ClientRegistry.Registration registration = registry.register(newId, this);
        switch (registration) {
            case REGISTERED -> {
                newOutbox.start();
                connection.setReadTimeout(Duration.ZERO);
                return Optional.of(joined);
            }
            case FULL -> reject("server is full");
            case DUPLICATE_ID -> reject("internal error");
        }
        // Never registered, so teardown must not deregister anything
        newOutbox.stop();
        id = null;
        return Optional.empty();
    }

    private void receiveLoop() throws IOException {
        while (true) {
            Optional<Message> next = connection.readMessage();
            if (next.isEmpty()) {
                log.info("{} disconnected", this);
                return;
            }
            Message message = next.get();
            switch (message.kind()) {
                case CHAT -> relay(message);
                case WHO -> broadcaster.send(this, onlineListing(registry.displayNames(), config.maxFrameBytes()));
                case HANDSHAKE, JOIN, LEAVE, SYSTEM ->
                        throw new FramingException("Unexpected " + message.kind() + " frame from " + this);
            }
        }
    }

    private void relay(Message message) {
        if (message.body().isBlank()) {
            log.debug("Ignoring empty chat line from {}", this);
            return;
        }
        // Sender and timestamp come from the server, not the frame
        Message attributed = Message.chat(id, displayName, message.body());
        if (!attributed.fitsIn(config.maxFrameBytes())) {
            log.info("Not relaying {} chars from {}: too long once attributed", message.body().length(), this);
            broadcaster.send(this, Message.system("Message too long, not delivered"));
            return;
        }
        log.debug("{} says: {}", this, message.body());
        broadcaster.broadcast(attributed, id);
    }

    /**
     * Lists names in order while they fit in one frame; the remainder is only counted.
     */
    static Message onlineListing(List<String> names, int maxFrameBytes) {
        int budget = maxFrameBytes - LISTING_OVERHEAD_BYTES;
        StringBuilder listing = new StringBuilder("Online: ");
        int used = listing.length();
        int shown = 0;
        for (String name : names) {
            int cost = name.getBytes(StandardCharsets.UTF_8).length + 2;
            if (used + cost > budget) {
                break;
            }
            if (shown > 0) {
                listing.append(", ");
            }
            listing.append(name);
            used += cost;
            shown++;
        }
        if (shown == 0 && !names.isEmpty()) {
            listing.append(names.size()).append(" users");
        } else if (shown < names.size()) {
            listing.append(" and ").append(names.size() - shown).append(" more");
        }
        return Message.system(listing.toString());
    }

    // Best-effort notice to a client that never got registered
    private void reject(String reason) {
        log.info("Rejecting {}: {}", connection.remoteAddress(), reason);
        try {
            connection.writeMessage(Message.system("Connection refused: " + reason));
        } catch (IOException e) {
            log.debug("Could not tell {} why it was rejected", connection.remoteAddress(), e);
        }
    }

    private void teardown() {
        log.debug("{} closing from {}", this, state);
        state = SessionState.CLOSING;
        ClientId registeredId = id;
        if (registeredId != null && registry.deregister(registeredId).isPresent()) {
            broadcaster.broadcast(Message.leave(registeredId, displayName), registeredId);
            log.info("{} ('{}') left", registeredId, displayName);
        }
        close();
        state = SessionState.CLOSED;
    }

    @Override
    public boolean deliver(Message message) {
        Outbox current = outbox;
        return current != null && connection.isOpen() && current.offer(message);
    }

    /**
     * Closes the transport, which ends the receive loop; the session thread then deregisters and announces the leave.
     */
    @Override
    public void close() {
        connection.close();
        Outbox current = outbox;
        if (current != null) {
            current.stop();
        }
    }

    @Override
    public ClientId id() {
        return id;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    @Override
    public String toString() {
        ClientId current = id;
        return current == null ? String.valueOf(connection.remoteAddress()) : current + " ('" + displayName + "')";
    }
}
