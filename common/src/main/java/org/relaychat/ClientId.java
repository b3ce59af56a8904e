package org.relaychat;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Identifier handed to a client once its handshake succeeds. Never reused while the server runs.
 */
public record ClientId(long value) {

    // Attribution for messages the server itself originates
    public static final ClientId SERVER = new ClientId(0);

    public static ClientId of(long value) {
        return new ClientId(value);
    }

    public boolean isServer() {
        return value == SERVER.value;
    }

    @Override
    public String toString() {
        return "client-" + value;
    }

    /**
     * Hands out ids in increasing order, starting at 1.
     */
    public static final class Generator {
        private final AtomicLong counter = new AtomicLong(1);

        public ClientId next() {
            return new ClientId(counter.getAndIncrement());
        }
    }
}
