package org.relaychat;

/**
 * A registered client as seen by the {@link Broadcaster}.
 */
public interface Peer {

    ClientId id();

    String displayName();

    /**
     * Queues a message for this client.
     *
     * @return false when the client is closed or did not make room within the write timeout
     */
    boolean deliver(Message message);

    // Idempotent; ends the client's session
    void close();
}
