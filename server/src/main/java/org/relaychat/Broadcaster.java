package org.relaychat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Fans a message out to a registry snapshot. A recipient that cannot take the message is closed and skipped;
 * the others still get it.
 */
public class Broadcaster {
    private static final Logger log = LoggerFactory.getLogger(Broadcaster.class);

    private final ClientRegistry registry;

    public Broadcaster(ClientRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param exclude peer that should not receive the message, or null to reach everyone
     */
    public DeliveryReport broadcast(Message message, ClientId exclude) {
        List<Peer> recipients = registry.snapshot();
        List<ClientId> delivered = new ArrayList<>(recipients.size());
        List<ClientId> failed = new ArrayList<>();

        for (Peer peer : recipients) {
            if (peer.id().equals(exclude)) {
                continue;
            }
            if (send(peer, message)) {
                delivered.add(peer.id());
            } else {
                failed.add(peer.id());
            }
        }

        log.info("Broadcast {} to {} users", message, delivered.size());
        if (!failed.isEmpty()) {
            log.warn("Broadcast of {} failed for {}", message.kind(), failed);
        }
        return new DeliveryReport(delivered, failed);
    }

    /**
     * Delivers to one peer. On failure the peer is closed, which lets its own session deregister it.
     */
    public boolean send(Peer peer, Message message) {
        boolean accepted;
        try {
            accepted = peer.deliver(message);
        } catch (RuntimeException e) {
            log.warn("Delivery to {} threw; dropping the client", peer.id(), e);
            accepted = false;
        }
        if (!accepted) {
            log.info("{} ('{}') is unreachable, closing it", peer.id(), peer.displayName());
            peer.close();
        }
        return accepted;
    }
}
