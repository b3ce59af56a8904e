package org.relaychat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Who is reachable right now. Every read and write goes through one lock, so a snapshot never shows a peer that is
 * halfway removed and never misses one whose registration finished before the snapshot was taken.
 */
public class ClientRegistry {
    private static final Logger log = LoggerFactory.getLogger(ClientRegistry.class);

    public enum Registration {
        REGISTERED,
        DUPLICATE_ID,
        FULL
    }

    private final ReentrantLock lock = new ReentrantLock();
    // Insertion order doubles as broadcast order
    private final Map<ClientId, Peer> peers = new LinkedHashMap<>();
    private final int capacity;

    public ClientRegistry() {
        this(0);
    }

    /**
     * @param capacity maximum number of registered peers, 0 for no limit
     */
    public ClientRegistry(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative: " + capacity);
        }
        this.capacity = capacity;
    }

    public Registration register(ClientId id, Peer peer) {
        lock.lock();
        try {
            if (peers.containsKey(id)) {
                log.error("Refusing to register {} twice; the registry keeps the existing entry", id);
                return Registration.DUPLICATE_ID;
            }
            if (capacity > 0 && peers.size() >= capacity) {
                return Registration.FULL;
            }
            peers.put(id, peer);
            log.debug("Registered {} as '{}' ({} online)", id, peer.displayName(), peers.size());
            return Registration.REGISTERED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the entry for {@code id}. Calling it again for the same id returns empty.
     */
    public Optional<Peer> deregister(ClientId id) {
        lock.lock();
        try {
            Peer removed = peers.remove(id);
            if (removed != null) {
                log.debug("Deregistered {} ({} online)", id, peers.size());
            }
            return Optional.ofNullable(removed);
        } finally {
            lock.unlock();
        }
    }

    // Point-in-time copy in registration order
    public List<Peer> snapshot() {
        lock.lock();
        try {
            return List.copyOf(peers.values());
        } finally {
            lock.unlock();
        }
    }

    public List<String> displayNames() {
        lock.lock();
        try {
            List<String> names = new ArrayList<>(peers.size());
            peers.values().forEach(peer -> names.add(peer.displayName()));
            return names;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return peers.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
