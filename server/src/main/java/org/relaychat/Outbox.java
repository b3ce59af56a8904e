package org.relaychat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

// Bounded FIFO of outgoing messages for one client, drained by its own writer thread.
public class Outbox implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(Outbox.class);

    private final Connection connection;
    private final BlockingQueue<Message> queue;
    private final Duration writeTimeout;
    private final String name;
    private final Runnable onWriteFailure;
    private volatile boolean running = false;
    private volatile boolean stopped = false;
    private Thread thread;

    /**
     * @param onWriteFailure invoked once from the writer thread when a write fails
     */
    public Outbox(Connection connection, int capacity, Duration writeTimeout, String name, Runnable onWriteFailure) {
        this.connection = connection;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.writeTimeout = writeTimeout;
        this.name = name;
        this.onWriteFailure = onWriteFailure;
    }

    public synchronized void start() {
        if (running || stopped) return;
        running = true;
        thread = new Thread(this, "chat-outbox-" + name);
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Waits up to the write timeout for room in the queue. Messages offered before {@link #start()} are kept and
     * written first once the writer runs.
     *
     * @return false when the outbox is stopped or stayed full for the whole timeout
     */
    public boolean offer(Message message) {
        if (stopped) {
            return false;
        }
        try {
            return queue.offer(message, writeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void run() {
        while (running) {
            Message next;
            try {
                next = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                connection.writeMessage(next);
            } catch (FramingException e) {
                // Nothing was written, the stream is still in sync
                log.warn("Not sending {} to {}: {}", next.kind(), name, e.getMessage());
            } catch (IOException e) {
                if (running) {
                    log.info("Write to {} failed: {}", name, e.getMessage());
                    stopped = true;
                    running = false;
                    onWriteFailure.run();
                }
                break;
            }
        }
        queue.clear();
    }

    // Anything still queued is dropped
    public synchronized void stop() {
        stopped = true;
        running = false;
        if (thread != null) {
            thread.interrupt();
        } else {
            queue.clear();
        }
    }

    public boolean isRunning() {
        return running;
    }
}
