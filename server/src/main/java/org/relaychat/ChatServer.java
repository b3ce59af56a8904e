package org.relaychat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Accepts TCP connections and runs one {@link ClientSession} per connection on a session thread.
 */
public class ChatServer implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(ChatServer.class);

    private static final int BACKLOG = 50;
    private static final long ACCEPT_ERROR_PAUSE_MS = 100;

    private final ServerConfig config;
    private final ClientRegistry registry;
    private final Broadcaster broadcaster;
    private final ClientId.Generator ids = new ClientId.Generator();
    private final ExecutorService sessionExecutor;
    // Every session that has not finished yet, registered or still handshaking
    private final Set<ClientSession> liveSessions = ConcurrentHashMap.newKeySet();

    private volatile ServerSocket serverSocket;
    private volatile boolean running = false;
    private Thread acceptThread;

    public ChatServer(ServerConfig config) {
        this.config = config;
        this.registry = new ClientRegistry(config.maxClients());
        this.broadcaster = new Broadcaster(registry);

        AtomicInteger sessionCounter = new AtomicInteger();
        this.sessionExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "chat-session-" + sessionCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Binds the listening socket and starts accepting in the background.
     *
     * @throws IOException when the address cannot be bound; nothing is left running in that case
     */
    public synchronized void start() throws IOException {
        if (running) {
            throw new IllegalStateException("Server already started");
        }
        ServerSocket socket = new ServerSocket();
        try {
            socket.bind(new InetSocketAddress(config.host(), config.port()), BACKLOG);
        } catch (IOException e) {
            socket.close();
            sessionExecutor.shutdownNow();
            throw e;
        }
        serverSocket = socket;
        running = true;

        acceptThread = new Thread(this::acceptLoop, "chat-accept");
        acceptThread.start();
        log.info("Server listening on {}:{}", config.host(), socket.getLocalPort());
    }

    private void acceptLoop() {
        while (running) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (!running) {
                    break;
                }
                log.error("Error accepting connection", e);
                pauseAfterAcceptError();
                continue;
            }
            dispatch(socket);
        }
        log.debug("Accept loop stopped");
    }

    private void dispatch(Socket socket) {
        ClientSession session;
        try {
            session = new ClientSession(new Connection(socket, config.maxFrameBytes()), registry, broadcaster, ids, config);
        } catch (IOException e) {
            log.warn("Could not set up connection from {}", socket.getRemoteSocketAddress(), e);
            closeQuietly(socket);
            return;
        }

        liveSessions.add(session);
        if (!running) {
            // close() may already have swept liveSessions
            log.info("Server is shutting down, refusing {}", socket.getRemoteSocketAddress());
            liveSessions.remove(session);
            session.close();
            return;
        }
        try {
            sessionExecutor.execute(() -> {
                try {
                    session.run();
                } finally {
                    liveSessions.remove(session);
                }
            });
        } catch (RejectedExecutionException e) {
            log.info("Server is shutting down, refusing {}", socket.getRemoteSocketAddress());
            liveSessions.remove(session);
            session.close();
        }
    }

    private void pauseAfterAcceptError() {
        try {
            Thread.sleep(ACCEPT_ERROR_PAUSE_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket", e);
        }
    }

    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    public ClientRegistry registry() {
        return registry;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Stops accepting, closes every client connection and waits briefly for the session threads to finish.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
        }
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.warn("Error closing server socket", e);
        }

        try {
            // No session can be dispatched once the accept thread is gone
            acceptThread.join(TimeUnit.SECONDS.toMillis(5));
            liveSessions.forEach(ClientSession::close);
            sessionExecutor.shutdown();
            if (!sessionExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Sessions still running after 5 seconds, interrupting them");
                sessionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            liveSessions.forEach(ClientSession::close);
            Thread.currentThread().interrupt();
            sessionExecutor.shutdownNow();
        }
        log.info("Server on port {} stopped", serverSocket.getLocalPort());
    }
}
