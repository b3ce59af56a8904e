package org.relaychat.controller;

import org.relaychat.Connection;
import org.relaychat.FramingException;
import org.relaychat.Message;
import org.relaychat.console.ConsoleView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;

/**
 * Client half of a chat session: one thread renders what the server sends, another turns typed lines into
 * frames. Whichever finishes first closes the connection, which releases the other.
 */
public class ChatClient implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(ChatClient.class);

    public static final String EXIT_COMMAND = "!exit";
    public static final String QUIT_COMMAND = "/quit";
    public static final String WHO_COMMAND = "/who";

    private final Connection connection;
    private final ConsoleView view;
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean leaving = false;

    public ChatClient(Connection connection, ConsoleView view) {
        this.connection = connection;
        this.view = view;
    }

    public void join(String displayName) throws IOException {
        connection.writeMessage(Message.handshake(displayName));
        log.info("Handshake sent as '{}' to {}", displayName, connection.remoteAddress());
    }

    /**
     * Runs both loops until either ends, then closes the connection.
     *
     * @param input typed lines; read on a daemon thread because a blocked console read cannot be interrupted
     */
    public void run(BufferedReader input) {
        Thread receiver = new Thread(this::receiveLoop, "chat-receiver");
        Thread sender = new Thread(() -> inputLoop(input), "chat-input");
        sender.setDaemon(true);
        receiver.start();
        sender.start();

        try {
            finished.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        close();
        try {
            receiver.join(Duration.ofSeconds(5).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void receiveLoop() {
        try {
            while (true) {
                Optional<Message> next = connection.readMessage();
                if (next.isEmpty()) {
                    view.notice("Server closed the connection");
                    return;
                }
                view.show(next.get());
            }
        } catch (FramingException e) {
            log.warn("Server sent an unreadable frame: {}", e.getMessage());
            view.notice("Connection to server lost: " + e.getMessage());
        } catch (IOException e) {
            if (!leaving) {
                log.debug("Receive loop ended", e);
                view.notice("Connection to server lost: " + e.getMessage());
            }
        } finally {
            finished.countDown();
        }
    }

    void inputLoop(BufferedReader input) {
        try {
            String line;
            while ((line = input.readLine()) != null && !leaving) {
                if (!handleLine(line)) {
                    return;
                }
            }
        } catch (IOException e) {
            if (!leaving) {
                log.warn("Error sending message", e);
                view.notice("Error sending message: " + e.getMessage());
            }
        } finally {
            leaving = true;
            finished.countDown();
        }
    }

    // false once the user asked to leave
    private boolean handleLine(String line) throws IOException {
        String text = line.strip();
        if (text.isEmpty()) {
            return true;
        }
        if (text.equals(EXIT_COMMAND) || text.equals(QUIT_COMMAND)) {
            view.notice("Leaving the chat");
            return false;
        }
        if (text.equals(WHO_COMMAND)) {
            connection.writeMessage(Message.who());
            return true;
        }
        try {
            connection.writeMessage(Message.chat(text));
        } catch (FramingException e) {
            view.notice("Message too long, not sent");
            return true;
        }
        view.showOwn(text);
        return true;
    }

    @Override
    public void close() {
        leaving = true;
        connection.close();
        finished.countDown();
    }
}
