package org.relaychat.console;

import org.relaychat.ChatProtocol;
import org.relaychat.Message;
import org.relaychat.MessageKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Instant;
import java.util.Optional;

/**
 * Plain-text rendering of chat traffic. Announcements are prefixed with {@code ***} so they stand apart from
 * chat lines.
 */
public class ConsoleView {
    private static final Logger log = LoggerFactory.getLogger(ConsoleView.class);

    private final PrintStream out;

    public ConsoleView(PrintStream out) {
        this.out = out;
    }

    public void show(Message message) {
        format(message).ifPresentOrElse(this::print,
                () -> log.debug("Not rendering {}", message));
    }

    public void showOwn(String text) {
        print("[" + timestamp(Instant.now()) + "] You: " + text);
    }

    public void notice(String text) {
        print("*** " + text);
    }

    public static Optional<String> format(Message message) {
        if (message.kind().isAnnouncement()) {
            return Optional.of("*** " + message.body());
        }
        if (message.kind() == MessageKind.CHAT) {
            return Optional.of("[" + timestamp(message.timestamp()) + "] " + message.senderName() + ": " + message.body());
        }
        // Client-to-server only
        return Optional.empty();
    }

    private static String timestamp(Instant instant) {
        return ChatProtocol.TIMESTAMP_FORMAT.format(instant);
    }

    // Lines from the two client threads must not interleave
    private synchronized void print(String line) {
        out.println(line);
        out.flush();
    }
}
