package org.relaychat;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

// Constants shared by server and client
public final class ChatProtocol {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 9999;

    // Upper bound for one encoded frame, length prefix excluded
    public static final int MAX_FRAME_BYTES = 64 * 1024;

    public static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss").withZone(ZoneId.systemDefault());

    private ChatProtocol() {
    }

    public static int parsePort(String value) {
        int port;
        try {
            port = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a port number: " + value, e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        return port;
    }
}
