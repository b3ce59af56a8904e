package org.relaychat;

import java.util.Objects;
import java.util.Optional;

/**
 * Where to connect and which name to ask for. A missing name is prompted for at startup.
 */
public record ClientConfig(String host, int port, String displayName) {

    public ClientConfig {
        Objects.requireNonNull(host, "host");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
    }

    /**
     * Accepts {@code []}, {@code [host]}, {@code [host, port]} or {@code [host, port, name]}.
     */
    public static ClientConfig fromArgs(String[] args) {
        if (args.length > 3) {
            throw new IllegalArgumentException("Expected at most a host, a port and a name, got " + args.length + " arguments");
        }
        String host = args.length > 0 ? args[0] : ChatProtocol.DEFAULT_HOST;
        int port = args.length > 1 ? ChatProtocol.parsePort(args[1]) : ChatProtocol.DEFAULT_PORT;
        String name = args.length > 2 ? DisplayNames.validate(args[2]) : null;
        return new ClientConfig(host, port, name);
    }

    public Optional<String> name() {
        return Optional.ofNullable(displayName);
    }
}
