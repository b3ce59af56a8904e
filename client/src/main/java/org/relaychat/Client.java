package org.relaychat;

import org.relaychat.console.ConsoleView;
import org.relaychat.controller.ChatClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

public class Client {
    private static final Logger log = LoggerFactory.getLogger(Client.class);

    private static final String USAGE = "Usage: Client [host] [port] [name]   (default " + ChatProtocol.DEFAULT_HOST
            + " " + ChatProtocol.DEFAULT_PORT + ")";
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    public static void main(String[] args) {
        ClientConfig config;
        try {
            config = ClientConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(1);
            return;
        }

        BufferedReader input = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        ConsoleView view = new ConsoleView(System.out);

        String name;
        try {
            name = config.name().isPresent() ? config.name().get() : promptForName(input, view);
        } catch (IOException e) {
            System.err.println("Could not read a display name: " + e.getMessage());
            System.exit(1);
            return;
        }

        Connection connection;
        try {
            connection = Connection.connect(config.host(), config.port(), CONNECT_TIMEOUT);
        } catch (IOException e) {
            log.error("Cannot reach {}:{}", config.host(), config.port(), e);
            System.err.println("Cannot reach " + config.host() + ":" + config.port() + ": " + e.getMessage());
            System.exit(1);
            return;
        }

        try (ChatClient client = new ChatClient(connection, view)) {
            client.join(name);
            view.notice("Welcome " + name + "! Type " + ChatClient.WHO_COMMAND + " to see who is online, "
                    + ChatClient.EXIT_COMMAND + " to leave.");
            client.run(input);
        } catch (IOException e) {
            log.error("Handshake with {}:{} failed", config.host(), config.port(), e);
            System.exit(1);
            return;
        }
        System.exit(0);
    }

    private static String promptForName(BufferedReader input, ConsoleView view) throws IOException {
        while (true) {
            System.out.print("Enter display name: ");
            System.out.flush();
            String line = input.readLine();
            if (line == null) {
                throw new IOException("input closed");
            }
            try {
                return DisplayNames.validate(line);
            } catch (IllegalArgumentException e) {
                view.notice(e.getMessage());
            }
        }
    }
}
