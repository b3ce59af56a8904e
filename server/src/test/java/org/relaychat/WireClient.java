package org.relaychat;

import java.io.IOException;
import java.net.InetAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

// Speaks the wire protocol directly, without the console client
class WireClient implements AutoCloseable {
    private final Socket socket;
    private final Connection connection;

    private WireClient(Socket socket) throws IOException {
        this.socket = socket;
        this.connection = new Connection(socket);
        connection.setReadTimeout(Duration.ofSeconds(5));
    }

    static WireClient connect(int port) throws IOException {
        return new WireClient(new Socket(InetAddress.getLoopbackAddress(), port));
    }

    static WireClient connect(Socket unconnected, int port) throws IOException {
        unconnected.connect(new java.net.InetSocketAddress(InetAddress.getLoopbackAddress(), port));
        return new WireClient(unconnected);
    }

    // Connects, handshakes and consumes the client's own join announcement
    static WireClient join(int port, String name) throws IOException {
        WireClient client = connect(port);
        client.send(Message.handshake(name));
        Message joined = client.next(MessageKind.JOIN);
        assertThat(joined.senderName()).isEqualTo(name);
        return client;
    }

    void send(Message message) throws IOException {
        connection.writeMessage(message);
    }

    void say(String body) throws IOException {
        send(Message.chat(body));
    }

    Message next() throws IOException {
        Optional<Message> message = connection.readMessage();
        if (message.isEmpty()) {
            throw new AssertionError("server closed the connection");
        }
        return message.get();
    }

    Message next(MessageKind expected) throws IOException {
        Message message = next();
        assertThat(message.kind()).as("kind of %s", message).isEqualTo(expected);
        return message;
    }

    /**
     * Reads until the server ends the stream and returns what arrived before that.
     */
    List<Message> drainUntilClosed() throws IOException {
        List<Message> seen = new ArrayList<>();
        while (true) {
            Optional<Message> message;
            try {
                message = connection.readMessage();
            } catch (java.net.SocketTimeoutException e) {
                throw new AssertionError("server kept the connection open", e);
            } catch (IOException e) {
                return seen;
            }
            if (message.isEmpty()) {
                return seen;
            }
            seen.add(message.get());
        }
    }

    void setReadTimeout(Duration timeout) throws IOException {
        connection.setReadTimeout(timeout);
    }

    // Resets the TCP connection instead of closing it cleanly
    void abort() throws IOException {
        socket.setSoLinger(true, 0);
        socket.close();
    }

    @Override
    public void close() {
        connection.close();
    }
}
