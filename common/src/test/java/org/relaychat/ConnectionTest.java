package org.relaychat;

import com.google.protobuf.CodedOutputStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.relaychat.proto.ChatProto;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionTest {

    private ServerSocket listener;
    private Socket rawPeer;
    private Connection connection;

    @BeforeEach
    void setUp() throws Exception {
        listener = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        CompletableFuture<Socket> accepted = CompletableFuture.supplyAsync(() -> {
            try {
                return listener.accept();
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        });
        rawPeer = new Socket(InetAddress.getLoopbackAddress(), listener.getLocalPort());
        connection = new Connection(accepted.get(5, TimeUnit.SECONDS), 1024);
    }

    @AfterEach
    void tearDown() throws Exception {
        connection.close();
        rawPeer.close();
        listener.close();
    }

    @Test
    void readsFramesInOrderAndReportsEndOfStream() throws Exception {
        Connection peer = new Connection(rawPeer);
        peer.writeMessage(Message.handshake("alice"));
        peer.writeMessage(Message.chat("hi"));
        rawPeer.shutdownOutput();

        Message first = connection.readMessage().orElseThrow();
        assertThat(first.kind()).isEqualTo(MessageKind.HANDSHAKE);
        assertThat(first.body()).isEqualTo("alice");

        Message second = connection.readMessage().orElseThrow();
        assertThat(second.kind()).isEqualTo(MessageKind.CHAT);
        assertThat(second.body()).isEqualTo("hi");

        assertThat(connection.readMessage()).isEmpty();
    }

    @Test
    void rejectsFrameAboveSizeLimit() throws Exception {
        OutputStream out = rawPeer.getOutputStream();
        CodedOutputStream coded = CodedOutputStream.newInstance(out);
        coded.writeUInt32NoTag(4096);
        coded.flush();
        out.write(new byte[16]);
        out.flush();

        assertThatThrownBy(() -> connection.readMessage())
                .isInstanceOf(FramingException.class)
                .hasMessageContaining("exceeds the limit");
    }

    @Test
    void rejectsTruncatedFrame() throws Exception {
        byte[] frame = delimited(Message.chat("this frame is cut short").toFrame());
        OutputStream out = rawPeer.getOutputStream();
        out.write(frame, 0, frame.length - 5);
        out.flush();
        rawPeer.shutdownOutput();

        assertThatThrownBy(() -> connection.readMessage())
                .isInstanceOf(FramingException.class)
                .hasMessageContaining("ended inside a frame");
    }

    @Test
    void rejectsGarbagePayload() throws Exception {
        OutputStream out = rawPeer.getOutputStream();
        out.write(new byte[]{3, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF});
        out.flush();

        assertThatThrownBy(() -> connection.readMessage()).isInstanceOf(FramingException.class);
    }

    @Test
    void rejectsFrameWithoutKind() throws Exception {
        ChatProto.Frame frame = ChatProto.Frame.newBuilder().setBody("no kind").build();
        OutputStream out = rawPeer.getOutputStream();
        out.write(delimited(frame));
        out.flush();

        assertThatThrownBy(() -> connection.readMessage())
                .isInstanceOf(FramingException.class)
                .hasMessageContaining("kind");
    }

    @Test
    void refusesToWriteOversizedMessage() {
        String body = "x".repeat(2048);

        assertThatThrownBy(() -> connection.writeMessage(Message.chat(body)))
                .isInstanceOf(FramingException.class);
        assertThat(connection.isOpen()).isTrue();
    }

    @Test
    void closeUnblocksPendingRead() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<Message>> pending = executor.submit(() -> connection.readMessage());
            Thread.sleep(100);
            connection.close();

            assertThatThrownBy(() -> pending.get(5, TimeUnit.SECONDS))
                    .hasCauseInstanceOf(IOException.class);
            assertThat(connection.isOpen()).isFalse();
            connection.close();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void writeAfterCloseFails() {
        connection.close();

        assertThatThrownBy(() -> connection.writeMessage(Message.system("late")))
                .isInstanceOf(IOException.class);
    }

    @Test
    void concurrentWritersProduceWholeFrames() throws Exception {
        int writers = 4;
        int perWriter = 50;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                int writer = w;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < perWriter; i++) {
                        connection.writeMessage(Message.chat("w" + writer + "-" + i));
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        Connection peer = new Connection(rawPeer);
        List<Integer> nextPerWriter = new ArrayList<>(List.of(0, 0, 0, 0));
        for (int n = 0; n < writers * perWriter; n++) {
            String body = peer.readMessage().orElseThrow().body();
            int writer = Integer.parseInt(body.substring(1, body.indexOf('-')));
            int seq = Integer.parseInt(body.substring(body.indexOf('-') + 1));
            assertThat(seq).isEqualTo(nextPerWriter.get(writer));
            nextPerWriter.set(writer, seq + 1);
        }
        assertThat(nextPerWriter).containsOnly(perWriter);
    }

    private static byte[] delimited(ChatProto.Frame frame) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        frame.writeDelimitedTo(bytes);
        return bytes.toByteArray();
    }
}
