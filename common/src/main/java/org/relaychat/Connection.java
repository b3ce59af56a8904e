package org.relaychat;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import org.relaychat.proto.ChatProto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Framed duplex channel over one TCP socket.
 *
 * <p>Every frame is a {@link ChatProto.Frame} preceded by its size as a varint, the protobuf delimited encoding.
 * Reading is meant for a single thread; writes may come from several threads and are serialized internally.
 */
public class Connection implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(Connection.class);

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final int maxFrameBytes;
    private final SocketAddress remoteAddress;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean open = new AtomicBoolean(true);

    public Connection(Socket socket) throws IOException {
        this(socket, ChatProtocol.MAX_FRAME_BYTES);
    }

    public Connection(Socket socket, int maxFrameBytes) throws IOException {
        this.socket = socket;
        this.maxFrameBytes = maxFrameBytes;
        this.remoteAddress = socket.getRemoteSocketAddress();
        socket.setTcpNoDelay(true);
        this.in = new BufferedInputStream(socket.getInputStream());
        this.out = new BufferedOutputStream(socket.getOutputStream());
    }

    public static Connection connect(String host, int port, Duration connectTimeout) throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), (int) connectTimeout.toMillis());
            return new Connection(socket);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    /**
     * Blocks until the next frame is complete.
     *
     * @return the message, or empty when the peer closed the stream between frames
     * @throws FramingException when the data is not a valid frame; the connection must be closed afterwards
     * @throws IOException      on transport errors, including reads interrupted by {@link #close()}
     */
    public Optional<Message> readMessage() throws IOException {
        int first = in.read();
        if (first == -1) {
            return Optional.empty();
        }

        int length;
        try {
            length = CodedInputStream.readRawVarint32(first, in);
        } catch (InvalidProtocolBufferException e) {
            throw new FramingException("Malformed frame length from " + remoteAddress, e);
        }
        if (length < 0 || length > maxFrameBytes) {
            throw new FramingException("Frame of " + length + " bytes exceeds the limit of " + maxFrameBytes);
        }

        byte[] payload = in.readNBytes(length);
        if (payload.length < length) {
            throw new FramingException("Stream ended inside a frame (" + payload.length + " of " + length + " bytes)");
        }

        ChatProto.Frame frame;
        try {
            frame = ChatProto.Frame.parseFrom(payload);
        } catch (InvalidProtocolBufferException e) {
            throw new FramingException("Malformed frame payload from " + remoteAddress, e);
        }
        return Optional.of(Message.fromFrame(frame));
    }

    public void writeMessage(Message message) throws IOException {
        ChatProto.Frame frame = message.toFrame();
        if (frame.getSerializedSize() > maxFrameBytes) {
            throw new FramingException("Message of " + frame.getSerializedSize() + " bytes exceeds the limit of " + maxFrameBytes);
        }
        writeLock.lock();
        try {
            if (!open.get()) {
                throw new IOException("Connection to " + remoteAddress + " is closed");
            }
            frame.writeDelimitedTo(out);
            out.flush();
        } finally {
            writeLock.unlock();
        }
    }

    // Zero disables the timeout
    public void setReadTimeout(Duration timeout) throws IOException {
        socket.setSoTimeout((int) timeout.toMillis());
    }

    public boolean isOpen() {
        return open.get();
    }

    public SocketAddress remoteAddress() {
        return remoteAddress;
    }

    /**
     * Closes the socket, which also fails any read or write blocked on it. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error while closing connection to {}", remoteAddress, e);
        }
    }
}
