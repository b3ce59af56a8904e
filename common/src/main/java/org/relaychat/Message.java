package org.relaychat;

import org.relaychat.proto.ChatProto;

import java.time.Instant;
import java.util.Objects;

/**
 * One unit of chat traffic. Immutable; converted to and from {@link ChatProto.Frame} at the connection boundary.
 */
public record Message(MessageKind kind, ClientId senderId, String senderName, String body, Instant timestamp) {

    public Message {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(senderId, "senderId");
        Objects.requireNonNull(timestamp, "timestamp");
        senderName = senderName == null ? "" : senderName;
        body = body == null ? "" : body;
    }

    public static Message handshake(String displayName) {
        return new Message(MessageKind.HANDSHAKE, ClientId.SERVER, "", displayName, Instant.now());
    }

    // Outgoing chat line from a client; the server fills in who sent it
    public static Message chat(String body) {
        return new Message(MessageKind.CHAT, ClientId.SERVER, "", body, Instant.now());
    }

    public static Message chat(ClientId senderId, String senderName, String body) {
        return new Message(MessageKind.CHAT, senderId, senderName, body, Instant.now());
    }

    public static Message join(ClientId clientId, String displayName) {
        return new Message(MessageKind.JOIN, clientId, displayName, displayName + " joined the chat", Instant.now());
    }

    public static Message leave(ClientId clientId, String displayName) {
        return new Message(MessageKind.LEAVE, clientId, displayName, displayName + " left the chat", Instant.now());
    }

    public static Message system(String body) {
        return new Message(MessageKind.SYSTEM, ClientId.SERVER, "", body, Instant.now());
    }

    public static Message who() {
        return new Message(MessageKind.WHO, ClientId.SERVER, "", "", Instant.now());
    }

    public ChatProto.Frame toFrame() {
        return ChatProto.Frame.newBuilder()
                .setKind(kind.toProto())
                .setSenderId(senderId.value())
                .setSenderName(senderName)
                .setBody(body)
                .setTimestampMillis(timestamp.toEpochMilli())
                .build();
    }

    // Size check against the frame limit, without the length prefix
    public boolean fitsIn(int maxFrameBytes) {
        return toFrame().getSerializedSize() <= maxFrameBytes;
    }

    public static Message fromFrame(ChatProto.Frame frame) throws FramingException {
        MessageKind kind = MessageKind.fromProto(frame.getKind());
        return new Message(kind, ClientId.of(frame.getSenderId()), frame.getSenderName(), frame.getBody(),
                Instant.ofEpochMilli(frame.getTimestampMillis()));
    }

    @Override
    public String toString() {
        return "Message[" + kind + " from " + senderId + " (" + senderName + "), " + body.length() + " chars]";
    }
}
