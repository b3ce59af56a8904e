package org.relaychat;

import org.relaychat.proto.ChatProto;

public enum MessageKind {
    HANDSHAKE,
    CHAT,
    JOIN,
    LEAVE,
    SYSTEM,
    WHO;

    public ChatProto.Kind toProto() {
        return switch (this) {
            case HANDSHAKE -> ChatProto.Kind.HANDSHAKE;
            case CHAT -> ChatProto.Kind.CHAT;
            case JOIN -> ChatProto.Kind.JOIN;
            case LEAVE -> ChatProto.Kind.LEAVE;
            case SYSTEM -> ChatProto.Kind.SYSTEM;
            case WHO -> ChatProto.Kind.WHO;
        };
    }

    public static MessageKind fromProto(ChatProto.Kind kind) throws FramingException {
        return switch (kind) {
            case HANDSHAKE -> HANDSHAKE;
            case CHAT -> CHAT;
            case JOIN -> JOIN;
            case LEAVE -> LEAVE;
            case SYSTEM -> SYSTEM;
            case WHO -> WHO;
            case KIND_UNSPECIFIED, UNRECOGNIZED -> throw new FramingException("Frame without a known kind: " + kind);
        };
    }

    // Joins, leaves and server notices are all shown as announcements
    public boolean isAnnouncement() {
        return switch (this) {
            case JOIN, LEAVE, SYSTEM -> true;
            case HANDSHAKE, CHAT, WHO -> false;
        };
    }
}
