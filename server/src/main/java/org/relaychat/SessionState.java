package org.relaychat;

public enum SessionState {
    CONNECTING,
    HANDSHAKING,
    ACTIVE,
    CLOSING,
    CLOSED
}
