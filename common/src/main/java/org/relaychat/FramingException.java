package org.relaychat;

import java.io.IOException;

/**
 * The byte stream no longer lines up with the frame format. The connection that produced it cannot be reused.
 */
public class FramingException extends IOException {

    public FramingException(String message) {
        super(message);
    }

    public FramingException(String message, Throwable cause) {
        super(message, cause);
    }
}
