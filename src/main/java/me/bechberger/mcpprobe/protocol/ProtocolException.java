package me.bechberger.mcpprobe.protocol;

import java.io.IOException;

/**
 * A response was malformed or did not have the shape the method declares.
 */
public class ProtocolException extends IOException {

    public ProtocolException(String message) {
        super(message);
    }
}
