package io.launchmanager.protocol;

/**
 * Malformed frame, out-of-bounds length, peer closed mid-read, read timeout or undecodable JSON.
 */
public final class ProtocolException extends RuntimeException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
