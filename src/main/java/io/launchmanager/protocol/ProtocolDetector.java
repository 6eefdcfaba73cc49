package io.launchmanager.protocol;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Arrays;

/**
 * Chooses the framing for a fresh connection from its first 8 bytes.
 *
 * <p>A channel cannot peek, so detection consumes up to 8 bytes under the short detection timeout.
 * If they decode to a big-endian length in {@code (0, maxMessageBytes)} the connection is framed
 * and the prefix is spent; otherwise the consumed bytes are handed to the legacy codec as the
 * start of its buffer.
 */
public final class ProtocolDetector {
    private final ProtocolSettings settings;

    public ProtocolDetector(ProtocolSettings settings) {
        this.settings = settings;
    }

    public WireCodec detect(ChannelIO io) throws IOException {
        ByteBuffer head = ByteBuffer.allocate(ProtocolSettings.LENGTH_PREFIX_BYTES);
        long deadline = System.nanoTime() + settings.detectTimeout().toNanos();
        boolean peerClosed = false;
        while (head.hasRemaining()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0L) {
                break;
            }
            int n;
            try {
                n = io.read(head, Duration.ofNanos(remaining));
            } catch (SocketTimeoutException e) {
                break;
            }
            if (n < 0) {
                peerClosed = true;
                break;
            }
        }
        head.flip();
        if (head.remaining() == ProtocolSettings.LENGTH_PREFIX_BYTES) {
            long length = head.getLong(0);
            if (settings.acceptsFrameLength(length)) {
                return new FramedCodec(io, settings, length);
            }
        }
        byte[] consumed = Arrays.copyOf(head.array(), head.remaining());
        return new LegacyCodec(io, settings, consumed, peerClosed);
    }
}
