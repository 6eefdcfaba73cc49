package io.launchmanager.protocol;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.time.Duration;

/**
 * Timed reads and writes on a socket channel. Unix domain channels expose no {@code SO_TIMEOUT},
 * so the channel is switched to non-blocking mode and every wait goes through a private selector.
 */
public final class ChannelIO implements Closeable {
    private final SocketChannel channel;
    private final Selector selector;
    private final SelectionKey key;

    public ChannelIO(SocketChannel channel) throws IOException {
        this.channel = channel;
        this.selector = Selector.open();
        try {
            channel.configureBlocking(false);
            this.key = channel.register(selector, 0);
        } catch (IOException | RuntimeException e) {
            selector.close();
            throw e;
        }
    }

    public SocketChannel channel() {
        return channel;
    }

    /**
     * Reads whatever is available into {@code dst}, waiting at most {@code timeout}.
     *
     * @return bytes read, or -1 once the peer has closed its side
     * @throws SocketTimeoutException if nothing arrived in time
     */
    public int read(ByteBuffer dst, Duration timeout) throws IOException {
        if (!dst.hasRemaining()) {
            return 0;
        }
        int n = channel.read(dst);
        if (n != 0) {
            return n;
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remainingMs = remainingMillis(deadline);
            if (remainingMs <= 0L) {
                throw new SocketTimeoutException("Read timed out after " + timeout.toMillis() + " ms");
            }
            await(SelectionKey.OP_READ, remainingMs);
            n = channel.read(dst);
            if (n != 0) {
                return n;
            }
        }
    }

    /**
     * Fills {@code dst} completely; each individual read may wait up to {@code timeout}.
     *
     * @throws EOFException if the peer closes before {@code dst} is full
     */
    public void readFully(ByteBuffer dst, Duration timeout) throws IOException {
        while (dst.hasRemaining()) {
            if (read(dst, timeout) < 0) {
                throw new EOFException("Connection closed with " + dst.remaining() + " bytes still expected");
            }
        }
    }

    public void writeFully(ByteBuffer src, Duration timeout) throws IOException {
        writeFully(new ByteBuffer[] {src}, timeout);
    }

    public void writeFully(ByteBuffer[] srcs, Duration timeout) throws IOException {
        // The deadline only runs while the peer is not draining its side.
        long deadline = Long.MIN_VALUE;
        while (hasRemaining(srcs)) {
            if (channel.write(srcs) > 0L) {
                deadline = Long.MIN_VALUE;
                continue;
            }
            if (deadline == Long.MIN_VALUE) {
                deadline = System.nanoTime() + timeout.toNanos();
            }
            long remainingMs = remainingMillis(deadline);
            if (remainingMs <= 0L) {
                throw new SocketTimeoutException("Write timed out after " + timeout.toMillis() + " ms");
            }
            await(SelectionKey.OP_WRITE, remainingMs);
        }
    }

    private void await(int ops, long timeoutMs) throws IOException {
        key.interestOps(ops);
        try {
            selector.select(timeoutMs);
            selector.selectedKeys().clear();
        } finally {
            if (key.isValid()) {
                key.interestOps(0);
            }
        }
    }

    private static boolean hasRemaining(ByteBuffer[] buffers) {
        for (ByteBuffer buffer : buffers) {
            if (buffer.hasRemaining()) {
                return true;
            }
        }
        return false;
    }

    private static long remainingMillis(long deadlineNanos) {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0L) {
            return 0L;
        }
        return Math.max(1L, remaining / 1_000_000L);
    }

    @Override
    public void close() throws IOException {
        try {
            selector.close();
        } finally {
            channel.close();
        }
    }
}
