package io.launchmanager.client;

import io.launchmanager.protocol.Messages;
import io.launchmanager.protocol.ProtocolException;
import io.launchmanager.protocol.ProtocolSettings;
import io.launchmanager.protocol.Request;
import io.launchmanager.protocol.Response;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;

/**
 * Blocking client for a running supervisor. One request per connection, as the server expects.
 */
public final class SupervisorClient {
    public static final int DEFAULT_CHUNK_BYTES = 64 * 1024;

    private final Path socketPath;
    private final int chunkBytes;

    public SupervisorClient(Path socketPath) {
        this(socketPath, DEFAULT_CHUNK_BYTES);
    }

    /**
     * @param chunkBytes upper bound on a single socket read
     */
    public SupervisorClient(Path socketPath, int chunkBytes) {
        if (chunkBytes <= 0) {
            throw new IllegalArgumentException("chunkBytes must be > 0");
        }
        this.socketPath = socketPath;
        this.chunkBytes = chunkBytes;
    }

    public Path socketPath() {
        return socketPath;
    }

    /**
     * Sends a length-prefixed request and reads the length-prefixed response.
     */
    public Response send(Request request) throws IOException {
        byte[] payload = Messages.encodeRequest(request);
        try (SocketChannel channel = connect()) {
            writeAll(channel, Messages.lengthPrefix(payload.length));
            writeAll(channel, ByteBuffer.wrap(payload));
            ByteBuffer prefix = readExactly(channel, ProtocolSettings.LENGTH_PREFIX_BYTES);
            long length = prefix.getLong();
            if (length <= 0 || length > Integer.MAX_VALUE) {
                throw new ProtocolException("Invalid response length: " + length);
            }
            return Messages.decodeResponse(readExactly(channel, (int) length).array());
        }
    }

    /**
     * Sends raw JSON without a prefix and reads the raw JSON reply until the server closes.
     */
    public Response sendLegacy(Request request) throws IOException {
        return Messages.decodeResponse(exchange(Messages.encodeRequest(request), false));
    }

    public Response send(Request request, boolean legacy) throws IOException {
        return legacy ? sendLegacy(request) : send(request);
    }

    /**
     * Writes {@code bytes} verbatim, optionally half-closes, and returns everything the server
     * sends before closing.
     */
    public byte[] exchange(byte[] bytes, boolean shutdownOutput) throws IOException {
        try (SocketChannel channel = connect()) {
            writeAll(channel, ByteBuffer.wrap(bytes));
            if (shutdownOutput) {
                channel.shutdownOutput();
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ByteBuffer chunk = ByteBuffer.allocate(chunkBytes);
            while (channel.read(chunk) >= 0) {
                out.write(chunk.array(), 0, chunk.position());
                chunk.clear();
            }
            return out.toByteArray();
        }
    }

    private SocketChannel connect() throws IOException {
        SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        try {
            channel.connect(UnixDomainSocketAddress.of(socketPath));
            return channel;
        } catch (IOException e) {
            channel.close();
            throw e;
        }
    }

    private static void writeAll(SocketChannel channel, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    private ByteBuffer readExactly(SocketChannel channel, int length) throws IOException {
        ByteBuffer target = ByteBuffer.allocate(length);
        while (target.hasRemaining()) {
            int limit = Math.min(target.capacity(), target.position() + chunkBytes);
            target.limit(limit);
            if (channel.read(target) < 0) {
                throw new EOFException("Server closed after " + target.position() + " of " + length + " bytes");
            }
            target.limit(target.capacity());
        }
        target.flip();
        return target;
    }
}
