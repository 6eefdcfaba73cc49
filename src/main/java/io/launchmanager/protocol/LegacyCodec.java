package io.launchmanager.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.launchmanager.util.Jsons;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * Unframed JSON: keep reading until the accumulated bytes parse. Replies are raw JSON written in
 * bounded chunks.
 */
public final class LegacyCodec implements WireCodec {
    private static final int READ_CHUNK_BYTES = 4096;

    private final ChannelIO io;
    private final ProtocolSettings settings;
    private final ByteArrayOutputStream buffer;
    private boolean peerClosed;

    LegacyCodec(ChannelIO io, ProtocolSettings settings, byte[] consumed, boolean peerClosed) {
        this.io = io;
        this.settings = settings;
        this.buffer = new ByteArrayOutputStream(Math.max(READ_CHUNK_BYTES, consumed.length));
        this.buffer.write(consumed, 0, consumed.length);
        this.peerClosed = peerClosed;
    }

    /**
     * Writer-only codec, used when a framed reply could not be delivered or detection never ran.
     */
    public static LegacyCodec writerFor(ChannelIO io, ProtocolSettings settings) {
        return new LegacyCodec(io, settings, new byte[0], true);
    }

    @Override
    public WireFormat format() {
        return WireFormat.LEGACY;
    }

    @Override
    public Request readRequest() throws IOException {
        Optional<Request> parsed = tryParse();
        if (parsed.isPresent()) {
            return parsed.get();
        }
        ByteBuffer chunk = ByteBuffer.allocate(READ_CHUNK_BYTES);
        while (!peerClosed) {
            chunk.clear();
            int n;
            try {
                n = io.read(chunk, settings.readTimeout());
            } catch (SocketTimeoutException e) {
                throw new ProtocolException("Timed out waiting for a complete JSON request", e);
            }
            if (n < 0) {
                peerClosed = true;
                break;
            }
            buffer.write(chunk.array(), 0, n);
            if (buffer.size() >= settings.maxMessageBytes()) {
                throw new ProtocolException("Request exceeds " + settings.maxMessageBytes() + " bytes");
            }
            parsed = tryParse();
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        throw new ProtocolException("Connection closed before a complete request was received ("
                + buffer.size() + " bytes)");
    }

    @Override
    public void writeResponse(Response response) throws IOException {
        byte[] payload = Messages.encodeResponse(response, settings.maxMessageBytes());
        for (int offset = 0; offset < payload.length; offset += ProtocolSettings.LEGACY_CHUNK_BYTES) {
            int length = Math.min(ProtocolSettings.LEGACY_CHUNK_BYTES, payload.length - offset);
            io.writeFully(ByteBuffer.wrap(payload, offset, length), settings.readTimeout());
        }
    }

    int bufferedBytes() {
        return buffer.size();
    }

    private Optional<Request> tryParse() {
        if (buffer.size() == 0) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = Jsons.compact().readTree(buffer.toByteArray());
        } catch (JsonProcessingException e) {
            // Incomplete so far.
            return Optional.empty();
        } catch (IOException e) {
            throw new ProtocolException("Failed to parse request", e);
        }
        if (root == null || root.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(Messages.toRequest(root));
    }
}
