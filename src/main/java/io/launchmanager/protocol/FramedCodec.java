package io.launchmanager.protocol;

import java.io.EOFException;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;

/**
 * Length-prefixed framing. The prefix has already been consumed by {@link ProtocolDetector}, so
 * this codec starts with the payload length in hand.
 */
public final class FramedCodec implements WireCodec {
    private final ChannelIO io;
    private final ProtocolSettings settings;
    private final long payloadLength;

    FramedCodec(ChannelIO io, ProtocolSettings settings, long payloadLength) {
        if (!settings.acceptsFrameLength(payloadLength)) {
            throw new ProtocolException("Frame length out of bounds: " + payloadLength);
        }
        this.io = io;
        this.settings = settings;
        this.payloadLength = payloadLength;
    }

    @Override
    public WireFormat format() {
        return WireFormat.FRAMED;
    }

    public long payloadLength() {
        return payloadLength;
    }

    @Override
    public Request readRequest() throws IOException {
        ByteBuffer payload = ByteBuffer.allocate(Math.toIntExact(payloadLength));
        try {
            io.readFully(payload, settings.readTimeout());
        } catch (EOFException e) {
            throw new ProtocolException("Connection closed mid-frame: expected " + payloadLength + " bytes", e);
        } catch (SocketTimeoutException e) {
            throw new ProtocolException("Timed out reading a " + payloadLength + " byte frame", e);
        }
        return Messages.decodeRequest(payload.array());
    }

    @Override
    public void writeResponse(Response response) throws IOException {
        writeFrame(io, Messages.encodeResponse(response, settings.maxMessageBytes()), settings);
    }

    static void writeFrame(ChannelIO io, byte[] payload, ProtocolSettings settings) throws IOException {
        io.writeFully(
                new ByteBuffer[] {Messages.lengthPrefix(payload.length), ByteBuffer.wrap(payload)},
                settings.readTimeout()
        );
    }
}
