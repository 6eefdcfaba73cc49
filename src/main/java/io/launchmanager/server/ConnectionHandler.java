package io.launchmanager.server;

import io.launchmanager.protocol.ChannelIO;
import io.launchmanager.protocol.LegacyCodec;
import io.launchmanager.protocol.ProtocolDetector;
import io.launchmanager.protocol.ProtocolException;
import io.launchmanager.protocol.ProtocolSettings;
import io.launchmanager.protocol.Request;
import io.launchmanager.protocol.Response;
import io.launchmanager.protocol.WireCodec;
import io.launchmanager.protocol.WireFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.channels.SocketChannel;
import java.util.function.Function;

/**
 * One request/response exchange on an accepted connection:
 * {@code DETECT -> READ_REQUEST -> DISPATCH -> WRITE_RESPONSE -> CLOSE}.
 *
 * <p>Whatever goes wrong stays on this thread: the error is logged, an error response is written in
 * whichever framing was detected (falling back to raw JSON), and the channel is closed.
 */
public final class ConnectionHandler implements Runnable {
    private static final Logger logger = LogManager.getLogger(ConnectionHandler.class);

    private final long connectionId;
    private final SocketChannel channel;
    private final ProtocolSettings settings;
    private final Function<Request, Response> dispatcher;
    private volatile ConnectionState state;
    private volatile WireFormat format;

    public ConnectionHandler(
            long connectionId,
            SocketChannel channel,
            ProtocolSettings settings,
            Function<Request, Response> dispatcher
    ) {
        this.connectionId = connectionId;
        this.channel = channel;
        this.settings = settings;
        this.dispatcher = dispatcher;
        this.state = ConnectionState.DETECT;
    }

    public ConnectionState state() {
        return state;
    }

    public WireFormat format() {
        return format;
    }

    @Override
    public void run() {
        ChannelIO io = null;
        WireCodec codec = null;
        try {
            io = new ChannelIO(channel);
            state = ConnectionState.DETECT;
            codec = new ProtocolDetector(settings).detect(io);
            format = codec.format();

            state = ConnectionState.READ_REQUEST;
            Request request = codec.readRequest();
            logger.debug("conn-{} {} request: {}", connectionId, format, request.command());

            state = ConnectionState.DISPATCH;
            Response response = dispatcher.apply(request);

            state = ConnectionState.WRITE_RESPONSE;
            deliver(io, codec, response);
        } catch (ProtocolException e) {
            logger.warn("conn-{} protocol error in {}: {}", connectionId, state, e.getMessage());
            fail(io, codec, Response.error(e), true);
        } catch (IOException e) {
            logger.warn("conn-{} I/O error in {}: {}", connectionId, state, e.getMessage());
            // A failed write already tried the unframed fallback.
            fail(io, codec, Response.error(e), state != ConnectionState.WRITE_RESPONSE);
        } catch (Throwable t) {
            logger.error("conn-{} unexpected failure in {}", connectionId, state, t);
            fail(io, codec, Response.error(t), true);
        } finally {
            state = ConnectionState.CLOSE;
            close(io);
        }
    }

    private void fail(ChannelIO io, WireCodec codec, Response error, boolean reply) {
        state = ConnectionState.ERROR;
        if (io == null || !reply) {
            return;
        }
        state = ConnectionState.WRITE_RESPONSE;
        try {
            deliver(io, codec, error);
        } catch (IOException | RuntimeException e) {
            logger.debug("conn-{} could not deliver error response: {}", connectionId, e.getMessage());
        }
    }

    private void deliver(ChannelIO io, WireCodec codec, Response response) throws IOException {
        if (codec == null) {
            LegacyCodec.writerFor(io, settings).writeResponse(response);
            return;
        }
        try {
            codec.writeResponse(response);
        } catch (IOException e) {
            if (codec.format() != WireFormat.FRAMED) {
                throw e;
            }
            logger.debug("conn-{} framed reply failed ({}), retrying unframed", connectionId, e.getMessage());
            LegacyCodec.writerFor(io, settings).writeResponse(response);
        }
    }

    private void close(ChannelIO io) {
        try {
            if (io != null) {
                io.close();
            } else {
                channel.close();
            }
        } catch (IOException e) {
            logger.debug("conn-{} close failed: {}", connectionId, e.getMessage());
        }
    }
}
