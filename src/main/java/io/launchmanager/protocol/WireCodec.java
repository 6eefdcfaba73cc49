package io.launchmanager.protocol;

import java.io.IOException;

/**
 * One connection's framing, picked by {@link ProtocolDetector}. The connection handler only talks
 * to this interface.
 */
public interface WireCodec {
    WireFormat format();

    Request readRequest() throws IOException;

    void writeResponse(Response response) throws IOException;
}
