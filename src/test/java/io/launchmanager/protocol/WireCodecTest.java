package io.launchmanager.protocol;

import io.launchmanager.TestFiles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class WireCodecTest {
    private static final ProtocolSettings SETTINGS = new ProtocolSettings(
            Duration.ofMillis(200), Duration.ofSeconds(2), 1_000_000L);

    private Path dir;
    private ServerSocketChannel listener;
    private SocketChannel client;
    private ChannelIO server;

    @BeforeEach
    void connect() throws IOException {
        dir = TestFiles.shortTempDir();
        Path socket = dir.resolve("t.sock");
        listener = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        listener.bind(UnixDomainSocketAddress.of(socket));
        client = SocketChannel.open(StandardProtocolFamily.UNIX);
        client.connect(UnixDomainSocketAddress.of(socket));
        server = new ChannelIO(listener.accept());
    }

    @AfterEach
    void close() throws IOException {
        server.close();
        client.close();
        listener.close();
        TestFiles.deleteRecursively(dir);
    }

    @Test
    void framedRequestIsDetectedAndAnsweredFramed() throws Exception {
        byte[] payload = Messages.encodeRequest(Request.of("bash", "npm run dev", "--name", "web"));
        write(Messages.lengthPrefix(payload.length));
        write(ByteBuffer.wrap(payload));

        WireCodec codec = new ProtocolDetector(SETTINGS).detect(server);
        assertEquals(WireFormat.FRAMED, codec.format());
        assertEquals(Request.of("bash", "npm run dev", "--name", "web"), codec.readRequest());

        codec.writeResponse(Response.ok("done").with("pid", 42));
        ByteBuffer prefix = readExactly(8);
        byte[] reply = readExactly((int) prefix.getLong()).array();
        Response response = Messages.decodeResponse(reply);
        assertTrue(response.success());
        assertEquals("done", response.message().orElseThrow());
        assertEquals(42, response.get("pid"));
    }

    @Test
    void rawJsonIsDetectedAsLegacyAndAnsweredRaw() throws Exception {
        write(ByteBuffer.wrap("{\"command\": \"status\", \"args\": []}".getBytes(StandardCharsets.UTF_8)));

        WireCodec codec = new ProtocolDetector(SETTINGS).detect(server);
        assertEquals(WireFormat.LEGACY, codec.format());
        assertEquals(Request.of("status"), codec.readRequest());

        codec.writeResponse(Response.ok().with("processes", Map.of()));
        server.close();
        assertEquals("{\"success\":true,\"processes\":{}}", new String(readToEnd(), StandardCharsets.UTF_8));
    }

    @Test
    void legacyRequestSplitAcrossWritesIsReassembled() throws Exception {
        Thread writer = new Thread(() -> {
            try {
                write(ByteBuffer.wrap("{\"command\":\"he".getBytes(StandardCharsets.UTF_8)));
                Thread.sleep(300L);
                write(ByteBuffer.wrap("lp\",\"args\":[\"bash\"]}".getBytes(StandardCharsets.UTF_8)));
            } catch (IOException | InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        writer.start();
        WireCodec codec = new ProtocolDetector(SETTINGS).detect(server);
        assertEquals(WireFormat.LEGACY, codec.format());
        assertEquals(Request.of("help", "bash"), codec.readRequest());
        writer.join(5_000L);
    }

    @Test
    void fewerThanEightBytesThenCloseFallsBackToLegacyAndFailsCleanly() throws Exception {
        write(ByteBuffer.wrap(new byte[] {0, 0, 1}));
        client.shutdownOutput();

        WireCodec codec = new ProtocolDetector(SETTINGS).detect(server);
        LegacyCodec legacy = assertInstanceOf(LegacyCodec.class, codec);
        assertEquals(3, legacy.bufferedBytes());
        assertThrows(ProtocolException.class, codec::readRequest);
    }

    @Test
    void oversizedLengthIsTreatedAsLegacyData() throws Exception {
        write(Messages.lengthPrefix(SETTINGS.maxMessageBytes()));
        client.shutdownOutput();

        WireCodec codec = new ProtocolDetector(SETTINGS).detect(server);
        assertEquals(WireFormat.LEGACY, codec.format());
        assertThrows(ProtocolException.class, codec::readRequest);
    }

    @Test
    void frameCutShortRaisesProtocolError() throws Exception {
        write(Messages.lengthPrefix(100));
        write(ByteBuffer.wrap("{\"command\":".getBytes(StandardCharsets.UTF_8)));
        client.shutdownOutput();

        WireCodec codec = new ProtocolDetector(SETTINGS).detect(server);
        assertEquals(WireFormat.FRAMED, codec.format());
        ProtocolException error = assertThrows(ProtocolException.class, codec::readRequest);
        assertTrue(error.getMessage().contains("closed mid-frame"));
    }

    @Test
    void frameWithInvalidJsonRaisesProtocolError() throws Exception {
        byte[] payload = "[1,2,3]".getBytes(StandardCharsets.UTF_8);
        write(Messages.lengthPrefix(payload.length));
        write(ByteBuffer.wrap(payload));

        WireCodec codec = new ProtocolDetector(SETTINGS).detect(server);
        assertThrows(ProtocolException.class, codec::readRequest);
    }

    @Test
    void silentPeerTimesOutDuringLegacyRead() throws Exception {
        ProtocolSettings quick = new ProtocolSettings(Duration.ofMillis(50), Duration.ofMillis(200), 1_000_000L);
        WireCodec codec = new ProtocolDetector(quick).detect(server);
        assertEquals(WireFormat.LEGACY, codec.format());
        ProtocolException error = assertThrows(ProtocolException.class, codec::readRequest);
        assertTrue(error.getMessage().startsWith("Timed out"));
    }

    @Test
    void largeFramedResponseArrivesWhole() throws Exception {
        byte[] payload = Messages.encodeRequest(Request.of("status"));
        write(Messages.lengthPrefix(payload.length));
        write(ByteBuffer.wrap(payload));
        WireCodec codec = new ProtocolDetector(SETTINGS).detect(server);
        codec.readRequest();

        String blob = "x".repeat(600_000);
        Thread writer = new Thread(() -> {
            try {
                codec.writeResponse(Response.ok().with(Response.OUTPUT, blob));
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        });
        writer.start();
        ByteBuffer prefix = readExactly(8);
        Response response = Messages.decodeResponse(readExactly((int) prefix.getLong()).array());
        writer.join(5_000L);
        assertEquals(blob, response.get(Response.OUTPUT));
    }

    private void write(ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            client.write(buffer);
        }
    }

    private ByteBuffer readExactly(int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining()) {
            if (client.read(buffer) < 0) {
                throw new IOException("closed early");
            }
        }
        buffer.flip();
        return buffer;
    }

    private byte[] readToEnd() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteBuffer chunk = ByteBuffer.allocate(4096);
        while (client.read(chunk) >= 0) {
            out.write(chunk.array(), 0, chunk.position());
            chunk.clear();
        }
        return out.toByteArray();
    }
}
