package io.launchmanager.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.launchmanager.util.Jsons;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of requests and responses, independent of framing.
 */
public final class Messages {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private Messages() {
    }

    public static byte[] encodeRequest(Request request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("command", request.command());
        body.put("args", request.args());
        try {
            return Jsons.compact().writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Failed to encode request", e);
        }
    }

    public static Request decodeRequest(byte[] payload) {
        JsonNode root;
        try {
            root = Jsons.compact().readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Invalid JSON request: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ProtocolException("Invalid JSON request", e);
        }
        return toRequest(root);
    }

    static Request toRequest(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ProtocolException("Request must be a JSON object");
        }
        JsonNode command = root.get("command");
        List<String> args = new ArrayList<>();
        JsonNode rawArgs = root.get("args");
        if (rawArgs != null && !rawArgs.isNull()) {
            if (!rawArgs.isArray()) {
                throw new ProtocolException("Request args must be a JSON array");
            }
            for (JsonNode arg : rawArgs) {
                args.add(arg.isValueNode() ? arg.asText() : arg.toString());
            }
        }
        return new Request(command == null || command.isNull() ? "" : command.asText(), args);
    }

    /**
     * Encodes {@code response}; if the result is not below {@code maxBytes} a failure response
     * describing the overflow is encoded instead.
     */
    public static byte[] encodeResponse(Response response, long maxBytes) {
        byte[] bytes = writeResponse(response);
        if (bytes.length < maxBytes) {
            return bytes;
        }
        return writeResponse(Response.error("Response too large: " + bytes.length + " bytes"));
    }

    public static Response decodeResponse(byte[] payload) {
        try {
            Map<String, Object> raw = Jsons.compact().readValue(payload, MAP_TYPE);
            if (raw == null) {
                throw new ProtocolException("Response must be a JSON object");
            }
            return Response.fromMap(raw);
        } catch (IOException e) {
            throw new ProtocolException("Invalid JSON response", e);
        }
    }

    public static ByteBuffer lengthPrefix(long length) {
        ByteBuffer prefix = ByteBuffer.allocate(ProtocolSettings.LENGTH_PREFIX_BYTES);
        prefix.putLong(length);
        prefix.flip();
        return prefix;
    }

    private static byte[] writeResponse(Response response) {
        try {
            return Jsons.compact().writeValueAsBytes(response);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Failed to encode response", e);
        }
    }
}
