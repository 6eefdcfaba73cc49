package io.launchmanager.protocol;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered JSON object sent back to a client. Always carries {@code success}; failures add
 * {@code error}, successes carry command specific fields.
 */
public final class Response {
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";
    public static final String MESSAGE = "message";
    public static final String OUTPUT = "output";

    private final Map<String, Object> fields;

    private Response(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static Response ok() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(SUCCESS, true);
        return new Response(fields);
    }

    public static Response ok(String message) {
        return ok().with(MESSAGE, message);
    }

    public static Response error(String error) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(SUCCESS, false);
        fields.put(ERROR, error == null ? "Unknown error" : error);
        return new Response(fields);
    }

    /**
     * Failure response for an exception, using its message or its type when it has none.
     */
    public static Response error(Throwable error) {
        String message = error.getMessage();
        return error(message == null || message.isBlank() ? error.getClass().getSimpleName() : message);
    }

    public static Response fromMap(Map<String, ?> raw) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(SUCCESS, Boolean.TRUE.equals(raw.get(SUCCESS)));
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            if (!SUCCESS.equals(entry.getKey())) {
                fields.put(entry.getKey(), entry.getValue());
            }
        }
        return new Response(fields);
    }

    public Response with(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (SUCCESS.equals(key)) {
            throw new IllegalArgumentException("success flag is fixed at construction");
        }
        fields.put(key, value);
        return this;
    }

    public boolean success() {
        return Boolean.TRUE.equals(fields.get(SUCCESS));
    }

    public Optional<String> error() {
        Object value = fields.get(ERROR);
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }

    public Optional<String> message() {
        Object value = fields.get(MESSAGE);
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }

    public Object get(String key) {
        return fields.get(key);
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Response other)) {
            return false;
        }
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Response" + fields;
    }
}
