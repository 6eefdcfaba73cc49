package io.launchmanager.process;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable view of one managed process. {@link ProcessTable} replaces the whole record on every
 * metadata change, so a reader never observes a half-applied patch.
 */
public record ProcessRecord(
        String name,
        Process process,
        ProcessKind kind,
        Instant startedAt,
        Map<String, Object> metadata
) {
    public ProcessRecord {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata == null ? Map.of() : metadata));
    }

    public long pid() {
        return process.pid();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public OptionalInt exitCode() {
        if (process.isAlive()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(process.exitValue());
    }

    public Optional<String> metadataString(String key) {
        Object value = metadata.get(key);
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }

    ProcessRecord merge(Map<String, ?> patch) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        for (Map.Entry<String, ?> entry : patch.entrySet()) {
            if (entry.getValue() == null) {
                merged.remove(entry.getKey());
            } else {
                merged.put(entry.getKey(), entry.getValue());
            }
        }
        return new ProcessRecord(name, process, kind, startedAt, merged);
    }
}
