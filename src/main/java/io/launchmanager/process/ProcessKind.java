package io.launchmanager.process;

import java.util.Locale;
import java.util.function.Predicate;

/**
 * Tag separating shell-command processes from agent processes. Plugins may mint their own kinds.
 */
public record ProcessKind(String id) {
    public static final ProcessKind SHELL = new ProcessKind("bash");
    public static final ProcessKind AGENT = new ProcessKind("agent");

    public ProcessKind {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("process kind cannot be empty");
        }
        id = id.trim().toLowerCase(Locale.ROOT);
    }

    public static ProcessKind of(String id) {
        return new ProcessKind(id);
    }

    public Predicate<ProcessRecord> matcher() {
        return record -> equals(record.kind());
    }

    public static Predicate<ProcessRecord> any() {
        return record -> true;
    }

    @Override
    public String toString() {
        return id;
    }
}
