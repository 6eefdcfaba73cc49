package io.launchmanager.command;

import java.nio.file.Path;

public final class PluginLoadException extends RuntimeException {
    private final Path source;

    public PluginLoadException(Path source, String message) {
        super(message);
        this.source = source;
    }

    public PluginLoadException(Path source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public Path source() {
        return source;
    }
}
