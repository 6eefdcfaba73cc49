package io.launchmanager.server;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalLong;

/**
 * Plain-text file holding the decimal pid of the running supervisor. It only lets outside tools
 * tell whether an instance is alive; nothing is recovered from it.
 */
public final class PidFile {
    private static final Logger logger = LogManager.getLogger(PidFile.class);

    private final Path path;

    public PidFile(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    public void write(long pid) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, Long.toString(pid), StandardCharsets.UTF_8);
    }

    public void delete() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Failed to remove pid file {}: {}", path, e.getMessage());
        }
    }

    /**
     * Pid of a live supervisor, or empty. A file that is unreadable, unparseable or names a dead
     * process is stale and gets removed.
     */
    public OptionalLong readLivePid() {
        if (!Files.exists(path)) {
            return OptionalLong.empty();
        }
        long pid;
        try {
            String raw = Files.readString(path, StandardCharsets.UTF_8).strip();
            if (raw.isEmpty()) {
                return OptionalLong.empty();
            }
            pid = Long.parseLong(raw);
        } catch (IOException | NumberFormatException e) {
            logger.info("Removing unreadable pid file {}", path);
            delete();
            return OptionalLong.empty();
        }
        boolean alive = ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
        if (!alive) {
            logger.info("Removing stale pid file {} (pid {})", path, pid);
            delete();
            return OptionalLong.empty();
        }
        return OptionalLong.of(pid);
    }
}
