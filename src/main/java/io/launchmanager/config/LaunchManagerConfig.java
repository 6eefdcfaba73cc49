package io.launchmanager.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.launchmanager.command.ConflictPolicy;
import io.launchmanager.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

public final class LaunchManagerConfig {
    private static final Logger logger = LogManager.getLogger(LaunchManagerConfig.class);

    public static final String CONFIG_FILE_NAME = "config.json";
    public static final String DEFAULT_SOCKET_PATH = "launch_manager.sock";
    public static final double DEFAULT_ACCEPT_TIMEOUT_SECONDS = 1.0;
    public static final long DEFAULT_DETECT_TIMEOUT_MS = 100L;
    public static final long DEFAULT_READ_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_MAX_MESSAGE_BYTES = 10_000_000L;
    // A frame must fit in one byte array.
    public static final long MAX_MESSAGE_BYTES_LIMIT = Integer.MAX_VALUE - 8L;
    public static final long DEFAULT_TERMINATION_TIMEOUT_SECONDS = 5L;
    public static final String DEFAULT_COMMANDS_DIR = "commands";
    public static final String DEFAULT_PID_FILE = ".pid";
    public static final String DEFAULT_LOGS_DIR = "logs";
    public static final String DEFAULT_LAUNCHER_MARKER = "launch.sh";
    public static final String DEFAULT_AGENT_EXECUTABLE = "claude";

    private final Path home;
    private final Path socketPath;
    private final Duration acceptTimeout;
    private final Duration detectTimeout;
    private final Duration readTimeout;
    private final long maxMessageBytes;
    private final Duration terminationTimeout;
    private final Path commandsDir;
    private final ConflictPolicy conflictPolicy;
    private final Path pidFile;
    private final Path logsDir;
    private final String launcherMarker;
    private final String agentExecutable;
    private final boolean agentSkipPermissions;

    private LaunchManagerConfig(
            Path home,
            Path socketPath,
            Duration acceptTimeout,
            Duration detectTimeout,
            Duration readTimeout,
            long maxMessageBytes,
            Duration terminationTimeout,
            Path commandsDir,
            ConflictPolicy conflictPolicy,
            Path pidFile,
            Path logsDir,
            String launcherMarker,
            String agentExecutable,
            boolean agentSkipPermissions
    ) {
        this.home = home;
        this.socketPath = socketPath;
        this.acceptTimeout = acceptTimeout;
        this.detectTimeout = detectTimeout;
        this.readTimeout = readTimeout;
        this.maxMessageBytes = maxMessageBytes;
        this.terminationTimeout = terminationTimeout;
        this.commandsDir = commandsDir;
        this.conflictPolicy = conflictPolicy;
        this.pidFile = pidFile;
        this.logsDir = logsDir;
        this.launcherMarker = launcherMarker;
        this.agentExecutable = agentExecutable;
        this.agentSkipPermissions = agentSkipPermissions;
    }

    public static LaunchManagerConfig defaults(Path home) {
        return fromFile(null, normalizeHome(home));
    }

    /**
     * Loads {@code config.json} from the home directory. A missing file yields the defaults; an
     * unreadable or corrupt file is logged and also yields the defaults.
     */
    public static LaunchManagerConfig load(Path home) {
        Path base = normalizeHome(home);
        Path cfg = base.resolve(CONFIG_FILE_NAME);
        if (!Files.exists(cfg)) {
            return fromFile(null, base);
        }
        try {
            return fromFile(read(cfg), base);
        } catch (ConfigException e) {
            logger.warn("Falling back to default configuration: {}", e.getMessage());
            return fromFile(null, base);
        }
    }

    public static LaunchManagerConfig fromHome(String home) {
        return load(home == null || home.isBlank() ? Paths.get(".") : Paths.get(home));
    }

    private static ConfigFile read(Path cfg) {
        try {
            ConfigFile file = Jsons.mapper().readValue(cfg.toFile(), ConfigFile.class);
            if (file == null) {
                throw new ConfigException("Configuration is empty: " + cfg);
            }
            return file;
        } catch (IOException e) {
            throw new ConfigException("Failed to load configuration: " + cfg, e);
        }
    }

    private static Path normalizeHome(Path home) {
        return (home == null ? Paths.get(".") : home).toAbsolutePath().normalize();
    }

    private static LaunchManagerConfig fromFile(ConfigFile file, Path home) {
        SocketSection socket = file == null || file.socket() == null ? SocketSection.EMPTY : file.socket();
        ProtocolSection protocol = file == null || file.protocol() == null ? ProtocolSection.EMPTY : file.protocol();
        ProcessSection process = file == null || file.process() == null ? ProcessSection.EMPTY : file.process();
        CommandsSection commands = file == null || file.commands() == null ? CommandsSection.EMPTY : file.commands();
        LauncherSection launcher = file == null || file.launcher() == null ? LauncherSection.EMPTY : file.launcher();
        AgentSection agent = file == null || file.agent() == null ? AgentSection.EMPTY : file.agent();

        double acceptSeconds = sanitizeDouble(socket.timeout(), DEFAULT_ACCEPT_TIMEOUT_SECONDS, 0.01);
        long detectMs = sanitizeLong(socket.detectTimeoutMs(), DEFAULT_DETECT_TIMEOUT_MS, 1L);
        long readMs = sanitizeLong(socket.readTimeoutMs(), DEFAULT_READ_TIMEOUT_MS, detectMs);
        long maxBytes = Math.min(
                sanitizeLong(protocol.maxMessageBytes(), DEFAULT_MAX_MESSAGE_BYTES, 1_024L),
                MAX_MESSAGE_BYTES_LIMIT
        );
        double terminationSeconds = sanitizeDouble(
                process.terminationTimeout(),
                DEFAULT_TERMINATION_TIMEOUT_SECONDS,
                0.0
        );
        return new LaunchManagerConfig(
                home,
                resolve(home, socket.path(), DEFAULT_SOCKET_PATH),
                Duration.ofMillis(Math.round(acceptSeconds * 1000.0)),
                Duration.ofMillis(detectMs),
                Duration.ofMillis(readMs),
                maxBytes,
                Duration.ofMillis(Math.round(terminationSeconds * 1000.0)),
                resolve(home, commands.dir(), DEFAULT_COMMANDS_DIR),
                ConflictPolicy.fromString(commands.onConflict()),
                resolve(home, file == null ? null : file.pidFile(), DEFAULT_PID_FILE),
                resolve(home, file == null ? null : file.logsDir(), DEFAULT_LOGS_DIR),
                sanitizeString(launcher.marker(), DEFAULT_LAUNCHER_MARKER),
                sanitizeString(agent.executable(), DEFAULT_AGENT_EXECUTABLE),
                agent.skipPermissions() == null || agent.skipPermissions()
        );
    }

    private static Path resolve(Path home, String raw, String fallback) {
        String value = sanitizeString(raw, fallback);
        return home.resolve(value).normalize();
    }

    private static String sanitizeString(String raw, String fallback) {
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static double sanitizeDouble(Double raw, double fallback, double min) {
        if (raw == null || raw.isNaN() || raw.isInfinite()) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    public Path home() {
        return home;
    }

    public Path socketPath() {
        return socketPath;
    }

    public Duration acceptTimeout() {
        return acceptTimeout;
    }

    public Duration detectTimeout() {
        return detectTimeout;
    }

    public Duration readTimeout() {
        return readTimeout;
    }

    public long maxMessageBytes() {
        return maxMessageBytes;
    }

    public Duration terminationTimeout() {
        return terminationTimeout;
    }

    public Path commandsDir() {
        return commandsDir;
    }

    public ConflictPolicy conflictPolicy() {
        return conflictPolicy;
    }

    public Path pidFile() {
        return pidFile;
    }

    public Path logsDir() {
        return logsDir;
    }

    public String launcherMarker() {
        return launcherMarker;
    }

    public String agentExecutable() {
        return agentExecutable;
    }

    public boolean agentSkipPermissions() {
        return agentSkipPermissions;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ConfigFile(
            SocketSection socket,
            ProtocolSection protocol,
            ProcessSection process,
            CommandsSection commands,
            String pidFile,
            String logsDir,
            LauncherSection launcher,
            AgentSection agent
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SocketSection(String path, Double timeout, Long detectTimeoutMs, Long readTimeoutMs) {
        static final SocketSection EMPTY = new SocketSection(null, null, null, null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ProtocolSection(Long maxMessageBytes) {
        static final ProtocolSection EMPTY = new ProtocolSection(null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ProcessSection(@JsonProperty("termination_timeout") Double terminationTimeout) {
        static final ProcessSection EMPTY = new ProcessSection(null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record CommandsSection(String dir, String onConflict) {
        static final CommandsSection EMPTY = new CommandsSection(null, null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record LauncherSection(String marker) {
        static final LauncherSection EMPTY = new LauncherSection(null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record AgentSection(String executable, Boolean skipPermissions) {
        static final AgentSection EMPTY = new AgentSection(null, null);
    }
}
