package io.launchmanager.plugins;

import io.launchmanager.config.LaunchManagerConfig;
import io.launchmanager.process.DuplicateProcessNameException;
import io.launchmanager.process.ProcessKind;
import io.launchmanager.process.ProcessNotFoundException;
import io.launchmanager.process.ProcessStartException;
import io.launchmanager.process.ProcessTable;
import io.launchmanager.protocol.Response;
import io.launchmanager.server.Supervisor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code bash '<command>' [--name NAME] [--no-log]}: runs a shell command as a managed process.
 *
 * <p>Output is appended to {@code logs/bash/<timestamp>_<name>.log}. With {@code --no-log} it is
 * kept in an {@link OutputBuffers} ring buffer instead, filled by a daemon reader thread.
 */
public final class BashCommand extends ArgumentCommand<BashCommand.Arguments> {
    private static final Logger logger = LogManager.getLogger(BashCommand.class);

    static final DateTimeFormatter LOG_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    static final int NAME_PREFIX_CHARS = 10;

    private final OutputBuffers buffers;

    public BashCommand(OutputBuffers buffers) {
        super("bash");
        this.buffers = buffers;
    }

    @Command(name = "bash", description = "Execute a bash command as a managed process")
    static final class Arguments {
        @Parameters(index = "0", paramLabel = "COMMAND", description = "Bash command to execute")
        String command;

        @Option(names = {"--name", "-n"}, description = "Process name (auto-generated if not specified)")
        String name;

        @Option(names = {"--no-log"}, description = "Keep output in memory instead of a log file")
        boolean noLog;
    }

    @Override
    public String help() {
        return "Execute a bash command as a managed process";
    }

    @Override
    protected Arguments newArguments() {
        return new Arguments();
    }

    @Override
    protected Response execute(Supervisor supervisor, Arguments arguments) throws IOException {
        if (arguments.command == null || arguments.command.isBlank()) {
            return Response.error("Command cannot be empty");
        }
        LaunchManagerConfig config = supervisor.config();
        String startedAt = Instant.now().toString();
        String timestamp = LOG_TIMESTAMP.format(LocalDateTime.now());

        Path logDir = config.logsDir().resolve("bash");
        Path tempLog = null;
        ProcessBuilder builder = new ProcessBuilder("bash", "-c", arguments.command)
                .directory(config.home().toFile())
                .redirectErrorStream(true);
        if (!arguments.noLog) {
            Files.createDirectories(logDir);
            tempLog = Files.createTempFile(logDir, timestamp + "_", ".log");
            Files.writeString(tempLog, header(arguments.command, startedAt), StandardCharsets.UTF_8);
            builder.redirectOutput(ProcessBuilder.Redirect.appendTo(tempLog.toFile()));
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            if (tempLog != null) {
                Files.deleteIfExists(tempLog);
            }
            throw new ProcessStartException("Failed to start bash command: " + e.getMessage(), e);
        }
        process.getOutputStream().close();

        String baseName = arguments.name != null && !arguments.name.isBlank()
                ? arguments.name.strip()
                : defaultBaseName(arguments.command);
        String processName = baseName + "-" + process.pid();

        Path logFile = null;
        if (tempLog != null) {
            logFile = logDir.resolve(timestamp + "_" + processName + ".log");
            try {
                Files.move(tempLog, logFile);
            } catch (IOException e) {
                logger.warn("Could not rename {} to {}: {}", tempLog, logFile, e.getMessage());
                logFile = tempLog;
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("command", arguments.command);
        metadata.put("started", startedAt);
        metadata.put("pid", process.pid());
        metadata.put("base_name", baseName);
        if (logFile != null) {
            metadata.put("log_file", logFile.toString());
        }
        try {
            supervisor.processes().register(processName, process, ProcessKind.SHELL, metadata);
        } catch (DuplicateProcessNameException e) {
            process.destroyForcibly();
            logger.warn("Killed pid {}: {}", process.pid(), e.getMessage());
            return Response.error(e);
        }
        if (arguments.noLog) {
            startOutputReader(supervisor.processes(), processName, process);
        }
        logger.info("Started bash process {} (pid {}): {}", processName, process.pid(), arguments.command);

        String message = "Started bash process \"" + processName + "\" with PID " + process.pid();
        if (logFile != null) {
            message = message + "\nLog file: " + logFile.getFileName();
        }
        return Response.ok(message)
                .with("pid", process.pid())
                .with("name", processName);
    }

    /**
     * {@code bash-} plus the first word's basename, cut to ten characters.
     */
    static String defaultBaseName(String command) {
        String firstWord = command.strip().split("\\s+", 2)[0];
        String base = firstWord.substring(firstWord.lastIndexOf('/') + 1);
        if (base.length() > NAME_PREFIX_CHARS) {
            base = base.substring(0, NAME_PREFIX_CHARS);
        }
        return "bash-" + base;
    }

    private static String header(String command, String startedAt) {
        return "=== Command: " + command + " ===\n"
                + "Started: " + startedAt + "\n"
                + "=".repeat(50) + "\n";
    }

    private void startOutputReader(ProcessTable table, String processName, Process process) {
        buffers.retainTracked(table);
        LineBuffer buffer = buffers.open(processName);
        Thread reader = new Thread(() -> {
            boolean tracked = true;
            try (BufferedReader in = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = in.readLine()) != null) {
                    buffer.append(line);
                    if (tracked) {
                        tracked = publish(table, processName, buffer.totalLines(), line);
                    }
                }
            } catch (IOException e) {
                logger.debug("Output reader for {} stopped: {}", processName, e.getMessage());
            }
        }, "bash-output-" + processName);
        reader.setDaemon(true);
        reader.start();
    }

    private static boolean publish(ProcessTable table, String processName, long lines, String last) {
        try {
            table.updateMetadata(processName, Map.of(
                    "output_lines", lines,
                    "last_output", last
            ));
            return true;
        } catch (ProcessNotFoundException e) {
            return false;
        }
    }
}
