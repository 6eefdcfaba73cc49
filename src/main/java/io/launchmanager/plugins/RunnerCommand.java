package io.launchmanager.plugins;

import io.launchmanager.config.LaunchManagerConfig;
import io.launchmanager.process.DuplicateProcessNameException;
import io.launchmanager.process.ProcessKind;
import io.launchmanager.process.ProcessStartException;
import io.launchmanager.protocol.Response;
import io.launchmanager.server.Supervisor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code runner '<prompt>' [options]}: starts the configured coding agent in non-interactive
 * {@code stream-json} mode and tracks its progress in the process table.
 */
public final class RunnerCommand extends ArgumentCommand<RunnerCommand.Arguments> {
    private static final Logger logger = LogManager.getLogger(RunnerCommand.class);

    static final String DEFAULT_BASE_NAME = "runner";

    public RunnerCommand() {
        super("runner");
    }

    @Command(name = "runner", description = "Run a coding agent as a managed process")
    static final class Arguments {
        @Parameters(index = "0", paramLabel = "PROMPT", description = "Prompt to send to the agent")
        String prompt;

        @Option(names = {"--context-file", "-c"}, description = "File passed to the agent as context")
        String contextFile;

        @Option(names = {"--report", "-r"}, description = "Ask the agent to write a full report to this file")
        String report;

        @Option(names = {"--name", "-n"}, description = "Process name (auto-generated if not specified)")
        String name;

        @Option(names = {"--model", "-m"}, description = "Model to use")
        String model;

        @Option(names = {"--no-permissions"}, description = "Do not pass --dangerously-skip-permissions")
        boolean noPermissions;
    }

    @Override
    public String help() {
        return "Run a coding agent as a managed process";
    }

    @Override
    protected Arguments newArguments() {
        return new Arguments();
    }

    @Override
    protected Response execute(Supervisor supervisor, Arguments arguments) throws IOException {
        LaunchManagerConfig config = supervisor.config();
        String prompt = arguments.prompt;
        if (arguments.contextFile != null) {
            Path context = config.home().resolve(arguments.contextFile);
            if (!Files.isRegularFile(context)) {
                return Response.error("Context file not found: " + arguments.contextFile);
            }
            prompt = "@" + arguments.contextFile + "\n" + prompt;
        }
        if (arguments.report != null) {
            prompt = prompt + "\n\nPlease write a full report to " + arguments.report;
        }

        List<String> command = agentCommand(config, prompt, arguments);
        String commandLine = String.join(" ", command);
        Path logDir = config.logsDir().resolve("agent");
        Files.createDirectories(logDir);
        String timestamp = BashCommand.LOG_TIMESTAMP.format(LocalDateTime.now());
        String startedAt = Instant.now().toString();

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(config.home().toFile())
                    .start();
        } catch (IOException e) {
            throw new ProcessStartException("Failed to start " + config.agentExecutable() + ": " + e.getMessage(), e);
        }
        process.getOutputStream().close();

        String baseName = arguments.name != null && !arguments.name.isBlank()
                ? arguments.name.strip()
                : DEFAULT_BASE_NAME;
        String processName = baseName + "-" + process.pid();
        Path streamLog = logDir.resolve(timestamp + "_" + processName + "_stream.jsonl");
        Path reportLog = logDir.resolve(timestamp + "_" + processName + "_report.json");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("command", commandLine);
        metadata.put("started", startedAt);
        metadata.put("pid", process.pid());
        metadata.put("prompt", arguments.prompt);
        metadata.put("context_file", arguments.contextFile);
        metadata.put("report_file", arguments.report);
        metadata.put("model", arguments.model);
        metadata.put("stream_log", streamLog.toString());
        metadata.put("report_log", reportLog.toString());
        metadata.values().removeIf(value -> value == null);

        Map<String, Object> report = new LinkedHashMap<>(metadata);
        report.put("process_name", processName);

        try {
            supervisor.processes().register(processName, process, ProcessKind.AGENT, metadata);
        } catch (DuplicateProcessNameException e) {
            process.destroyForcibly();
            logger.warn("Killed pid {}: {}", process.pid(), e.getMessage());
            return Response.error(e);
        }
        try {
            new AgentSession(supervisor.processes(), processName, process, streamLog, reportLog, report)
                    .start(commandLine);
        } catch (IOException e) {
            logger.error("Could not open stream log for {}, stopping it", processName, e);
            supervisor.stopProcess(processName);
            throw e;
        }
        logger.info("Started agent {} (pid {})", processName, process.pid());

        return Response.ok("Started agent runner \"" + processName + "\" with PID " + process.pid()
                        + "\nStream log: " + streamLog.getFileName()
                        + "\nReport log: " + reportLog.getFileName())
                .with("pid", process.pid())
                .with("name", processName);
    }

    static List<String> agentCommand(LaunchManagerConfig config, String prompt, Arguments arguments) {
        List<String> command = new ArrayList<>(List.of(
                config.agentExecutable(), "-p", prompt, "--verbose", "--output-format", "stream-json"));
        if (arguments.model != null && !arguments.model.isBlank()) {
            command.add("--model");
            command.add(arguments.model);
        }
        if (config.agentSkipPermissions() && !arguments.noPermissions) {
            command.add("--dangerously-skip-permissions");
        }
        return command;
    }
}
