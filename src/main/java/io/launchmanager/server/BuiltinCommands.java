package io.launchmanager.server;

import io.launchmanager.command.CommandEntry;
import io.launchmanager.command.CommandRegistry;
import io.launchmanager.process.ProcessKind;
import io.launchmanager.process.ProcessRecord;
import io.launchmanager.protocol.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Commands every supervisor exposes: status, list-commands, help, shutdown, restart-manager.
 * They are plain {@link io.launchmanager.command.Command} lambdas closing over the server, so
 * they go through the same dispatch path as plugins.
 */
final class BuiltinCommands {
    private static final Logger logger = LogManager.getLogger(BuiltinCommands.class);

    static final String MANUAL_RESTART_STEPS = """
            To manually restart the manager:
            1. Find the launcher process: ps aux | grep %s
            2. Send SIGHUP: kill -HUP <pid>
            3. Or restart the launcher in your terminal""";

    private BuiltinCommands() {
    }

    static void registerAll(SupervisorServer server, CommandRegistry registry) {
        registry.register("status", (supervisor, args) -> status(server),
                "Show status of all managed processes");
        registry.register("restart-manager", (supervisor, args) -> restartManager(server),
                "Restart the launch manager");
        registry.register("shutdown", (supervisor, args) -> shutdown(server),
                "Shutdown the launch manager and all processes");
        registry.register("list-commands", (supervisor, args) -> listCommands(registry),
                "List all available commands with descriptions");
        registry.register("help", (supervisor, args) -> help(registry, args),
                "Show help for a specific command");
    }

    static Response status(Supervisor server) {
        Map<String, Object> processes = new LinkedHashMap<>();
        for (ProcessRecord record : server.processes().listAll(ProcessKind.any())) {
            processes.put(record.name(), describe(server, record));
        }
        return Response.ok().with("processes", processes);
    }

    private static Map<String, Object> describe(Supervisor server, ProcessRecord record) {
        Map<String, Object> view = new LinkedHashMap<>();
        Object command = record.metadata().get("command");
        if (record.isAlive()) {
            view.put("status", "running");
            view.put("pid", record.pid());
            view.put("kind", record.kind().id());
            view.put("command", command);
            view.put("started", record.startedAt().toString());
            return view;
        }
        int exitCode = record.process().exitValue();
        view.put("status", "stopped");
        view.put("return_code", exitCode);
        view.put("kind", record.kind().id());
        view.put("command", command);
        server.processes().recordExit(record.name(), exitCode);
        return view;
    }

    static Response listCommands(CommandRegistry registry) {
        Map<String, String> commands = new TreeMap<>();
        for (CommandEntry entry : registry.entries()) {
            commands.put(entry.name(), entry.help());
        }
        return Response.ok().with("commands", commands);
    }

    static Response help(CommandRegistry registry, List<String> args) {
        if (args.isEmpty()) {
            return Response.error("Please specify a command name");
        }
        String name = args.get(0);
        Optional<CommandEntry> entry = registry.find(name);
        if (entry.isEmpty()) {
            return Response.error("Unknown command: " + name);
        }
        String text = entry.get().help();
        if (entry.get().schema().isPresent()) {
            try {
                String usage = new CommandLine(entry.get().schema().get())
                        .getUsageMessage(CommandLine.Help.Ansi.OFF);
                text = text + "\n\n" + usage;
            } catch (RuntimeException e) {
                logger.warn("Could not render usage for {}: {}", name, e.getMessage());
            }
        }
        return Response.ok()
                .with("command", name)
                .with("help", text);
    }

    static Response shutdown(Supervisor server) {
        int stopped = server.stopAll();
        server.requestShutdown();
        return Response.ok("Shutdown initiated").with("stopped", stopped);
    }

    static Response restartManager(Supervisor server) {
        String marker = server.config().launcherMarker();
        String manual = MANUAL_RESTART_STEPS.formatted(marker);
        Optional<ProcessHandle> parent = ProcessHandle.current().parent();
        String commandLine = parent.flatMap(p -> p.info().commandLine()).orElse("");
        if (parent.isEmpty() || !commandLine.contains(marker)) {
            return Response.error("Could not find " + marker + " parent process.\n\n" + manual);
        }
        long pid = parent.get().pid();
        try {
            Process kill = new ProcessBuilder("kill", "-HUP", Long.toString(pid))
                    .redirectErrorStream(true)
                    .start();
            if (!kill.waitFor(5, TimeUnit.SECONDS)) {
                kill.destroyForcibly();
                return Response.error("Timed out sending SIGHUP to " + pid + ".\n\n" + manual);
            }
            if (kill.exitValue() != 0) {
                String output = new String(kill.getInputStream().readAllBytes(), StandardCharsets.UTF_8).strip();
                return Response.error("Failed to send restart signal: " + output + "\n\n" + manual);
            }
        } catch (IOException e) {
            return Response.error("Failed to send restart signal: " + e.getMessage() + "\n\n" + manual);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Response.error("Interrupted while sending restart signal.\n\n" + manual);
        }
        logger.info("Sent SIGHUP to launcher {} for restart", pid);
        return Response.ok("Manager restart requested via SIGHUP. The manager should restart automatically.");
    }
}
