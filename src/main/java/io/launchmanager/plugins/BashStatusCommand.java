package io.launchmanager.plugins;

import io.launchmanager.process.ProcessKind;
import io.launchmanager.process.ProcessRecord;
import io.launchmanager.process.ProcessTable;
import io.launchmanager.protocol.Response;
import io.launchmanager.server.Supervisor;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@code bash-status [NAME] [--all]}: running/exited state, durations and exit codes of shell
 * processes, or of every managed process with {@code --all}.
 */
public final class BashStatusCommand extends ArgumentCommand<BashStatusCommand.Arguments> {
    private final OutputBuffers buffers;

    public BashStatusCommand(OutputBuffers buffers) {
        super("bash-status");
        this.buffers = buffers;
    }

    @Command(name = "bash-status", description = "Check status of bash processes")
    static final class Arguments {
        @Parameters(index = "0", arity = "0..1", paramLabel = "NAME",
                description = "Name of the process (optional, shows all if omitted)")
        String name;

        @Option(names = {"--all", "-a"}, description = "Show all processes, not just bash")
        boolean all;
    }

    @Override
    public String help() {
        return "Check status of bash processes";
    }

    @Override
    protected Arguments newArguments() {
        return new Arguments();
    }

    @Override
    protected Response execute(Supervisor supervisor, Arguments arguments) {
        ProcessTable table = supervisor.processes();
        buffers.retainTracked(table);
        Instant now = Instant.now();
        Map<String, Map<String, Object>> status = new TreeMap<>();
        for (ProcessRecord record : table.listAll(arguments.all ? ProcessKind.any() : ProcessKind.SHELL.matcher())) {
            if (arguments.name != null && !arguments.name.equals(record.name())) {
                continue;
            }
            status.put(record.name(), describe(table, record, now));
        }

        String scope = arguments.all ? "" : "bash ";
        if (arguments.name != null && status.isEmpty()) {
            return Response.error("No " + scope + "process found with name: " + arguments.name);
        }
        if (status.isEmpty()) {
            return Response.ok().with(Response.OUTPUT, "No " + scope + "processes found");
        }

        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, Map<String, Object>> entry : status.entrySet()) {
            Map<String, Object> view = entry.getValue();
            if ("running".equals(view.get("status"))) {
                lines.add("[" + entry.getKey() + "] RUNNING (pid: " + view.get("pid") + ", " + view.get("duration") + ")");
            } else {
                int exitCode = (Integer) view.get("exit_code");
                String outcome = exitCode == 0 ? "SUCCESS" : "FAILED (" + exitCode + ")";
                lines.add("[" + entry.getKey() + "] " + outcome + " (" + view.get("duration") + ")");
            }
            Object logFile = view.get("log_file");
            if (logFile != null) {
                lines.add("  Log: " + Path.of(logFile.toString()).getFileName());
            }
        }
        return Response.ok()
                .with(Response.OUTPUT, String.join("\n", lines))
                .with("processes", status);
    }

    private static Map<String, Object> describe(ProcessTable table, ProcessRecord record, Instant now) {
        Map<String, Object> view = new LinkedHashMap<>();
        Instant started = Durations.parseOr(record.metadata().get("started"), record.startedAt());
        if (record.isAlive()) {
            view.put("status", "running");
            view.put("pid", record.pid());
            view.put("command", record.metadata().get("command"));
            view.put("started", started.toString());
            view.put("duration", Durations.format(Durations.between(started, now)));
        } else {
            int exitCode = record.process().exitValue();
            ProcessRecord current = table.recordExit(record.name(), exitCode).orElse(record);
            Instant ended = Durations.parseOr(current.metadata().get(ProcessTable.ENDED), now);
            view.put("status", "exited");
            view.put("exit_code", exitCode);
            view.put("command", record.metadata().get("command"));
            view.put("started", started.toString());
            view.put("ended", ended.toString());
            view.put("duration", Durations.format(Durations.between(started, ended)));
        }
        view.put("base_name", record.metadata().getOrDefault("base_name", record.name()));
        view.put("log_file", record.metadata().get("log_file"));
        return view;
    }
}
