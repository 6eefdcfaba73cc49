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
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@code runner-status [NAME] [--json]}: state, duration, tokens, tool usage and cost of agent runs.
 */
public final class RunnerStatusCommand extends ArgumentCommand<RunnerStatusCommand.Arguments> {
    static final int PROMPT_PREVIEW_CHARS = 100;

    public RunnerStatusCommand() {
        super("runner-status");
    }

    @Command(name = "runner-status", description = "Show detailed status of agent runner processes")
    static final class Arguments {
        @Parameters(index = "0", arity = "0..1", paramLabel = "NAME",
                description = "Only runners whose name starts with NAME")
        String name;

        @Option(names = {"--json"}, description = "Return raw data only")
        boolean json;
    }

    @Override
    public String help() {
        return "Show detailed status of agent runner processes";
    }

    @Override
    protected Arguments newArguments() {
        return new Arguments();
    }

    @Override
    protected Response execute(Supervisor supervisor, Arguments arguments) {
        ProcessTable table = supervisor.processes();
        Instant now = Instant.now();
        Map<String, Map<String, Object>> runners = new TreeMap<>();
        for (ProcessRecord record : table.listAll(ProcessKind.AGENT.matcher())) {
            if (arguments.name != null && !record.name().startsWith(arguments.name)) {
                continue;
            }
            runners.put(record.name(), describe(table, record, now));
        }
        if (arguments.json) {
            return Response.ok().with("runners", runners);
        }
        if (runners.isEmpty()) {
            return Response.ok("No agent runners found").with("runners", runners);
        }
        List<String> lines = new ArrayList<>();
        lines.add("=== Agent Runner Status ===");
        lines.add("");
        runners.forEach((name, view) -> render(lines, name, view));
        return Response.ok()
                .with(Response.OUTPUT, String.join("\n", lines).stripTrailing())
                .with("runners", runners);
    }

    private static Map<String, Object> describe(ProcessTable table, ProcessRecord record, Instant now) {
        Map<String, Object> meta = record.metadata();
        Instant started = Durations.parseOr(meta.get("started"), record.startedAt());
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("pid", record.pid());
        Instant end = now;
        if (record.isAlive()) {
            view.put("status", "running");
            view.put("return_code", null);
        } else {
            int exitCode = record.process().exitValue();
            ProcessRecord current = table.recordExit(record.name(), exitCode).orElse(record);
            meta = current.metadata();
            end = Durations.parseOr(meta.get(ProcessTable.ENDED), now);
            view.put("status", meta.getOrDefault("agent_status", "stopped"));
            view.put("return_code", exitCode);
        }
        view.put("duration", Durations.format(Durations.between(started, end)));
        view.put("started", started.toString());
        view.put("prompt", meta.getOrDefault("prompt", "N/A"));
        view.put("context_file", meta.get("context_file"));
        view.put("report_file", meta.get("report_file"));
        view.put("model", meta.getOrDefault("model", "N/A"));
        view.put("tool_counts", meta.getOrDefault("tool_counts", Map.of()));
        view.put("total_tokens", meta.getOrDefault("total_tokens", 0L));
        view.put("input_tokens", meta.getOrDefault("total_input_tokens", 0L));
        view.put("output_tokens", meta.getOrDefault("total_output_tokens", 0L));
        view.put("cost_usd", meta.getOrDefault("cost_usd", 0.0));
        view.put("is_error", meta.getOrDefault("is_error", false));
        view.put("stream_log", meta.get("stream_log"));
        view.put("report_log", meta.get("report_log"));
        return view;
    }

    private static void render(List<String> lines, String name, Map<String, Object> view) {
        boolean running = "running".equals(view.get("status"));
        boolean error = Boolean.TRUE.equals(view.get("is_error"));
        lines.add((running ? "● " : "○ ") + name + (error ? " [ERROR]" : ""));
        lines.add("  Status: " + view.get("status") + " (PID: " + view.get("pid") + ")");
        lines.add("  Duration: " + view.get("duration"));
        lines.add("  Model: " + view.get("model"));
        lines.add("  Prompt: " + preview(String.valueOf(view.get("prompt"))));
        if (view.get("context_file") != null) {
            lines.add("  Context: " + view.get("context_file"));
        }
        if (view.get("report_file") != null) {
            lines.add("  Report: " + view.get("report_file"));
        }
        if (view.get("tool_counts") instanceof Map<?, ?> tools && !tools.isEmpty()) {
            lines.add("  Tools: " + formatToolCounts(tools));
        }
        long total = asLong(view.get("total_tokens"));
        if (total > 0) {
            lines.add(String.format(Locale.ROOT, "  Tokens: %,d (in: %,d, out: %,d)",
                    total, asLong(view.get("input_tokens")), asLong(view.get("output_tokens"))));
        }
        double cost = view.get("cost_usd") instanceof Number n ? n.doubleValue() : 0.0;
        if (cost > 0) {
            lines.add(String.format(Locale.ROOT, "  Cost: $%.4f", cost));
        }
        if (view.get("stream_log") != null) {
            lines.add("  Stream log: " + Path.of(view.get("stream_log").toString()).getFileName());
        }
        if (view.get("report_log") != null) {
            lines.add("  Report log: " + Path.of(view.get("report_log").toString()).getFileName());
        }
        lines.add("");
    }

    static String formatToolCounts(Map<?, ?> counts) {
        if (counts.isEmpty()) {
            return "none";
        }
        Map<String, Object> sorted = new TreeMap<>();
        counts.forEach((tool, count) -> sorted.put(String.valueOf(tool), count));
        List<String> items = new ArrayList<>();
        sorted.forEach((tool, count) -> items.add(count + " " + tool));
        return String.join(", ", items);
    }

    private static String preview(String prompt) {
        String text = prompt.length() > PROMPT_PREVIEW_CHARS
                ? prompt.substring(0, PROMPT_PREVIEW_CHARS) + "..."
                : prompt;
        return text.replace('\n', ' ');
    }

    private static long asLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
