package io.launchmanager.plugins;

import io.launchmanager.process.ProcessRecord;
import io.launchmanager.protocol.Response;
import io.launchmanager.server.Supervisor;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * {@code bash-watch NAME [--lines N]}: recent output of a shell process, from its log file or
 * from its in-memory buffer.
 */
public final class BashWatchCommand extends ArgumentCommand<BashWatchCommand.Arguments> {
    static final int DEFAULT_LINES = 50;

    private final OutputBuffers buffers;

    public BashWatchCommand(OutputBuffers buffers) {
        super("bash-watch");
        this.buffers = buffers;
    }

    @Command(name = "bash-watch", description = "Watch output from a bash process")
    static final class Arguments {
        @Parameters(index = "0", paramLabel = "NAME", description = "Name of the process to watch")
        String name;

        @Option(names = {"--lines", "-l"}, defaultValue = "50",
                description = "Number of lines to show (default: ${DEFAULT-VALUE})")
        int lines = DEFAULT_LINES;
    }

    @Override
    public String help() {
        return "Watch output from a bash process";
    }

    @Override
    protected Arguments newArguments() {
        return new Arguments();
    }

    @Override
    protected Response execute(Supervisor supervisor, Arguments arguments) throws IOException {
        Optional<ProcessRecord> found = supervisor.processes().get(arguments.name);
        if (found.isEmpty()) {
            return Response.error("Process \"" + arguments.name + "\" not found");
        }
        ProcessRecord record = found.get();
        List<String> lines = recentLines(record, Math.max(0, arguments.lines));

        StringBuilder output = new StringBuilder();
        if (!record.isAlive()) {
            output.append("Process \"").append(record.name())
                    .append("\" has stopped with return code ").append(record.process().exitValue());
            if (!lines.isEmpty()) {
                output.append('\n');
            }
        } else if (lines.isEmpty()) {
            output.append("No output yet from process \"").append(record.name()).append('"');
        }
        if (!lines.isEmpty()) {
            output.append("=== Output from ").append(record.name())
                    .append(" (last ").append(lines.size()).append(" lines) ===\n")
                    .append(String.join("\n", lines));
        }
        return Response.ok().with(Response.OUTPUT, output.toString());
    }

    private List<String> recentLines(ProcessRecord record, int count) throws IOException {
        Optional<String> logFile = record.metadataString("log_file");
        if (logFile.isPresent()) {
            return tail(Path.of(logFile.get()), count);
        }
        return buffers.find(record.name())
                .map(buffer -> buffer.tail(count))
                .orElse(List.of());
    }

    static List<String> tail(Path file, int count) throws IOException {
        if (count == 0 || !Files.exists(file)) {
            return List.of();
        }
        Deque<String> window = new ArrayDeque<>(Math.min(count, 1024));
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (window.size() == count) {
                    window.removeFirst();
                }
                window.addLast(line);
            }
        }
        return List.copyOf(window);
    }
}
