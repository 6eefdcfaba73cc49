package io.launchmanager.plugins;

import io.launchmanager.process.ProcessNotFoundException;
import io.launchmanager.process.ProcessTable;
import io.launchmanager.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Background side of one agent run: copies stdout and stderr into the stream log, feeds stdout
 * through {@link AgentStreamStats} into the process table, and writes the JSON report once the
 * process exits.
 */
final class AgentSession {
    private static final Logger logger = LogManager.getLogger(AgentSession.class);
    private static final long READER_JOIN_MS = 2_000L;

    private final ProcessTable table;
    private final String processName;
    private final Process process;
    private final Path streamLog;
    private final Path reportLog;
    private final Map<String, Object> report;
    private final AgentStreamStats stats = new AgentStreamStats();
    private final List<String> stderrLines = new ArrayList<>();
    private BufferedWriter writer;

    AgentSession(
            ProcessTable table,
            String processName,
            Process process,
            Path streamLog,
            Path reportLog,
            Map<String, Object> report
    ) {
        this.table = table;
        this.processName = processName;
        this.process = process;
        this.streamLog = streamLog;
        this.reportLog = reportLog;
        this.report = new LinkedHashMap<>(report);
    }

    void start(String commandLine) throws IOException {
        writer = Files.newBufferedWriter(streamLog, StandardCharsets.UTF_8);
        writeLog("[DEBUG] Command: " + commandLine);
        writeLog("[DEBUG] Started at: " + Instant.now());

        Thread stdout = daemon("agent-stdout-" + processName, () -> readStdout(process.getInputStream()));
        Thread stderr = daemon("agent-stderr-" + processName, () -> readStderr(process.getErrorStream()));
        stdout.start();
        stderr.start();
        daemon("agent-monitor-" + processName, () -> monitor(stdout, stderr)).start();
    }

    AgentStreamStats stats() {
        return stats;
    }

    private void readStdout(InputStream in) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                writeLog(line);
                if (stats.accept(line)) {
                    publish();
                }
            }
        } catch (IOException e) {
            logger.warn("Stream reader for {} failed: {}", processName, e.getMessage());
            stats.markFailed(e.getMessage());
        } finally {
            publish();
        }
    }

    private void readStderr(InputStream in) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                writeLog("[STDERR] " + line);
                synchronized (stderrLines) {
                    stderrLines.add(line);
                }
            }
        } catch (IOException e) {
            logger.debug("Stderr reader for {} stopped: {}", processName, e.getMessage());
        }
    }

    private void monitor(Thread stdout, Thread stderr) {
        int exitCode;
        try {
            exitCode = process.waitFor();
            stdout.join(READER_JOIN_MS);
            stderr.join(READER_JOIN_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        closeLog();
        table.recordExit(processName, exitCode);

        Map<String, Object> finalReport = new LinkedHashMap<>(report);
        finalReport.putAll(stats.snapshot());
        if (stats.toolsAvailable() != null && !stats.toolsAvailable().isMissingNode()) {
            finalReport.put("tools_available", stats.toolsAvailable());
        }
        synchronized (stderrLines) {
            if (!stderrLines.isEmpty()) {
                finalReport.put("stderr", String.join("\n", stderrLines));
            }
        }
        finalReport.put("ended", Instant.now().toString());
        finalReport.put("return_code", exitCode);
        try {
            Files.writeString(reportLog, Jsons.toJson(finalReport), StandardCharsets.UTF_8);
            logger.info("Agent {} exited with {}, report at {}", processName, exitCode, reportLog);
        } catch (IOException e) {
            logger.error("Failed to write report {}", reportLog, e);
        }
    }

    private void publish() {
        try {
            table.updateMetadata(processName, stats.snapshot());
        } catch (ProcessNotFoundException e) {
            logger.debug("Agent {} no longer tracked", processName);
        }
    }

    private synchronized void writeLog(String line) {
        if (writer == null) {
            return;
        }
        try {
            writer.write(line);
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            logger.warn("Stream log {} is not writable: {}", streamLog, e.getMessage());
        }
    }

    private synchronized void closeLog() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            logger.debug("Failed to close {}: {}", streamLog, e.getMessage());
        }
        writer = null;
    }

    private static Thread daemon(String name, Runnable body) {
        Thread thread = new Thread(body, name);
        thread.setDaemon(true);
        return thread;
    }
}
