package io.launchmanager.plugins;

import com.fasterxml.jackson.databind.JsonNode;
import io.launchmanager.TestFiles;
import io.launchmanager.config.LaunchManagerConfig;
import io.launchmanager.process.ProcessKind;
import io.launchmanager.process.ProcessRecord;
import io.launchmanager.protocol.Request;
import io.launchmanager.protocol.Response;
import io.launchmanager.server.SupervisorServer;
import io.launchmanager.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class RunnerCommandsTest {
    private static final String FAKE_AGENT = """
            #!/bin/bash
            echo '{"type":"system","subtype":"init","session_id":"s-1","tools":["Bash","Read"]}'
            echo 'not json at all'
            echo '{"type":"assistant","session_id":"s-1","message":{"model":"m-1","content":[{"type":"tool_use","name":"Bash"},{"type":"text","text":"hi"}],"usage":{"input_tokens":10,"cache_creation_input_tokens":5,"cache_read_input_tokens":2,"output_tokens":7}}}'
            echo '{"type":"assistant","message":{"content":[{"type":"tool_use","name":"Read"},{"type":"tool_use","name":"Bash"}],"usage":{"input_tokens":1,"output_tokens":1}}}'
            echo "args: $*" >&2
            echo '{"type":"result","subtype":"success","result":"all done","cost_usd":0.25,"num_turns":3,"is_error":false}'
            """;

    private Path home;
    private SupervisorServer server;

    @BeforeEach
    void setUp() throws Exception {
        home = TestFiles.shortTempDir();
        Path agent = home.resolve("fake-agent.sh");
        Files.writeString(agent, FAKE_AGENT, StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(agent, PosixFilePermissions.fromString("rwxr-xr-x"));
        Files.writeString(home.resolve("config.json"),
                "{\"agent\": {\"executable\": \"" + agent + "\"}, \"process\": {\"termination_timeout\": 1}}",
                StandardCharsets.UTF_8);
        server = new SupervisorServer(LaunchManagerConfig.load(home));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.stopAll();
        TestFiles.deleteRecursively(home);
    }

    @Test
    void runnerTracksStreamAndWritesReport() throws Exception {
        Files.writeString(home.resolve("ctx.md"), "context", StandardCharsets.UTF_8);
        Response started = server.dispatch(Request.of("runner", "fix the bug",
                "--name", "job", "--model", "m-1", "-c", "ctx.md", "--report", "out.md"));
        assertTrue(started.success(), started.toString());
        String name = (String) started.get("name");
        assertEquals("job-" + started.get("pid"), name);

        ProcessRecord record = server.processes().require(name);
        assertEquals(ProcessKind.AGENT, record.kind());
        assertTrue(record.process().waitFor(5, TimeUnit.SECONDS));
        Path report = Path.of(record.metadataString("report_log").orElseThrow());
        awaitFile(report);

        Map<String, Object> meta = server.processes().require(name).metadata();
        assertEquals("s-1", meta.get("session_id"));
        assertEquals("m-1", meta.get("model"));
        assertEquals(Map.of("Bash", 2, "Read", 1), meta.get("tool_counts"));
        assertEquals(18L, meta.get("total_input_tokens"));
        assertEquals(8L, meta.get("total_output_tokens"));
        assertEquals(26L, meta.get("total_tokens"));
        assertEquals("success", meta.get("agent_status"));
        assertEquals("all done", meta.get("result"));
        assertEquals(0.25, meta.get("cost_usd"));
        assertEquals(3L, meta.get("num_turns"));
        assertEquals(false, meta.get("is_error"));

        JsonNode json = Jsons.mapper().readTree(report.toFile());
        assertEquals(0, json.path("return_code").asInt(-1));
        assertEquals(name, json.path("process_name").asText());
        assertEquals(26L, json.path("total_tokens").asLong());
        assertEquals("Read", json.path("tools_available").get(1).asText());
        String stderr = json.path("stderr").asText();
        assertTrue(stderr.contains("-p @ctx.md\nfix the bug\n\nPlease write a full report to out.md"), stderr);
        assertTrue(stderr.contains("--verbose --output-format stream-json --model m-1 --dangerously-skip-permissions"),
                stderr);

        String stream = Files.readString(Path.of(record.metadataString("stream_log").orElseThrow()));
        assertTrue(stream.contains("not json at all"));
        assertTrue(stream.contains("[STDERR] args: "));

        Response status = server.dispatch(Request.of("runner-status", "job"));
        String output = (String) status.get(Response.OUTPUT);
        assertTrue(output.contains("○ " + name), output);
        assertTrue(output.contains("  Status: success (PID: " + record.pid() + ")"), output);
        assertTrue(output.contains("  Tools: 2 Bash, 1 Read"), output);
        assertTrue(output.contains("  Tokens: 26 (in: 18, out: 8)"), output);
        assertTrue(output.contains("  Cost: $0.2500"), output);
        assertTrue(output.contains("  Context: ctx.md"), output);
    }

    @Test
    void noPermissionsFlagDropsSkipPermissions() throws Exception {
        Response started = server.dispatch(Request.of("runner", "hello", "--no-permissions"));
        String name = (String) started.get("name");
        assertTrue(name.startsWith("runner-"));
        ProcessRecord record = server.processes().require(name);
        assertFalse(record.metadataString("command").orElseThrow().contains("--dangerously-skip-permissions"));
        assertTrue(record.process().waitFor(5, TimeUnit.SECONDS));
        awaitFile(Path.of(record.metadataString("report_log").orElseThrow()));
    }

    @Test
    void missingContextFileIsRejectedBeforeStarting() {
        Response response = server.dispatch(Request.of("runner", "hello", "--context-file", "nope.txt"));
        assertEquals("Context file not found: nope.txt", response.error().orElseThrow());
        assertEquals(0, server.processes().size());
    }

    @Test
    void runnerStatusWithoutRunnersSaysSo() {
        Response response = server.dispatch(Request.of("runner-status"));
        assertEquals("No agent runners found", response.message().orElseThrow());
        Response json = server.dispatch(Request.of("runner-status", "--json"));
        assertEquals(Map.of(), json.get("runners"));
    }

    private static void awaitFile(Path file) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!Files.exists(file)) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("report not written: " + file);
            }
            Thread.sleep(20L);
        }
    }
}
