package io.launchmanager.cli;

import io.launchmanager.TestFiles;
import io.launchmanager.config.LaunchManagerConfig;
import io.launchmanager.server.SupervisorServer;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class LaunchManagerCommandTest {

    @Test
    void sendPassesUnknownOptionsThroughAsArguments() {
        LaunchManagerCommand root = new LaunchManagerCommand();
        CommandLine.ParseResult result = newCommandLine(root)
                .parseArgs("--home", "/tmp/x", "send", "--legacy", "bash-status", "--all");
        LaunchManagerCommand.SendCommand send =
                (LaunchManagerCommand.SendCommand) result.subcommand().commandSpec().userObject();
        assertEquals("/tmp/x", root.home);
        assertTrue(send.legacy);
        assertEquals("bash-status", send.command);
        assertEquals(List.of("--all"), send.args);
    }

    @Test
    void sendWithoutSupervisorFails() throws Exception {
        Path home = TestFiles.shortTempDir();
        try {
            assertEquals(1, newCommandLine(new LaunchManagerCommand())
                    .execute("--home", home.toString(), "send", "status"));
            assertEquals(1, newCommandLine(new LaunchManagerCommand())
                    .execute("--home", home.toString(), "pid"));
        } finally {
            TestFiles.deleteRecursively(home);
        }
    }

    @Test
    void sendPrintsTheSupervisorResponse() throws Exception {
        Path home = TestFiles.shortTempDir();
        SupervisorServer server = new SupervisorServer(LaunchManagerConfig.load(home));
        server.start();
        Thread serveThread = new Thread(server::serve, "cli-test-serve");
        serveThread.start();
        PrintStream original = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
            int framed = newCommandLine(new LaunchManagerCommand())
                    .execute("--home", home.toString(), "send", "status");
            int legacy = newCommandLine(new LaunchManagerCommand())
                    .execute("--home", home.toString(), "send", "--legacy", "nope");
            assertEquals(0, framed);
            assertEquals(1, legacy);
            String out = captured.toString(StandardCharsets.UTF_8);
            assertTrue(out.contains("\"success\" : true"), out);
            assertTrue(out.contains("\"error\" : \"Unknown command: nope\""), out);
        } finally {
            System.setOut(original);
            server.requestShutdown();
            server.awaitStopped(Duration.ofSeconds(5));
            serveThread.join(5_000L);
            TestFiles.deleteRecursively(home);
        }
    }

    private static CommandLine newCommandLine(LaunchManagerCommand root) {
        return new CommandLine(root).setUnmatchedOptionsArePositionalParams(true);
    }
}
