package io.launchmanager.config;

import io.launchmanager.TestFiles;
import io.launchmanager.command.ConflictPolicy;
import io.launchmanager.protocol.ProtocolSettings;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class LaunchManagerConfigTest {

    @Test
    void missingFileYieldsDefaultsUnderHome() throws Exception {
        Path home = TestFiles.shortTempDir();
        try {
            LaunchManagerConfig config = LaunchManagerConfig.load(home);
            Path base = home.toAbsolutePath().normalize();
            assertEquals(base.resolve("launch_manager.sock"), config.socketPath());
            assertEquals(Duration.ofSeconds(1), config.acceptTimeout());
            assertEquals(Duration.ofMillis(100), config.detectTimeout());
            assertEquals(Duration.ofSeconds(30), config.readTimeout());
            assertEquals(10_000_000L, config.maxMessageBytes());
            assertEquals(Duration.ofSeconds(5), config.terminationTimeout());
            assertEquals(base.resolve("commands"), config.commandsDir());
            assertEquals(ConflictPolicy.OVERRIDE, config.conflictPolicy());
            assertEquals(base.resolve(".pid"), config.pidFile());
            assertEquals(base.resolve("logs"), config.logsDir());
            assertEquals("launch.sh", config.launcherMarker());
            assertEquals("claude", config.agentExecutable());
            assertTrue(config.agentSkipPermissions());
        } finally {
            TestFiles.deleteRecursively(home);
        }
    }

    @Test
    void fileValuesOverrideDefaultsAndUnknownKeysAreIgnored() throws Exception {
        Path home = TestFiles.shortTempDir();
        try {
            Files.writeString(home.resolve("config.json"), """
                    {
                      "socket": {"path": "run/lm.sock", "timeout": 0.25, "detectTimeoutMs": 50, "readTimeoutMs": 2000},
                      "protocol": {"maxMessageBytes": 4096},
                      "process": {"termination_timeout": 1.5},
                      "commands": {"dir": "plugins", "onConflict": "reject"},
                      "pidFile": "state/manager.pid",
                      "logsDir": "var/log",
                      "launcher": {"marker": "start.sh"},
                      "agent": {"executable": "/opt/agent/bin/agent", "skipPermissions": false},
                      "somethingNew": {"x": 1}
                    }
                    """, StandardCharsets.UTF_8);

            LaunchManagerConfig config = LaunchManagerConfig.load(home);
            Path base = home.toAbsolutePath().normalize();
            assertEquals(base.resolve("run/lm.sock"), config.socketPath());
            assertEquals(Duration.ofMillis(250), config.acceptTimeout());
            assertEquals(Duration.ofMillis(50), config.detectTimeout());
            assertEquals(Duration.ofMillis(2000), config.readTimeout());
            assertEquals(4096L, config.maxMessageBytes());
            assertEquals(Duration.ofMillis(1500), config.terminationTimeout());
            assertEquals(base.resolve("plugins"), config.commandsDir());
            assertEquals(ConflictPolicy.REJECT, config.conflictPolicy());
            assertEquals(base.resolve("state/manager.pid"), config.pidFile());
            assertEquals(base.resolve("var/log"), config.logsDir());
            assertEquals("start.sh", config.launcherMarker());
            assertEquals("/opt/agent/bin/agent", config.agentExecutable());
            assertFalse(config.agentSkipPermissions());
        } finally {
            TestFiles.deleteRecursively(home);
        }
    }

    @Test
    void corruptFileFallsBackToDefaults() throws Exception {
        Path home = TestFiles.shortTempDir();
        try {
            Files.writeString(home.resolve("config.json"), "{ not json", StandardCharsets.UTF_8);
            LaunchManagerConfig config = LaunchManagerConfig.load(home);
            assertEquals(LaunchManagerConfig.defaults(home).socketPath(), config.socketPath());
            assertEquals(10_000_000L, config.maxMessageBytes());
        } finally {
            TestFiles.deleteRecursively(home);
        }
    }

    @Test
    void outOfRangeValuesAreClamped() throws Exception {
        Path home = TestFiles.shortTempDir();
        try {
            Files.writeString(home.resolve("config.json"), """
                    {"socket": {"timeout": -3, "detectTimeoutMs": 0, "readTimeoutMs": 0},
                     "protocol": {"maxMessageBytes": 10},
                     "process": {"termination_timeout": -1}}
                    """, StandardCharsets.UTF_8);
            LaunchManagerConfig config = LaunchManagerConfig.load(home);
            assertEquals(Duration.ofMillis(10), config.acceptTimeout());
            assertEquals(Duration.ofMillis(1), config.detectTimeout());
            assertEquals(Duration.ofMillis(1), config.readTimeout());
            assertEquals(1024L, config.maxMessageBytes());
            assertEquals(Duration.ZERO, config.terminationTimeout());
        } finally {
            TestFiles.deleteRecursively(home);
        }
    }

    @Test
    void messageCeilingNeverExceedsOneByteArray() throws Exception {
        Path home = TestFiles.shortTempDir();
        try {
            Files.writeString(home.resolve("config.json"),
                    "{\"protocol\": {\"maxMessageBytes\": 9999999999}}", StandardCharsets.UTF_8);
            LaunchManagerConfig config = LaunchManagerConfig.load(home);
            assertEquals(LaunchManagerConfig.MAX_MESSAGE_BYTES_LIMIT, config.maxMessageBytes());
            ProtocolSettings settings = ProtocolSettings.from(config);
            assertFalse(settings.acceptsFrameLength((1L << 32) + 100L));
            assertEquals(LaunchManagerConfig.MAX_MESSAGE_BYTES_LIMIT,
                    new ProtocolSettings(Duration.ofMillis(1), Duration.ofMillis(1), Long.MAX_VALUE).maxMessageBytes());
        } finally {
            TestFiles.deleteRecursively(home);
        }
    }
}
