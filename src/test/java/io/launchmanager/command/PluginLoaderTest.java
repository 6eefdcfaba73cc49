package io.launchmanager.command;

import io.launchmanager.TestFiles;
import io.launchmanager.protocol.Response;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.jar.Attributes;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class PluginLoaderTest {

    @Test
    void jarNameMapsToCommandName() {
        assertEquals("bash-status", PluginLoader.commandNameFor(Path.of("commands/bash_status.jar")));
        assertEquals("echo", PluginLoader.commandNameFor(Path.of("echo.JAR")));
    }

    @Test
    void loadsCommandFromJarManifest() throws Exception {
        Path dir = Files.createTempDirectory("lm-plugins-");
        try {
            writeJar(dir.resolve("say_it.jar"), EchoCommand.class.getName());
            CommandRegistry registry = new CommandRegistry(ConflictPolicy.OVERRIDE);
            try (PluginLoader loader = new PluginLoader(registry)) {
                List<String> loaded = loader.loadDirectory(dir);
                assertEquals(List.of("say-it"), loaded);
            }
            CommandEntry entry = registry.require("say-it");
            assertEquals("Echo the arguments back", entry.help());
            Response response = registry.dispatch(null, "say-it", List.of("hi"));
            assertEquals("hi", response.message().orElseThrow());
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void brokenPluginsAreSkippedAndOthersStillLoad() throws Exception {
        Path dir = Files.createTempDirectory("lm-plugins-");
        try {
            writeJar(dir.resolve("a_no_attribute.jar"), null);
            writeJar(dir.resolve("b_missing_class.jar"), "io.launchmanager.command.DoesNotExist");
            writeJar(dir.resolve("c_not_a_command.jar"), String.class.getName());
            Files.writeString(dir.resolve("d_garbage.jar"), "not a zip");
            writeJar(dir.resolve("_private.jar"), EchoCommand.class.getName());
            writeJar(dir.resolve("z_good.jar"), EchoCommand.class.getName());

            CommandRegistry registry = new CommandRegistry(ConflictPolicy.OVERRIDE);
            try (PluginLoader loader = new PluginLoader(registry)) {
                assertEquals(List.of("z-good"), loader.loadDirectory(dir));
            }
            assertFalse(registry.find("-private").isPresent());
            assertFalse(registry.find("private").isPresent());
            assertEquals(1, registry.size());
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void loadJarReportsTheOffendingFile() throws Exception {
        Path dir = Files.createTempDirectory("lm-plugins-");
        try {
            Path jar = dir.resolve("bad.jar");
            writeJar(jar, String.class.getName());
            try (PluginLoader loader = new PluginLoader(new CommandRegistry(ConflictPolicy.OVERRIDE))) {
                PluginLoadException error = assertThrows(PluginLoadException.class, () -> loader.loadJar(jar));
                assertEquals(jar, error.source());
            }
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void rejectPolicySkipsPluginThatShadowsExistingCommand() throws Exception {
        Path dir = Files.createTempDirectory("lm-plugins-");
        try {
            writeJar(dir.resolve("status.jar"), EchoCommand.class.getName());
            CommandRegistry registry = new CommandRegistry(ConflictPolicy.REJECT);
            registry.register("status", (supervisor, args) -> Response.ok("builtin"), "Built-in status");
            try (PluginLoader loader = new PluginLoader(registry)) {
                assertTrue(loader.loadDirectory(dir).isEmpty());
            }
            assertEquals("builtin", registry.dispatch(null, "status", List.of()).message().orElseThrow());
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void missingDirectoryLoadsNothing() {
        CommandRegistry registry = new CommandRegistry(ConflictPolicy.OVERRIDE);
        try (PluginLoader loader = new PluginLoader(registry)) {
            assertTrue(loader.loadDirectory(Path.of("/nonexistent/lm-commands")).isEmpty());
            assertTrue(loader.loadDirectory(null).isEmpty());
        }
    }

    @Test
    void compiledInPluginsAreDiscoveredAsServices() {
        CommandRegistry registry = new CommandRegistry(ConflictPolicy.OVERRIDE);
        try (PluginLoader loader = new PluginLoader(registry)) {
            List<String> loaded = loader.loadServices();
            assertTrue(loaded.containsAll(List.of(
                    "bash", "bash-status", "bash-stop", "bash-watch", "pid", "runner", "runner-status")));
        }
        assertTrue(registry.require("bash").schema().isPresent());
    }

    private static void writeJar(Path jar, String commandClass) throws IOException {
        Manifest manifest = new Manifest();
        manifest.getMainAttributes().put(Attributes.Name.MANIFEST_VERSION, "1.0");
        if (commandClass != null) {
            manifest.getMainAttributes().put(new Attributes.Name(PluginLoader.COMMAND_CLASS_ATTRIBUTE), commandClass);
        }
        try (OutputStream out = Files.newOutputStream(jar);
             JarOutputStream ignored = new JarOutputStream(out, manifest)) {
            // manifest only; the command class comes from the parent class loader
        }
    }
}
