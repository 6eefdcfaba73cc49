package io.launchmanager.command;

import io.launchmanager.process.ProcessNotFoundException;
import io.launchmanager.protocol.Response;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class CommandRegistryTest {

    @Test
    void unknownCommandBecomesFailureResponse() {
        CommandRegistry registry = new CommandRegistry(ConflictPolicy.OVERRIDE);
        Response response = registry.dispatch(null, "bogus", List.of());
        assertFalse(response.success());
        assertEquals("Unknown command: bogus", response.error().orElseThrow());
    }

    @Test
    void dispatchPassesArgumentsToHandler() {
        CommandRegistry registry = new CommandRegistry(ConflictPolicy.OVERRIDE);
        registry.register("echo", new EchoCommand(), "");
        Response response = registry.dispatch(null, "echo", List.of("a", "b"));
        assertTrue(response.success());
        assertEquals("a b", response.message().orElseThrow());
        assertEquals("Command: echo", registry.require("echo").help());
    }

    @Test
    void handlerFailuresAreContained() {
        CommandRegistry registry = new CommandRegistry(ConflictPolicy.OVERRIDE);
        registry.register("boom", (supervisor, args) -> {
            throw new IllegalStateException("kaboom");
        }, "Always fails");
        registry.register("missing", (supervisor, args) -> {
            throw new ProcessNotFoundException("x");
        }, "Missing process");
        registry.register("silent", (supervisor, args) -> null, "Returns nothing");

        assertEquals("kaboom", registry.dispatch(null, "boom", List.of()).error().orElseThrow());
        assertEquals("Process \"x\" not found", registry.dispatch(null, "missing", List.of()).error().orElseThrow());
        assertFalse(registry.dispatch(null, "silent", List.of()).success());
    }

    @Test
    void overridePolicyKeepsLaterRegistration() {
        CommandRegistry registry = new CommandRegistry(ConflictPolicy.OVERRIDE);
        registry.register("dup", (supervisor, args) -> Response.ok("first"), "first");
        registry.register("dup", (supervisor, args) -> Response.ok("second"), "second");
        assertEquals(1, registry.size());
        assertEquals("second", registry.dispatch(null, "dup", List.of()).message().orElseThrow());
    }

    @Test
    void rejectPolicyKeepsFirstRegistration() {
        CommandRegistry registry = new CommandRegistry(ConflictPolicy.REJECT);
        registry.register("dup", (supervisor, args) -> Response.ok("first"), "first");
        assertThrows(CommandConflictException.class,
                () -> registry.register("dup", (supervisor, args) -> Response.ok("second"), "second"));
        assertEquals("first", registry.dispatch(null, "dup", List.of()).message().orElseThrow());
    }

    @Test
    void entriesAreSortedByName() {
        CommandRegistry registry = new CommandRegistry(null);
        registry.register("zeta", new EchoCommand(), "z");
        registry.register("alpha", new EchoCommand(), "a");
        registry.register("mid", new EchoCommand(), "m");
        assertEquals(ConflictPolicy.OVERRIDE, registry.conflictPolicy());
        assertEquals(List.of("alpha", "mid", "zeta"),
                registry.entries().stream().map(CommandEntry::name).toList());
    }

    @Test
    void conflictPolicyParsesAliases() {
        assertEquals(ConflictPolicy.REJECT, ConflictPolicy.fromString(" Reject "));
        assertEquals(ConflictPolicy.REJECT, ConflictPolicy.fromString("fail"));
        assertEquals(ConflictPolicy.OVERRIDE, ConflictPolicy.fromString("override"));
        assertEquals(ConflictPolicy.OVERRIDE, ConflictPolicy.fromString(null));
    }
}
