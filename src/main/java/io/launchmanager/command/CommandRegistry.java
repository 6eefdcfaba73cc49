package io.launchmanager.command;

import io.launchmanager.process.ProcessException;
import io.launchmanager.protocol.Response;
import io.launchmanager.server.Supervisor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine.Model.CommandSpec;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to handler map. Written during startup (built-ins first, then plugins) and read
 * concurrently by connection workers afterwards.
 */
public final class CommandRegistry {
    private static final Logger logger = LogManager.getLogger(CommandRegistry.class);

    private final Map<String, CommandEntry> entries = new ConcurrentHashMap<>();
    private final ConflictPolicy conflictPolicy;

    public CommandRegistry(ConflictPolicy conflictPolicy) {
        this.conflictPolicy = conflictPolicy == null ? ConflictPolicy.OVERRIDE : conflictPolicy;
    }

    public void register(String name, Command command, String help) {
        register(CommandEntry.of(name, command, help));
    }

    public void register(String name, Command command, String help, CommandSpec schema) {
        register(new CommandEntry(name, command, help, Optional.ofNullable(schema)));
    }

    public void register(CommandEntry entry) {
        CommandEntry previous = conflictPolicy == ConflictPolicy.REJECT
                ? entries.putIfAbsent(entry.name(), entry)
                : entries.put(entry.name(), entry);
        if (previous == null) {
            logger.debug("Registered command: {}", entry.name());
            return;
        }
        if (conflictPolicy == ConflictPolicy.REJECT) {
            throw new CommandConflictException(entry.name());
        }
        logger.warn("Command {} was registered twice; the later registration wins", entry.name());
    }

    public Optional<CommandEntry> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(entries.get(name));
    }

    public CommandEntry require(String name) {
        return find(name).orElseThrow(() -> new UnknownCommandException(name));
    }

    public List<CommandEntry> entries() {
        return entries.values().stream()
                .sorted(Comparator.comparing(CommandEntry::name))
                .toList();
    }

    public int size() {
        return entries.size();
    }

    public ConflictPolicy conflictPolicy() {
        return conflictPolicy;
    }

    /**
     * Runs the named command. Nothing a handler throws escapes: unknown names and handler failures
     * both come back as {@code {"success": false, "error": ...}}.
     */
    public Response dispatch(Supervisor supervisor, String name, List<String> args) {
        CommandEntry entry;
        try {
            entry = require(name);
        } catch (UnknownCommandException e) {
            logger.info("Rejected unknown command: {}", name);
            return Response.error(e);
        }
        try {
            Response response = entry.command().handle(supervisor, args == null ? List.of() : args);
            if (response == null) {
                logger.warn("Command {} returned no response", name);
                return Response.error("Command " + name + " returned no response");
            }
            return response;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Command {} interrupted", name);
            return Response.error("Command " + name + " was interrupted");
        } catch (ProcessException e) {
            logger.warn("Command {} failed: {}", name, e.getMessage());
            return Response.error(e);
        } catch (Exception e) {
            logger.error("Command {} failed", name, e);
            return Response.error(e);
        }
    }
}
