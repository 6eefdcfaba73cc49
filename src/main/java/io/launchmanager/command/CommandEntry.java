package io.launchmanager.command;

import picocli.CommandLine.Model.CommandSpec;

import java.util.Objects;
import java.util.Optional;

public record CommandEntry(String name, Command command, String help, Optional<CommandSpec> schema) {
    public CommandEntry {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("command name cannot be empty");
        }
        Objects.requireNonNull(command, "command");
        help = help == null || help.isBlank() ? "Command: " + name : help.strip();
        schema = schema == null ? Optional.empty() : schema;
    }

    public static CommandEntry of(String name, Command command, String help) {
        return new CommandEntry(name, command, help, command.argumentSpec());
    }

    public static CommandEntry of(String name, Command command) {
        return of(name, command, command.help());
    }
}
