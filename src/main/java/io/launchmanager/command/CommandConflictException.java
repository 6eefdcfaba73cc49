package io.launchmanager.command;

public final class CommandConflictException extends RuntimeException {
    public CommandConflictException(String commandName) {
        super("Command already registered: " + commandName);
    }
}
