package io.launchmanager.command;

public final class UnknownCommandException extends RuntimeException {
    private final String commandName;

    public UnknownCommandException(String commandName) {
        super("Unknown command: " + commandName);
        this.commandName = commandName;
    }

    public String commandName() {
        return commandName;
    }
}
