package io.launchmanager.command;

import java.util.List;

/**
 * Compiled-in source of commands, discovered through {@link java.util.ServiceLoader}.
 */
public interface CommandPlugin {
    List<CommandEntry> commands();
}
