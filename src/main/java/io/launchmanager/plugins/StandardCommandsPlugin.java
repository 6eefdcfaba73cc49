package io.launchmanager.plugins;

import io.launchmanager.command.CommandEntry;
import io.launchmanager.command.CommandPlugin;

import java.util.List;

/**
 * Process commands shipped with the manager. The shell commands share one {@link OutputBuffers}.
 */
public final class StandardCommandsPlugin implements CommandPlugin {
    private final OutputBuffers buffers;

    public StandardCommandsPlugin() {
        this(new OutputBuffers());
    }

    public StandardCommandsPlugin(OutputBuffers buffers) {
        this.buffers = buffers;
    }

    @Override
    public List<CommandEntry> commands() {
        List<ArgumentCommand<?>> commands = List.of(
                new BashCommand(buffers),
                new BashStatusCommand(buffers),
                new BashStopCommand(buffers),
                new BashWatchCommand(buffers),
                new PidCommand(),
                new RunnerCommand(),
                new RunnerStatusCommand()
        );
        return commands.stream().map(ArgumentCommand::entry).toList();
    }
}
