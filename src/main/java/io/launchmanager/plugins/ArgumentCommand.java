package io.launchmanager.plugins;

import io.launchmanager.command.Command;
import io.launchmanager.command.CommandEntry;
import io.launchmanager.protocol.Response;
import io.launchmanager.server.Supervisor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;

import java.util.List;
import java.util.Optional;

/**
 * Base for plugin commands whose arguments are declared as a picocli options object.
 *
 * <p>Each call parses into a fresh options instance, so one command object can serve concurrent
 * connections. The same options class doubles as the schema {@code help <name>} renders.
 *
 * @param <T> picocli-annotated options type
 */
public abstract class ArgumentCommand<T> implements Command {
    private static final Logger logger = LogManager.getLogger(ArgumentCommand.class);

    private final String name;

    protected ArgumentCommand(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public CommandEntry entry() {
        return CommandEntry.of(name, this);
    }

    protected abstract T newArguments();

    protected abstract Response execute(Supervisor supervisor, T arguments) throws Exception;

    @Override
    public final Response handle(Supervisor supervisor, List<String> args) throws Exception {
        T arguments = newArguments();
        try {
            new CommandLine(arguments)
                    .setExpandAtFiles(false)
                    .parseArgs(args.toArray(new String[0]));
        } catch (CommandLine.ParameterException e) {
            logger.debug("{} rejected arguments {}: {}", name, args, e.getMessage());
            return Response.error(invalidArguments());
        }
        return execute(supervisor, arguments);
    }

    @Override
    public Optional<CommandSpec> argumentSpec() {
        return Optional.of(new CommandLine(newArguments()).getCommandSpec());
    }

    protected String invalidArguments() {
        return "Invalid arguments. Use \"help " + name + "\" for usage.";
    }
}
