package io.launchmanager.command;

import io.launchmanager.protocol.Response;
import io.launchmanager.server.Supervisor;
import picocli.CommandLine.Model.CommandSpec;

import java.util.List;
import java.util.Optional;

/**
 * Handler contract shared by built-ins and plugins: the owning supervisor plus the raw argument
 * list in, a structured response out.
 */
@FunctionalInterface
public interface Command {
    Response handle(Supervisor supervisor, List<String> args) throws Exception;

    default String help() {
        return "";
    }

    /**
     * Argument schema used to render detailed help.
     */
    default Optional<CommandSpec> argumentSpec() {
        return Optional.empty();
    }
}
