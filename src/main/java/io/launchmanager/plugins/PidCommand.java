package io.launchmanager.plugins;

import io.launchmanager.protocol.Response;
import io.launchmanager.server.PidFile;
import io.launchmanager.server.Supervisor;
import io.launchmanager.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Map;
import java.util.OptionalLong;

public final class PidCommand extends ArgumentCommand<PidCommand.Arguments> {

    public PidCommand() {
        super("pid");
    }

    @Command(name = "pid", description = "Show the PID of the running launch manager")
    static final class Arguments {
        @Option(names = {"--json"}, description = "Output in JSON format")
        boolean json;
    }

    @Override
    public String help() {
        return "Show the PID of the running launch manager";
    }

    @Override
    protected Arguments newArguments() {
        return new Arguments();
    }

    @Override
    protected Response execute(Supervisor supervisor, Arguments arguments) {
        OptionalLong pid = new PidFile(supervisor.config().pidFile()).readLivePid();
        if (pid.isEmpty()) {
            return Response.error("No manager PID found or manager not running");
        }
        String message = arguments.json
                ? Jsons.toJson(Map.of("pid", pid.getAsLong()))
                : Long.toString(pid.getAsLong());
        return Response.ok(message);
    }
}
