package io.launchmanager.plugins;

import io.launchmanager.process.ProcessKind;
import io.launchmanager.process.ProcessRecord;
import io.launchmanager.protocol.Response;
import io.launchmanager.server.Supervisor;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Optional;

/**
 * {@code bash-stop NAME}: stops a shell process through the supervisor's escalating stop.
 */
public final class BashStopCommand extends ArgumentCommand<BashStopCommand.Arguments> {
    private final OutputBuffers buffers;

    public BashStopCommand(OutputBuffers buffers) {
        super("bash-stop");
        this.buffers = buffers;
    }

    @Command(name = "bash-stop", description = "Stop a bash process")
    static final class Arguments {
        @Parameters(index = "0", arity = "0..1", paramLabel = "NAME", description = "Name of the process to stop")
        String name;
    }

    @Override
    public String help() {
        return "Stop a bash process";
    }

    @Override
    protected Arguments newArguments() {
        return new Arguments();
    }

    @Override
    protected Response execute(Supervisor supervisor, Arguments arguments) {
        if (arguments.name == null || arguments.name.isBlank()) {
            return Response.error("No process name specified");
        }
        Optional<ProcessRecord> record = supervisor.processes().get(arguments.name);
        if (record.isEmpty()) {
            return Response.error("Process \"" + arguments.name + "\" not found");
        }
        if (!ProcessKind.SHELL.equals(record.get().kind())) {
            return Response.error("\"" + arguments.name + "\" is not a bash process");
        }
        supervisor.stopProcess(arguments.name);
        buffers.drop(arguments.name);
        return Response.ok("Stopped bash process \"" + arguments.name + "\"");
    }
}
