package io.launchmanager.cli;

import io.launchmanager.client.SupervisorClient;
import io.launchmanager.config.LaunchManagerConfig;
import io.launchmanager.protocol.Request;
import io.launchmanager.protocol.Response;
import io.launchmanager.server.PidFile;
import io.launchmanager.server.SupervisorServer;
import io.launchmanager.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.Callable;

@Command(
        name = "launch-manager",
        mixinStandardHelpOptions = true,
        description = "Local process supervisor reachable over a Unix domain socket",
        subcommands = {
                LaunchManagerCommand.ServeCommand.class,
                LaunchManagerCommand.SendCommand.class,
                LaunchManagerCommand.PidCommand.class
        }
)
public final class LaunchManagerCommand implements Runnable {
    static final String HOME_PROPERTY = "launchmanager.home";

    @Option(names = {"--home"}, description = "Manager home directory (config, socket, logs)", defaultValue = ".")
    String home;

    @Override
    public void run() {
        System.out.println("Use subcommands: serve | send | pid");
    }

    LaunchManagerConfig config() {
        Path base = Paths.get(home == null || home.isBlank() ? "." : home).toAbsolutePath().normalize();
        // Log4j reads this when the first logger is created.
        System.setProperty(HOME_PROPERTY, base.toString());
        return LaunchManagerConfig.load(base);
    }

    @Command(name = "serve", description = "Run the supervisor in the foreground until shutdown")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        LaunchManagerCommand parent;

        @Override
        public Integer call() throws IOException {
            LaunchManagerConfig config = parent.config();
            OptionalLong running = new PidFile(config.pidFile()).readLivePid();
            if (running.isPresent()) {
                System.err.println("Launch manager already running with PID " + running.getAsLong());
                return 1;
            }
            SupervisorServer server = new SupervisorServer(config);
            server.installSignalHandlers();
            System.out.println("Launch manager listening on " + config.socketPath());
            server.run();
            return 0;
        }
    }

    @Command(name = "send", description = "Send one command to a running supervisor and print the response")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        LaunchManagerCommand parent;

        @Option(names = {"--legacy"}, description = "Send raw JSON without the length prefix")
        boolean legacy;

        @Parameters(index = "0", description = "Command name")
        String command;

        @Parameters(index = "1..*", description = "Command arguments")
        List<String> args = new ArrayList<>();

        @Override
        public Integer call() {
            LaunchManagerConfig config = parent.config();
            SupervisorClient client = new SupervisorClient(config.socketPath());
            try {
                Response response = client.send(new Request(command, args), legacy);
                System.out.println(Jsons.toJson(response));
                return response.success() ? 0 : 1;
            } catch (IOException e) {
                System.err.println("Cannot reach launch manager at " + config.socketPath() + ": " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "pid", description = "Print the pid of the running supervisor")
    static final class PidCommand implements Callable<Integer> {
        @ParentCommand
        LaunchManagerCommand parent;

        @Override
        public Integer call() {
            OptionalLong pid = new PidFile(parent.config().pidFile()).readLivePid();
            if (pid.isEmpty()) {
                System.err.println("No manager PID found or manager not running");
                return 1;
            }
            System.out.println(pid.getAsLong());
            return 0;
        }
    }
}
