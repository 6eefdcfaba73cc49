package io.launchmanager;

import io.launchmanager.cli.LaunchManagerCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        // Lets `send bash-status --all` pass --all through to the supervisor.
        int code = new CommandLine(new LaunchManagerCommand())
                .setUnmatchedOptionsArePositionalParams(true)
                .execute(args);
        System.exit(code);
    }
}
