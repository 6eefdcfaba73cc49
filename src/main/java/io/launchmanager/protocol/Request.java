package io.launchmanager.protocol;

import java.util.List;

public record Request(String command, List<String> args) {
    public Request {
        command = command == null ? "" : command;
        args = args == null ? List.of() : List.copyOf(args);
    }

    public static Request of(String command, String... args) {
        return new Request(command, List.of(args));
    }
}
