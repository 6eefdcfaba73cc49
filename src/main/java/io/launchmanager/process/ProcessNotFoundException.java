package io.launchmanager.process;

public final class ProcessNotFoundException extends ProcessException {
    private final String processName;

    public ProcessNotFoundException(String processName) {
        super("Process \"" + processName + "\" not found");
        this.processName = processName;
    }

    public String processName() {
        return processName;
    }
}
