package io.launchmanager.process;

public final class DuplicateProcessNameException extends ProcessException {
    private final String processName;

    public DuplicateProcessNameException(String processName) {
        super("Process name already registered: " + processName);
        this.processName = processName;
    }

    public String processName() {
        return processName;
    }
}
