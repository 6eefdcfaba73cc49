package io.launchmanager.process;

/**
 * Base of every failure raised while starting, tracking or stopping a managed process.
 */
public class ProcessException extends RuntimeException {
    public ProcessException(String message) {
        super(message);
    }

    public ProcessException(String message, Throwable cause) {
        super(message, cause);
    }
}
