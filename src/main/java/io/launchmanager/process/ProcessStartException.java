package io.launchmanager.process;

public final class ProcessStartException extends ProcessException {
    public ProcessStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
