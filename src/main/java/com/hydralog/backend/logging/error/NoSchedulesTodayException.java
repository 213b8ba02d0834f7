package com.hydralog.backend.logging.error;

public final class NoSchedulesTodayException extends LoggingException {

    public NoSchedulesTodayException() {
        super("No active schedule has a reminder today");
    }

    @Override
    public ErrorKind kind() { return ErrorKind.NO_SCHEDULES; }
}
