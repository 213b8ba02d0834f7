package com.hydralog.backend.logging.error;

/** Quick-log found nothing outstanding. Shown as "all caught up", not as an error banner. */
public final class ReconciliationEmptyException extends LoggingException {

    public ReconciliationEmptyException() {
        super("All scheduled treatments for today are already logged");
    }

    @Override
    public ErrorKind kind() { return ErrorKind.RECONCILIATION_EMPTY; }
}
