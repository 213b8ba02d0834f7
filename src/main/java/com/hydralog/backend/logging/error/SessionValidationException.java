package com.hydralog.backend.logging.error;

import java.util.List;
import java.util.Map;

public final class SessionValidationException extends LoggingException {

    private final List<String> errors;

    public SessionValidationException(List<String> errors) {
        super("Session validation failed: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public SessionValidationException(String error) {
        this(List.of(error));
    }

    public List<String> errors() { return errors; }

    @Override
    public ErrorKind kind() { return ErrorKind.VALIDATION_FAILURE; }

    @Override
    public Map<String, Object> context() {
        return Map.of("errors", errors);
    }
}
