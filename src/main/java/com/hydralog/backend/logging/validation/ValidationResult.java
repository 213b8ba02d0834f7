package com.hydralog.backend.logging.validation;

import com.hydralog.backend.logging.error.SessionValidationException;

import java.util.ArrayList;
import java.util.List;

/** Errors block the write; warnings are returned to the caller alongside a successful write. */
public record ValidationResult(List<String> errors, List<String> warnings) {

    public static final ValidationResult OK = new ValidationResult(List.of(), List.of());

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean valid() {
        return errors.isEmpty();
    }

    public ValidationResult withWarnings(List<String> more) {
        if (more.isEmpty()) return this;
        List<String> merged = new ArrayList<>(warnings);
        merged.addAll(more);
        return new ValidationResult(errors, merged);
    }

    public ValidationResult orThrow() {
        if (!valid()) throw new SessionValidationException(errors);
        return this;
    }
}
