package com.gasview.alerts.exception;

import java.util.List;

/**
 * A configuration value or input reading was rejected.
 * The object that raised it keeps its previous state.
 */
public class ValidationException extends AlertDetectorException {
    private final List<String> errors;

    public ValidationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public ValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
