package com.gasview.alerts.exception;

public class InsufficientDataException extends AlertDetectorException {
    private final int available;
    private final int required;

    public InsufficientDataException(String message, int available, int required) {
        super(message);
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
