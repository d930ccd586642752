package com.gasview.alerts.exception;

/**
 * Base type for every failure the detector reports to its caller.
 */
public class AlertDetectorException extends RuntimeException {

    public AlertDetectorException(String message) {
        super(message);
    }

    public AlertDetectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
