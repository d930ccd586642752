package com.gasview.alerts.exception;

/**
 * A detection or tuning operation was called before a series was loaded.
 */
public class NotReadyException extends AlertDetectorException {

    public NotReadyException(String message) {
        super(message);
    }
}
