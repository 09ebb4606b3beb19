package com.phillippitts.livetranslate.exception;

/**
 * Thrown by a session repository when a read or write fails.
 * On the real-time path this is logged and swallowed; it never blocks delivery.
 */
public class PersistenceException extends LiveTranslateException {

    private final String operation;

    public PersistenceException(String operation, String message) {
        super(operation + " failed: " + message);
        this.operation = operation;
    }

    public PersistenceException(String operation, String message, Throwable cause) {
        super(operation + " failed: " + message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
