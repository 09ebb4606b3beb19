package com.phillippitts.livetranslate.exception;

/**
 * Thrown when a classroom code or session id is unknown or expired.
 */
public class InvalidSessionException extends LiveTranslateException {

    private final String identifier;

    public InvalidSessionException(String identifier) {
        super("Classroom session expired or invalid: " + identifier);
        this.identifier = identifier;
    }

    public InvalidSessionException(String identifier, String message) {
        super(message);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
