package com.phillippitts.livetranslate.exception;

/**
 * Thrown when an inbound message or request is malformed: unknown type, missing
 * fields, empty text or an empty language code. Raised before any provider call.
 */
public class InvalidMessageException extends LiveTranslateException {

    private final String messageType;

    public InvalidMessageException(String reason) {
        super("Invalid message: " + reason);
        this.messageType = "unknown";
    }

    public InvalidMessageException(String messageType, String reason) {
        super("Invalid " + messageType + " message: " + reason);
        this.messageType = messageType;
    }

    public InvalidMessageException(String messageType, String reason, Throwable cause) {
        super("Invalid " + messageType + " message: " + reason, cause);
        this.messageType = messageType;
    }

    public String getMessageType() {
        return messageType;
    }
}
