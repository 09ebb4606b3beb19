package com.phillippitts.livetranslate.exception;

/**
 * Thrown when a payload cannot be written to a client connection.
 */
public class DeliveryException extends LiveTranslateException {

    private final String connectionId;

    public DeliveryException(String connectionId, String message) {
        super("Delivery to " + connectionId + " failed: " + message);
        this.connectionId = connectionId;
    }

    public DeliveryException(String connectionId, String message, Throwable cause) {
        super("Delivery to " + connectionId + " failed: " + message, cause);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
