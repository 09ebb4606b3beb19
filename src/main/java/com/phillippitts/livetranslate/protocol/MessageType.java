package com.phillippitts.livetranslate.protocol;

import java.util.Optional;

/**
 * Discriminant of inbound messages ({@code type} field).
 */
public enum MessageType {
    REGISTER("register"),
    TRANSCRIPTION("transcription"),
    TTS_REQUEST("tts_request"),
    AUDIO("audio"),
    SETTINGS("settings"),
    PING("ping"),
    PONG("pong");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<MessageType> fromWire(String value) {
        for (MessageType t : values()) {
            if (t.wireName.equals(value)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    /** Types a connection may still send after its classroom code expired. */
    public boolean allowedAfterExpiry() {
        return this == REGISTER || this == PING || this == PONG;
    }
}
