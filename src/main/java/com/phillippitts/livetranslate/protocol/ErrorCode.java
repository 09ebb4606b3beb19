package com.phillippitts.livetranslate.protocol;

/**
 * Machine-readable codes carried by outbound error payloads.
 */
public enum ErrorCode {
    INVALID_CLASSROOM,
    SESSION_EXPIRED,
    INVALID_MESSAGE,
    TTS_ERROR
}
