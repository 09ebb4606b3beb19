package com.phillippitts.livetranslate.domain;

/**
 * How a listener wants translated text rendered.
 */
public enum DeliveryMode {
    /** Client synthesizes speech locally from structured speech parameters. */
    CLIENT_SPEECH,
    /** Server synthesizes audio and embeds it base64-encoded. */
    SERVER_AUDIO,
    /** Text only. */
    SILENT
}
