package com.phillippitts.livetranslate.service.synthesis;

import java.util.Base64;

/**
 * Outcome of a synthesis call: audio bytes, or a request that the client speak the text.
 *
 * @param audio       encoded audio (WAV for the bundled provider); empty for client speech
 * @param clientSpeech true when the provider delegates rendering to the client
 */
public record SynthesisResult(byte[] audio, String mimeType, boolean clientSpeech) {

    public SynthesisResult {
        audio = audio == null ? new byte[0] : audio;
    }

    public static SynthesisResult audio(byte[] audio, String mimeType) {
        return new SynthesisResult(audio, mimeType, false);
    }

    public static SynthesisResult clientSpeechMarker() {
        return new SynthesisResult(new byte[0], null, true);
    }

    public boolean hasAudio() {
        return audio.length > 0;
    }

    /** Audio as base64 for embedding in a JSON frame; "" when there is none. */
    public String base64Audio() {
        return hasAudio() ? Base64.getEncoder().encodeToString(audio) : "";
    }
}
