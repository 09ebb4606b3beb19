package com.phillippitts.livetranslate.domain;

/**
 * Instructions for a client to synthesize speech locally.
 */
public record SpeechParams(String type, String text, String languageCode, boolean autoPlay) {

    public static final String BROWSER_SPEECH = "browser-speech";

    public static SpeechParams browserSpeech(String text, String languageCode) {
        return new SpeechParams(BROWSER_SPEECH, text, languageCode, true);
    }
}
