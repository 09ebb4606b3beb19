package com.phillippitts.livetranslate.exception;

/**
 * Thrown when a translation or speech-synthesis provider fails.
 * Callers degrade (fallback text, audio-less payload); this is never fatal to a broadcast.
 */
public class ProviderException extends LiveTranslateException {

    private final String providerName;

    public ProviderException(String message, String providerName) {
        super(message + " (provider: " + providerName + ")");
        this.providerName = providerName;
    }

    public ProviderException(String message, String providerName, Throwable cause) {
        super(message + " (provider: " + providerName + ")", cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
