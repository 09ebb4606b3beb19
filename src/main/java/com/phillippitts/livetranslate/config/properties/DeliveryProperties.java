package com.phillippitts.livetranslate.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for translation fan-out and delivery.
 */
@ConfigurationProperties(prefix = "live-translate.delivery")
@Validated
public class DeliveryProperties {

    /** Send attempts per listener before recording a terminal non-delivery. */
    @Positive(message = "Max attempts must be positive")
    @Max(value = 10, message = "Max attempts must be at most 10")
    private int maxAttempts = 3;

    /** Language assumed for a listener that registered without one. */
    @NotBlank
    private String defaultListenerLanguage = "en";

    /** Language assumed for a presenter that registered without one. */
    @NotBlank
    private String defaultPresenterLanguage = "en-US";

    /** ttsServiceType reported when a listener did not choose one. */
    @NotBlank
    private String defaultTtsServiceType = "openai";

    /** Persist one TranslationRecord per delivered translation. Off the critical path when disabled. */
    private boolean persistTranslations = false;

    /** Characters of transcript text included in log lines. */
    @Positive
    private int logPreviewLength = 100;

    /** Audio payloads shorter than this are ignored. */
    @Positive
    private int minAudioLength = 100;

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public String getDefaultListenerLanguage() {
        return defaultListenerLanguage;
    }

    public void setDefaultListenerLanguage(String defaultListenerLanguage) {
        this.defaultListenerLanguage = defaultListenerLanguage;
    }

    public String getDefaultPresenterLanguage() {
        return defaultPresenterLanguage;
    }

    public void setDefaultPresenterLanguage(String defaultPresenterLanguage) {
        this.defaultPresenterLanguage = defaultPresenterLanguage;
    }

    public String getDefaultTtsServiceType() {
        return defaultTtsServiceType;
    }

    public void setDefaultTtsServiceType(String defaultTtsServiceType) {
        this.defaultTtsServiceType = defaultTtsServiceType;
    }

    public boolean isPersistTranslations() {
        return persistTranslations;
    }

    public void setPersistTranslations(boolean persistTranslations) {
        this.persistTranslations = persistTranslations;
    }

    public int getLogPreviewLength() {
        return logPreviewLength;
    }

    public void setLogPreviewLength(int logPreviewLength) {
        this.logPreviewLength = logPreviewLength;
    }

    public int getMinAudioLength() {
        return minAudioLength;
    }

    public void setMinAudioLength(int minAudioLength) {
        this.minAudioLength = minAudioLength;
    }
}
