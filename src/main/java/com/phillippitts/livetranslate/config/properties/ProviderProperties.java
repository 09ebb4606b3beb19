package com.phillippitts.livetranslate.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Selects and configures the translation and synthesis providers.
 */
@ConfigurationProperties(prefix = "live-translate.provider")
@Validated
public class ProviderProperties {

    /** {@code passthrough} (no network) or {@code mymemory}. */
    @NotBlank
    private String translation = "passthrough";

    /** Only {@code silent-wav} ships with the service. */
    @NotBlank
    private String synthesis = "silent-wav";

    @NotBlank
    private String mymemoryBaseUrl = "https://api.mymemory.translated.net";

    @Positive
    private int connectTimeoutMs = 2_000;

    @Positive
    private int readTimeoutMs = 5_000;

    public String getTranslation() {
        return translation;
    }

    public void setTranslation(String translation) {
        this.translation = translation;
    }

    public String getSynthesis() {
        return synthesis;
    }

    public void setSynthesis(String synthesis) {
        this.synthesis = synthesis;
    }

    public String getMymemoryBaseUrl() {
        return mymemoryBaseUrl;
    }

    public void setMymemoryBaseUrl(String mymemoryBaseUrl) {
        this.mymemoryBaseUrl = mymemoryBaseUrl;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }
}
