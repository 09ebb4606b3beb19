package com.phillippitts.livetranslate.service.translation;

import com.phillippitts.livetranslate.exception.ProviderException;

/**
 * Contract for machine translation back ends.
 *
 * <p>Implementations wrap one external service behind a blocking call. The fan-out
 * orchestrator invokes them concurrently from the translation pool, so they must be thread-safe.
 *
 * <p>Language codes arrive as BCP-47 tags ("en-US", "es"); implementations map them to whatever
 * their service expects.
 */
public interface TranslationProvider {

    /**
     * Translates one text.
     *
     * @param text           non-blank source text
     * @param sourceLanguage language of {@code text}
     * @param targetLanguage requested language
     * @return translated text
     * @throws ProviderException if the service fails or returns no usable translation
     */
    String translate(String text, String sourceLanguage, String targetLanguage);

    /**
     * Returns the name of this provider for logging and monitoring.
     *
     * @return provider name (e.g., "passthrough", "mymemory")
     */
    String getProviderName();
}
