package com.phillippitts.livetranslate.service.synthesis;

import com.phillippitts.livetranslate.exception.ProviderException;

/**
 * Contract for text-to-speech back ends used for server-side audio delivery.
 *
 * <p>Thread Safety: called concurrently from the delivery pool, one call per listener.
 */
public interface SpeechSynthesisProvider {

    /**
     * Renders speech for one text.
     *
     * @param text         text to speak
     * @param languageCode BCP-47 language of {@code text}
     * @param voice        optional voice hint, may be null
     * @return encoded audio, or a marker telling the client to speak the text itself
     * @throws ProviderException if synthesis fails
     */
    SynthesisResult synthesize(String text, String languageCode, String voice);

    String getProviderName();
}
