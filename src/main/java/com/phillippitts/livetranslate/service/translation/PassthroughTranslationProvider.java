package com.phillippitts.livetranslate.service.translation;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Returns the input unchanged. Default provider: needs no network and keeps the pipeline
 * runnable in development and tests.
 */
@Component
@ConditionalOnProperty(name = "live-translate.provider.translation", havingValue = "passthrough",
        matchIfMissing = true)
public class PassthroughTranslationProvider implements TranslationProvider {

    public static final String NAME = "passthrough";

    @Override
    public String translate(String text, String sourceLanguage, String targetLanguage) {
        return text;
    }

    @Override
    public String getProviderName() {
        return NAME;
    }
}
