package com.phillippitts.livetranslate.service.delivery;

import java.util.Map;
import java.util.Set;

/**
 * Translations of one text keyed by target language.
 *
 * @param translations  one entry per requested language; failed languages hold the original text
 * @param fallbacks     languages whose translation failed
 * @param translationMs wall-clock duration of the parallel phase
 */
public record TranslationBatch(Map<String, String> translations, Set<String> fallbacks, long translationMs) {

    public TranslationBatch {
        translations = Map.copyOf(translations);
        fallbacks = Set.copyOf(fallbacks);
    }

    /** Translation for a language, or {@code original} when none was produced. */
    public String textFor(String language, String original) {
        String text = translations.get(language);
        return text == null ? original : text;
    }
}
