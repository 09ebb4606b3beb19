package com.phillippitts.livetranslate.service.status;

/**
 * Listeners of one language within a session.
 *
 * @param percentage share of the session's listeners, rounded to a whole percent
 */
public record LanguageShare(String languageCode, int listenerCount, int percentage) {
}
