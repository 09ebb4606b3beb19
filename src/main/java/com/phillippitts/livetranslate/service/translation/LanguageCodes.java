package com.phillippitts.livetranslate.service.translation;

import java.util.Locale;

/** Helpers for BCP-47 style language tags. */
public final class LanguageCodes {

    private LanguageCodes() {
    }

    /** Primary subtag in lower case: "en-US" becomes "en". Null or blank yields "". */
    public static String baseLanguage(String languageCode) {
        if (languageCode == null || languageCode.isBlank()) {
            return "";
        }
        String trimmed = languageCode.trim();
        int dash = trimmed.indexOf('-');
        if (dash < 0) {
            dash = trimmed.indexOf('_');
        }
        return (dash < 0 ? trimmed : trimmed.substring(0, dash)).toLowerCase(Locale.ROOT);
    }

    /** True when both tags share a primary language, so no translation is needed. */
    public static boolean sameBaseLanguage(String a, String b) {
        String baseA = baseLanguage(a);
        return !baseA.isEmpty() && baseA.equals(baseLanguage(b));
    }
}
