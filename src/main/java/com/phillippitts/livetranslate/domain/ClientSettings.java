package com.phillippitts.livetranslate.domain;

import java.util.Locale;

/**
 * Per-connection delivery preferences.
 *
 * <p>Both fields are nullable so that a partial {@code settings} message only overrides the
 * values it carries (see {@link #merge(ClientSettings)}).
 *
 * @param ttsServiceType  requested synthesis service, or {@code "none"} for text-only delivery
 * @param useClientSpeech true when the client renders speech itself
 */
public record ClientSettings(String ttsServiceType, Boolean useClientSpeech) {

    /** ttsServiceType value that selects {@link DeliveryMode#SILENT}. */
    public static final String SILENT_SERVICE_TYPE = "none";

    private static final ClientSettings EMPTY = new ClientSettings(null, null);

    public static ClientSettings empty() {
        return EMPTY;
    }

    /**
     * Returns settings where every non-null field of {@code update} replaces this one's.
     */
    public ClientSettings merge(ClientSettings update) {
        if (update == null) {
            return this;
        }
        return new ClientSettings(
                update.ttsServiceType != null ? update.ttsServiceType : ttsServiceType,
                update.useClientSpeech != null ? update.useClientSpeech : useClientSpeech);
    }

    public DeliveryMode deliveryMode() {
        if (Boolean.TRUE.equals(useClientSpeech)) {
            return DeliveryMode.CLIENT_SPEECH;
        }
        if (ttsServiceType != null && SILENT_SERVICE_TYPE.equals(ttsServiceType.toLowerCase(Locale.ROOT))) {
            return DeliveryMode.SILENT;
        }
        return DeliveryMode.SERVER_AUDIO;
    }

    public String ttsServiceTypeOr(String fallback) {
        return ttsServiceType == null || ttsServiceType.isBlank() ? fallback : ttsServiceType;
    }

    public boolean isEmpty() {
        return ttsServiceType == null && useClientSpeech == null;
    }
}
