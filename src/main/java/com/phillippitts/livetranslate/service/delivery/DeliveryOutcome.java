package com.phillippitts.livetranslate.service.delivery;

import com.phillippitts.livetranslate.domain.DeliveryMode;

/**
 * Result of delivering one broadcast to one listener.
 *
 * @param attempts send attempts used (0 if the payload was never sent)
 * @param error    failure description, null when delivered
 */
public record DeliveryOutcome(
        String connectionId,
        String listenerLanguage,
        DeliveryMode mode,
        boolean delivered,
        int attempts,
        String error
) {

    public static DeliveryOutcome delivered(String connectionId, String language, DeliveryMode mode, int attempts) {
        return new DeliveryOutcome(connectionId, language, mode, true, attempts, null);
    }

    public static DeliveryOutcome failed(String connectionId, String language, DeliveryMode mode, int attempts,
                                         String error) {
        return new DeliveryOutcome(connectionId, language, mode, false, attempts, error);
    }
}
