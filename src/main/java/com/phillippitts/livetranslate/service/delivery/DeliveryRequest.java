package com.phillippitts.livetranslate.service.delivery;

import com.phillippitts.livetranslate.domain.ClientSettings;
import com.phillippitts.livetranslate.domain.LatencyTrace;
import com.phillippitts.livetranslate.service.registry.ClientConnection;
import com.phillippitts.livetranslate.service.registry.ListenerSnapshot;

import java.util.Objects;
import java.util.function.Function;

/**
 * Everything {@link TranslationFanoutService#sendToListeners(DeliveryRequest)} needs for one broadcast.
 *
 * @param sessionId       session being broadcast to; used for audit records, may be null
 * @param settingsLookup  resolves each listener's current delivery settings
 * @param trace           latency trace with preparation and translation already recorded
 */
public record DeliveryRequest(
        String sessionId,
        String originalText,
        String sourceLanguage,
        TranslationBatch batch,
        ListenerSnapshot listeners,
        Function<ClientConnection, ClientSettings> settingsLookup,
        LatencyTrace trace
) {

    public DeliveryRequest {
        Objects.requireNonNull(originalText, "originalText");
        Objects.requireNonNull(batch, "batch");
        Objects.requireNonNull(listeners, "listeners");
        Objects.requireNonNull(settingsLookup, "settingsLookup");
        Objects.requireNonNull(trace, "trace");
    }
}
