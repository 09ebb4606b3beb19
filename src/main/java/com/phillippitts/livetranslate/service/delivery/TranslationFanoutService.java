package com.phillippitts.livetranslate.service.delivery;

import com.phillippitts.livetranslate.domain.ClientSettings;
import com.phillippitts.livetranslate.domain.LatencyTrace;
import com.phillippitts.livetranslate.protocol.outbound.TtsResponseMessage;
import com.phillippitts.livetranslate.service.registry.ClientConnection;
import com.phillippitts.livetranslate.service.registry.ListenerSnapshot;

import java.util.Collection;
import java.util.function.Function;

/**
 * Translates one presenter utterance into every listener language and delivers it to every
 * listener, both phases in parallel.
 *
 * <p>Failures degrade per language or per listener and never abort the broadcast. Calls block
 * until all parallel work has settled.
 */
public interface TranslationFanoutService {

    /**
     * True when {@code text} has non-whitespace content and {@code languageCode} is a non-empty
     * string.
     */
    boolean validateRequest(String text, String languageCode);

    /**
     * One translation per distinct target language, concurrently. A failed language maps to the
     * original text; the batch always has one entry per distinct language.
     */
    TranslationBatch translateToMultipleLanguages(String text, String sourceLanguage,
                                                  Collection<String> targetLanguages);

    /**
     * Delivers to every listener of the request concurrently, with bounded retries.
     * Returns once every listener's attempt sequence has settled.
     */
    DeliveryReport sendToListeners(DeliveryRequest request);

    /**
     * Full broadcast of a presenter transcription: audit, translate, deliver, then bookkeeping.
     *
     * @param trace started when the transcription arrived
     */
    DeliveryReport broadcast(String sessionId, String text, String sourceLanguage, ListenerSnapshot listeners,
                             Function<ClientConnection, ClientSettings> settingsLookup,
                             LatencyTrace trace);

    /**
     * Answers an explicit speech request from a client according to its settings.
     */
    TtsResponseMessage synthesizeOnDemand(String text, String languageCode, String voice, ClientSettings settings);
}
