package com.phillippitts.livetranslate.service.delivery;

import com.phillippitts.livetranslate.config.properties.DeliveryProperties;
import com.phillippitts.livetranslate.domain.ClientSettings;
import com.phillippitts.livetranslate.domain.DeliveryMode;
import com.phillippitts.livetranslate.domain.LatencyTrace;
import com.phillippitts.livetranslate.domain.SessionUpdate;
import com.phillippitts.livetranslate.domain.SpeechParams;
import com.phillippitts.livetranslate.domain.TranscriptRecord;
import com.phillippitts.livetranslate.domain.TranslationRecord;
import com.phillippitts.livetranslate.exception.PersistenceException;
import com.phillippitts.livetranslate.exception.ProviderException;
import com.phillippitts.livetranslate.protocol.outbound.TranslationMessage;
import com.phillippitts.livetranslate.protocol.outbound.TtsResponseMessage;
import com.phillippitts.livetranslate.service.metrics.LiveTranslateMetrics;
import com.phillippitts.livetranslate.service.persistence.SessionRepository;
import com.phillippitts.livetranslate.service.registry.ClientConnection;
import com.phillippitts.livetranslate.service.registry.ListenerSnapshot;
import com.phillippitts.livetranslate.service.synthesis.SpeechSynthesisProvider;
import com.phillippitts.livetranslate.service.synthesis.SynthesisResult;
import com.phillippitts.livetranslate.service.translation.LanguageCodes;
import com.phillippitts.livetranslate.service.translation.TranslationProvider;
import com.phillippitts.livetranslate.util.LogSanitizer;
import com.phillippitts.livetranslate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Default fan-out orchestrator.
 *
 * <p><b>Thread Model:</b> translation runs one task per distinct language on
 * {@code translationExecutor}; delivery runs one task per listener on {@code deliveryExecutor}.
 * Each task catches its own failures and completes normally, so joining the combined future
 * never throws and always waits for every task.
 *
 * <p><b>Error Handling:</b>
 * <ul>
 *   <li>Translation failure: that language falls back to the original text</li>
 *   <li>Synthesis failure: the listener receives the text without audio</li>
 *   <li>Send failure: retried up to {@code live-translate.delivery.max-attempts} times in total</li>
 *   <li>Persistence failure: logged, never blocks delivery</li>
 * </ul>
 */
@Service
public class DefaultTranslationFanoutService implements TranslationFanoutService {

    private static final Logger LOG = LogManager.getLogger(DefaultTranslationFanoutService.class);

    private final TranslationProvider translationProvider;
    private final SpeechSynthesisProvider synthesisProvider;
    private final Executor translationExecutor;
    private final Executor deliveryExecutor;
    private final SessionRepository repository;
    private final DeliveryProperties props;
    private final LiveTranslateMetrics metrics;
    private final Clock clock;
    private final BoundedRetry retry;

    public DefaultTranslationFanoutService(TranslationProvider translationProvider,
                                           SpeechSynthesisProvider synthesisProvider,
                                           @Qualifier("translationExecutor") Executor translationExecutor,
                                           @Qualifier("deliveryExecutor") Executor deliveryExecutor,
                                           SessionRepository repository,
                                           DeliveryProperties props,
                                           LiveTranslateMetrics metrics,
                                           Clock clock) {
        this.translationProvider = Objects.requireNonNull(translationProvider, "translationProvider");
        this.synthesisProvider = Objects.requireNonNull(synthesisProvider, "synthesisProvider");
        this.translationExecutor = Objects.requireNonNull(translationExecutor, "translationExecutor");
        this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.retry = new BoundedRetry(props.getMaxAttempts());
    }

    @Override
    public boolean validateRequest(String text, String languageCode) {
        if (text == null || text.isBlank()) {
            return false;
        }
        return languageCode != null && !languageCode.isEmpty();
    }

    @Override
    public TranslationBatch translateToMultipleLanguages(String text, String sourceLanguage,
                                                         Collection<String> targetLanguages) {
        Objects.requireNonNull(text, "text");
        Set<String> distinct = new LinkedHashSet<>();
        for (String target : targetLanguages) {
            if (target != null && !target.isBlank()) {
                distinct.add(target);
            }
        }
        long t0 = System.nanoTime();

        Map<String, CompletableFuture<String>> futures = new LinkedHashMap<>();
        Set<String> fallbacks = ConcurrentHashMap.newKeySet();
        for (String target : distinct) {
            futures.put(target, CompletableFuture.supplyAsync(
                    () -> translateOne(text, sourceLanguage, target, fallbacks), translationExecutor));
        }
        CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new)).join();

        Map<String, String> translations = new LinkedHashMap<>();
        futures.forEach((lang, f) -> translations.put(lang, f.join()));
        long translationMs = TimeUtils.elapsedMillis(t0);

        metrics.recordTranslationLatency(translationMs, distinct.size());
        LOG.debug("Translated into {} languages in {} ms ({} fallbacks)", distinct.size(), translationMs,
                fallbacks.size());
        return new TranslationBatch(translations, fallbacks, translationMs);
    }

    private String translateOne(String text, String sourceLanguage, String target, Set<String> fallbacks) {
        if (LanguageCodes.sameBaseLanguage(sourceLanguage, target)) {
            return text;
        }
        try {
            String translated = translationProvider.translate(text, sourceLanguage, target);
            if (translated == null || translated.isBlank()) {
                throw new ProviderException("empty translation", translationProvider.getProviderName());
            }
            return translated;
        } catch (ProviderException e) {
            LOG.warn("Translation {} -> {} failed, using original text: {}", sourceLanguage, target, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Translation {} -> {} failed unexpectedly, using original text", sourceLanguage, target, e);
        }
        fallbacks.add(target);
        metrics.incrementTranslationFallback(target);
        return text;
    }

    @Override
    public DeliveryReport sendToListeners(DeliveryRequest request) {
        ListenerSnapshot listeners = request.listeners();
        List<CompletableFuture<DeliveryOutcome>> futures = new ArrayList<>(listeners.size());
        int skipped = 0;
        for (int i = 0; i < listeners.size(); i++) {
            ClientConnection connection = listeners.connections().get(i);
            String language = listeners.languages().get(i);
            if (language == null || language.isBlank()) {
                LOG.warn("Skipping listener {}: no usable language", connection.id());
                skipped++;
                continue;
            }
            futures.add(CompletableFuture.supplyAsync(
                    () -> deliverOne(request, connection, language), deliveryExecutor));
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

        List<DeliveryOutcome> outcomes = new ArrayList<>(futures.size());
        futures.forEach(f -> outcomes.add(f.join()));
        DeliveryReport report = new DeliveryReport(outcomes, skipped);
        logLedger(report);
        return report;
    }

    private DeliveryOutcome deliverOne(DeliveryRequest request, ClientConnection connection, String language) {
        ClientSettings settings = settingsOf(request.settingsLookup(), connection);
        DeliveryMode mode = settings.deliveryMode();
        try {
            String text = request.batch().textFor(language, request.originalText());
            String ttsServiceType = settings.ttsServiceTypeOr(props.getDefaultTtsServiceType());

            String audioData = "";
            SpeechParams speechParams = null;
            long synthesisMs = 0;
            if (mode == DeliveryMode.SERVER_AUDIO) {
                long t0 = System.nanoTime();
                SynthesisResult synthesized = synthesizeOrEmpty(text, language, null);
                synthesisMs = TimeUtils.elapsedMillis(t0);
                if (synthesized.clientSpeech()) {
                    // provider handed rendering back to the browser
                    mode = DeliveryMode.CLIENT_SPEECH;
                } else {
                    audioData = synthesized.base64Audio();
                }
            }
            if (mode == DeliveryMode.CLIENT_SPEECH) {
                speechParams = SpeechParams.browserSpeech(text, language);
            }

            LatencyTrace.Breakdown latency = request.trace().withSynthesis(synthesisMs)
                    .complete(clock.millis());
            TranslationMessage message = new TranslationMessage(text, request.originalText(),
                    request.sourceLanguage(), language, ttsServiceType, latency, audioData,
                    mode == DeliveryMode.CLIENT_SPEECH, speechParams);

            BoundedRetry.Result result = retry.run("send to " + connection.id(), () -> connection.send(message));
            metrics.recordDeliveryAttempts(result.attempts());
            if (result.succeeded()) {
                metrics.incrementDeliverySuccess();
                persistTranslation(request, language, text, latency.totalMs());
                return DeliveryOutcome.delivered(connection.id(), language, mode, result.attempts());
            }
            metrics.incrementDeliveryFailure(result.retriesExhausted() ? "retries_exhausted" : "unexpected_error");
            return DeliveryOutcome.failed(connection.id(), language, mode, result.attempts(),
                    result.lastError() == null ? "unknown" : result.lastError().getMessage());
        } catch (RuntimeException e) {
            LOG.error("Delivery to {} failed before sending", connection.id(), e);
            metrics.incrementDeliveryFailure("unexpected_error");
            return DeliveryOutcome.failed(connection.id(), language, mode, 0, e.getMessage());
        }
    }

    private ClientSettings settingsOf(Function<ClientConnection, ClientSettings> lookup, ClientConnection connection) {
        ClientSettings settings = lookup.apply(connection);
        return settings == null ? ClientSettings.empty() : settings;
    }

    private SynthesisResult synthesizeOrEmpty(String text, String language, String voice) {
        try {
            SynthesisResult result = synthesisProvider.synthesize(text, language, voice);
            if (result != null) {
                return result;
            }
            LOG.warn("Synthesis for {} returned nothing, sending text only", language);
        } catch (ProviderException e) {
            LOG.warn("Synthesis for {} failed, sending text only: {}", language, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Synthesis for {} failed unexpectedly, sending text only", language, e);
        }
        return SynthesisResult.audio(new byte[0], null);
    }

    private static boolean isNonEmpty(String s) {
        return s != null && !s.isEmpty();
    }

    private void persistTranslation(DeliveryRequest request, String targetLanguage, String translated,
                                    long latencyMs) {
        if (!props.isPersistTranslations() || request.sessionId() == null) {
            return;
        }
        if (!isNonEmpty(request.sourceLanguage()) || !isNonEmpty(targetLanguage)) {
            LOG.warn("Skipping translation audit for session {}: invalid language pair '{}' -> '{}'",
                    request.sessionId(), request.sourceLanguage(), targetLanguage);
            return;
        }
        try {
            repository.addTranslation(new TranslationRecord(request.sessionId(), request.sourceLanguage(),
                    targetLanguage, request.originalText(), translated, latencyMs, clock.instant()));
        } catch (PersistenceException e) {
            LOG.warn("Could not persist translation for session {}: {}", request.sessionId(), e.getMessage());
        }
    }

    private void logLedger(DeliveryReport report) {
        if (report.allDelivered()) {
            LOG.info("Delivered to {}/{} listeners ({} skipped)", report.deliveredCount(), report.outcomes().size(),
                    report.skipped());
            return;
        }
        LOG.warn("Delivered to {}/{} listeners ({} skipped); failed after retries: {}", report.deliveredCount(),
                report.outcomes().size(), report.skipped(),
                report.outcomes().stream().filter(o -> !o.delivered()).map(DeliveryOutcome::connectionId).toList());
    }

    @Override
    public DeliveryReport broadcast(String sessionId, String text, String sourceLanguage, ListenerSnapshot listeners,
                                    Function<ClientConnection, ClientSettings> settingsLookup, LatencyTrace trace) {
        LOG.info("Broadcasting \"{}\" ({}) to {} listeners", LogSanitizer.preview(text, props.getLogPreviewLength()),
                sourceLanguage, listeners.size());
        recordTranscript(sessionId, sourceLanguage, text);

        List<String> targets = listeners.distinctLanguages().stream()
                .filter(l -> l != null && !l.isBlank())
                .toList();
        LatencyTrace prepared = trace.withPreparation(TimeUtils.elapsedMillis(trace.startNanos()));
        TranslationBatch batch = translateToMultipleLanguages(text, sourceLanguage, targets);
        LatencyTrace translated = prepared.withTranslation(batch.translationMs());

        DeliveryReport report = sendToListeners(new DeliveryRequest(sessionId, text, sourceLanguage, batch,
                listeners, settingsLookup, translated));
        recordBroadcast(sessionId, report);
        return report;
    }

    private void recordTranscript(String sessionId, String language, String text) {
        if (sessionId == null) {
            return;
        }
        try {
            repository.addTranscript(new TranscriptRecord(sessionId, language, text, clock.instant()));
        } catch (PersistenceException e) {
            LOG.warn("Could not persist transcript for session {}: {}", sessionId, e.getMessage());
        }
    }

    /**
     * Post-broadcast bookkeeping: adds the delivered count to totalDeliveries and refreshes
     * lastActivityAt. Runs only after every delivery settled.
     */
    void recordBroadcast(String sessionId, DeliveryReport report) {
        if (sessionId == null || report.outcomes().isEmpty()) {
            return;
        }
        try {
            repository.updateSession(sessionId, SessionUpdate.create()
                    .incrementTotalDeliveries(report.deliveredCount())
                    .lastActivityAt(clock.instant()));
        } catch (PersistenceException e) {
            LOG.warn("Could not record broadcast for session {}: {}", sessionId, e.getMessage());
        }
    }

    @Override
    public TtsResponseMessage synthesizeOnDemand(String text, String languageCode, String voice,
                                                 ClientSettings settings) {
        ClientSettings effective = settings == null ? ClientSettings.empty() : settings;
        String ttsServiceType = effective.ttsServiceTypeOr(props.getDefaultTtsServiceType());
        long now = clock.millis();
        if (!validateRequest(text, languageCode)) {
            return TtsResponseMessage.error(text, languageCode, ttsServiceType,
                    "Invalid TTS request: text and languageCode are required", now);
        }
        if (effective.deliveryMode() == DeliveryMode.CLIENT_SPEECH) {
            return TtsResponseMessage.clientSpeech(text, languageCode, ttsServiceType,
                    SpeechParams.browserSpeech(text, languageCode), now);
        }
        try {
            SynthesisResult result = synthesisProvider.synthesize(text, languageCode, voice);
            if (result.clientSpeech()) {
                return TtsResponseMessage.clientSpeech(text, languageCode, ttsServiceType,
                        SpeechParams.browserSpeech(text, languageCode), now);
            }
            if (!result.hasAudio()) {
                return TtsResponseMessage.error(text, languageCode, ttsServiceType,
                        "Speech synthesis produced no audio", now);
            }
            return TtsResponseMessage.audio(text, languageCode, ttsServiceType, result.base64Audio(), now);
        } catch (ProviderException e) {
            LOG.warn("On-demand synthesis for {} failed: {}", languageCode, e.getMessage());
            return TtsResponseMessage.error(text, languageCode, ttsServiceType,
                    "Speech synthesis failed: " + e.getMessage(), now);
        } catch (RuntimeException e) {
            LOG.error("On-demand synthesis for {} failed unexpectedly", languageCode, e);
            return TtsResponseMessage.error(text, languageCode, ttsServiceType,
                    "Speech synthesis failed: " + e.getMessage(), now);
        }
    }
}
