package com.phillippitts.livetranslate.service.delivery;

import com.phillippitts.livetranslate.config.properties.DeliveryProperties;
import com.phillippitts.livetranslate.domain.ClientSettings;
import com.phillippitts.livetranslate.domain.DeliveryMode;
import com.phillippitts.livetranslate.domain.LatencyTrace;
import com.phillippitts.livetranslate.domain.PersistedSession;
import com.phillippitts.livetranslate.domain.SpeechParams;
import com.phillippitts.livetranslate.exception.ProviderException;
import com.phillippitts.livetranslate.protocol.outbound.TranslationMessage;
import com.phillippitts.livetranslate.protocol.outbound.TtsResponseMessage;
import com.phillippitts.livetranslate.service.metrics.LiveTranslateMetrics;
import com.phillippitts.livetranslate.service.persistence.InMemorySessionRepository;
import com.phillippitts.livetranslate.service.registry.ClientConnection;
import com.phillippitts.livetranslate.service.registry.ListenerSnapshot;
import com.phillippitts.livetranslate.service.synthesis.SilentWavSynthesisProvider;
import com.phillippitts.livetranslate.service.synthesis.SpeechSynthesisProvider;
import com.phillippitts.livetranslate.service.synthesis.SynthesisResult;
import com.phillippitts.livetranslate.testutil.FakeTranslationProvider;
import com.phillippitts.livetranslate.testutil.MutableClock;
import com.phillippitts.livetranslate.testutil.RecordingConnection;
import com.phillippitts.livetranslate.testutil.SyncExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DefaultTranslationFanoutServiceTest {

    private static final String SESSION = "session-1-1000";

    private FakeTranslationProvider translator;
    private InMemorySessionRepository repository;
    private DeliveryProperties props;
    private MeterRegistry meters;
    private MutableClock clock;
    private final Map<ClientConnection, ClientSettings> settings = new HashMap<>();

    @BeforeEach
    void setUp() {
        translator = new FakeTranslationProvider().translating("es", "Hola").translating("fr", "Bonjour");
        repository = new InMemorySessionRepository();
        props = new DeliveryProperties();
        meters = new SimpleMeterRegistry();
        clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
    }

    private DefaultTranslationFanoutService service() {
        return service(new SilentWavSynthesisProvider());
    }

    private DefaultTranslationFanoutService service(SpeechSynthesisProvider synthesis) {
        return new DefaultTranslationFanoutService(translator, synthesis, new SyncExecutor(), new SyncExecutor(),
                repository, props, new LiveTranslateMetrics(meters), clock);
    }

    private Function<ClientConnection, ClientSettings> settingsLookup() {
        return c -> settings.getOrDefault(c, ClientSettings.empty());
    }

    private static ListenerSnapshot listeners(Object... connectionAndLanguage) {
        ClientConnection[] connections = new ClientConnection[connectionAndLanguage.length / 2];
        String[] languages = new String[connections.length];
        for (int i = 0; i < connections.length; i++) {
            connections[i] = (ClientConnection) connectionAndLanguage[2 * i];
            languages[i] = (String) connectionAndLanguage[2 * i + 1];
        }
        return new ListenerSnapshot(Arrays.asList(connections), Arrays.asList(languages));
    }

    @Test
    void broadcastsTranslationToEachListenerLanguage() {
        RecordingConnection spanish = new RecordingConnection("l-es");
        RecordingConnection french = new RecordingConnection("l-fr");

        DeliveryReport report = service().broadcast(SESSION, "Hello", "en-US",
                listeners(spanish, "es", french, "fr"), settingsLookup(), LatencyTrace.begin());

        TranslationMessage toSpanish = spanish.lastOfType(TranslationMessage.class);
        TranslationMessage toFrench = french.lastOfType(TranslationMessage.class);
        assertThat(toSpanish.text()).isEqualTo("Hola");
        assertThat(toSpanish.originalText()).isEqualTo("Hello");
        assertThat(toSpanish.targetLanguage()).isEqualTo("es");
        assertThat(toFrench.text()).isEqualTo("Bonjour");
        assertThat(toFrench.targetLanguage()).isEqualTo("fr");
        assertThat(toSpanish.latency().componentSum()).isEqualTo(toSpanish.latency().totalMs());
        assertThat(toSpanish.latency().serverCompleteTime()).isEqualTo(clock.millis());
        assertThat(report.deliveredCount()).isEqualTo(2);
        assertThat(report.allDelivered()).isTrue();
    }

    @Test
    void retriesFailedSendUntilThirdAttemptSucceeds() {
        RecordingConnection flaky = new RecordingConnection("l-flaky").failNextSends(2);

        DeliveryReport report = service().broadcast(SESSION, "Hello", "en-US", listeners(flaky, "es"),
                settingsLookup(), LatencyTrace.begin());

        DeliveryOutcome outcome = report.outcomeFor("l-flaky").orElseThrow();
        assertThat(outcome.delivered()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(flaky.sendCalls()).isEqualTo(3);
        assertThat(flaky.sentOfType(TranslationMessage.class)).hasSize(1);
    }

    @Test
    void recordsTerminalFailureWithoutAffectingOtherListeners() {
        RecordingConnection dead = new RecordingConnection("l-dead").failAllSends();
        RecordingConnection healthy = new RecordingConnection("l-ok");

        DeliveryReport report = service().broadcast(SESSION, "Hello", "en-US",
                listeners(dead, "es", healthy, "es"), settingsLookup(), LatencyTrace.begin());

        DeliveryOutcome failed = report.outcomeFor("l-dead").orElseThrow();
        assertThat(failed.delivered()).isFalse();
        assertThat(failed.attempts()).isEqualTo(3);
        assertThat(failed.error()).contains("scripted failure");
        assertThat(report.outcomeFor("l-ok").orElseThrow().delivered()).isTrue();
        assertThat(report.failedCount()).isEqualTo(1);
        assertThat(meters.find("livetranslate.delivery.failure").tag("reason", "retries_exhausted").counter()
                .count()).isEqualTo(1.0);
    }

    @Test
    void skipsListenersWithBlankLanguage() {
        RecordingConnection blank = new RecordingConnection("l-blank");
        RecordingConnection spanish = new RecordingConnection("l-es");

        DeliveryReport report = service().broadcast(SESSION, "Hello", "en-US",
                listeners(blank, " ", spanish, "es"), settingsLookup(), LatencyTrace.begin());

        assertThat(report.skipped()).isEqualTo(1);
        assertThat(report.outcomes()).hasSize(1);
        assertThat(blank.sent()).isEmpty();
        assertThat(translator.requestedTargets()).containsExactly("es");
    }

    @Test
    void failedTranslationFallsBackToOriginalText() {
        translator.failingFor("fr");
        RecordingConnection french = new RecordingConnection("l-fr");
        RecordingConnection spanish = new RecordingConnection("l-es");

        DeliveryReport report = service().broadcast(SESSION, "Hello", "en-US",
                listeners(french, "fr", spanish, "es"), settingsLookup(), LatencyTrace.begin());

        assertThat(french.lastOfType(TranslationMessage.class).text()).isEqualTo("Hello");
        assertThat(spanish.lastOfType(TranslationMessage.class).text()).isEqualTo("Hola");
        assertThat(report.allDelivered()).isTrue();
        assertThat(meters.find("livetranslate.translation.fallback").tag("language", "fr").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void translatesEachDistinctLanguageOnce() {
        TranslationBatch batch = service().translateToMultipleLanguages("Hello", "en-US",
                Arrays.asList("es", "es", null, "", "fr"));

        assertThat(batch.translations()).containsOnlyKeys("es", "fr");
        assertThat(translator.requestedTargets()).containsExactlyInAnyOrder("es", "fr");
        assertThat(batch.fallbacks()).isEmpty();
    }

    @Test
    void sameBaseLanguageSkipsProvider() {
        TranslationBatch batch = service().translateToMultipleLanguages("Hello", "en-US", List.of("en-GB"));

        assertThat(batch.textFor("en-GB", "Hello")).isEqualTo("Hello");
        assertThat(translator.requestedTargets()).isEmpty();
    }

    @Test
    void deliveryModeFollowsListenerSettings() {
        RecordingConnection browser = new RecordingConnection("l-browser");
        RecordingConnection silent = new RecordingConnection("l-silent");
        RecordingConnection server = new RecordingConnection("l-server");
        settings.put(browser, new ClientSettings(null, true));
        settings.put(silent, new ClientSettings("none", false));

        DeliveryReport report = service().broadcast(SESSION, "Hello", "en-US",
                listeners(browser, "es", silent, "es", server, "es"), settingsLookup(), LatencyTrace.begin());

        TranslationMessage toBrowser = browser.lastOfType(TranslationMessage.class);
        assertThat(toBrowser.useClientSpeech()).isTrue();
        assertThat(toBrowser.speechParams().text()).isEqualTo("Hola");
        assertThat(toBrowser.audioData()).isEmpty();

        TranslationMessage toSilent = silent.lastOfType(TranslationMessage.class);
        assertThat(toSilent.speechParams()).isNull();
        assertThat(toSilent.audioData()).isEmpty();
        assertThat(toSilent.ttsServiceType()).isEqualTo("none");

        TranslationMessage toServer = server.lastOfType(TranslationMessage.class);
        assertThat(toServer.audioData()).isNotEmpty();
        assertThat(toServer.ttsServiceType()).isEqualTo("openai");

        assertThat(report.outcomeFor("l-browser").orElseThrow().mode()).isEqualTo(DeliveryMode.CLIENT_SPEECH);
        assertThat(report.outcomeFor("l-silent").orElseThrow().mode()).isEqualTo(DeliveryMode.SILENT);
        assertThat(report.outcomeFor("l-server").orElseThrow().mode()).isEqualTo(DeliveryMode.SERVER_AUDIO);
    }

    @Test
    void synthesisFailureStillDeliversText() {
        SpeechSynthesisProvider broken = mock(SpeechSynthesisProvider.class);
        when(broken.synthesize(any(), any(), any())).thenThrow(new ProviderException("engine down", "mock"));
        RecordingConnection listener = new RecordingConnection("l-es");

        DeliveryReport report = service(broken).broadcast(SESSION, "Hello", "en-US", listeners(listener, "es"),
                settingsLookup(), LatencyTrace.begin());

        TranslationMessage message = listener.lastOfType(TranslationMessage.class);
        assertThat(message.text()).isEqualTo("Hola");
        assertThat(message.audioData()).isEmpty();
        assertThat(report.allDelivered()).isTrue();
    }

    @Test
    void providerAskingForClientSpeechSendsSpeechInstructions() {
        SpeechSynthesisProvider browserOnly = mock(SpeechSynthesisProvider.class);
        when(browserOnly.synthesize(any(), any(), any())).thenReturn(SynthesisResult.clientSpeechMarker());
        RecordingConnection listener = new RecordingConnection("l-es");

        DeliveryReport report = service(browserOnly).broadcast(SESSION, "Hello", "en-US",
                listeners(listener, "es"), settingsLookup(), LatencyTrace.begin());

        TranslationMessage message = listener.lastOfType(TranslationMessage.class);
        assertThat(message.audioData()).isEmpty();
        assertThat(message.useClientSpeech()).isTrue();
        assertThat(message.speechParams()).isEqualTo(SpeechParams.browserSpeech("Hola", "es"));
        assertThat(report.outcomeFor("l-es").orElseThrow().mode()).isEqualTo(DeliveryMode.CLIENT_SPEECH);
    }

    @Test
    void broadcastRecordsTranscriptAndDeliveries() {
        repository.createSession(PersistedSession.started(SESSION, "en-US", "es", "AB12CD", 2, clock.instant()));
        clock.advanceMillis(5_000);

        service().broadcast(SESSION, "Hello", "en-US",
                listeners(new RecordingConnection("a"), "es", new RecordingConnection("b"), "fr"),
                settingsLookup(), LatencyTrace.begin());

        PersistedSession session = repository.getSessionById(SESSION).orElseThrow();
        assertThat(session.totalDeliveries()).isEqualTo(2);
        assertThat(session.lastActivityAt()).isEqualTo(clock.instant());
        assertThat(repository.getTranscripts(SESSION)).hasSize(1);
        assertThat(repository.getTranslations(SESSION)).isEmpty();
    }

    @Test
    void persistsTranslationsWhenEnabled() {
        props.setPersistTranslations(true);

        service().broadcast(SESSION, "Hello", "en-US", listeners(new RecordingConnection("a"), "es"),
                settingsLookup(), LatencyTrace.begin());

        assertThat(repository.getTranslations(SESSION)).singleElement()
                .satisfies(r -> {
                    assertThat(r.targetLanguage()).isEqualTo("es");
                    assertThat(r.translatedText()).isEqualTo("Hola");
                });
    }

    @Test
    void translationAuditSkipsBlankSourceLanguage() {
        props.setPersistTranslations(true);
        RecordingConnection listener = new RecordingConnection("a");

        DeliveryReport report = service().broadcast(SESSION, "Hello", "", listeners(listener, "es"),
                settingsLookup(), LatencyTrace.begin());

        assertThat(report.allDelivered()).isTrue();
        assertThat(listener.lastOfType(TranslationMessage.class).text()).isEqualTo("Hola");
        assertThat(repository.getTranslations(SESSION)).isEmpty();
    }

    @Test
    void broadcastWithoutListenersTouchesNothing() {
        repository.createSession(PersistedSession.started(SESSION, "en-US", "es", null, 1, clock.instant()));

        DeliveryReport report = service().broadcast(SESSION, "Hello", "en-US", ListenerSnapshot.empty(),
                settingsLookup(), LatencyTrace.begin());

        assertThat(report.outcomes()).isEmpty();
        assertThat(repository.getSessionById(SESSION).orElseThrow().totalDeliveries()).isZero();
    }

    @Test
    void parallelDeliveryWaitsForEveryListener() {
        ExecutorService translationPool = Executors.newFixedThreadPool(4);
        ExecutorService deliveryPool = Executors.newFixedThreadPool(4);
        DefaultTranslationFanoutService parallel = new DefaultTranslationFanoutService(translator,
                new SilentWavSynthesisProvider(), translationPool, deliveryPool, repository, props,
                new LiveTranslateMetrics(meters), clock);
        RecordingConnection[] connections = new RecordingConnection[12];
        Object[] pairs = new Object[24];
        for (int i = 0; i < connections.length; i++) {
            connections[i] = new RecordingConnection("l-" + i).failNextSends(i % 3);
            pairs[2 * i] = connections[i];
            pairs[2 * i + 1] = i % 2 == 0 ? "es" : "fr";
        }

        DeliveryReport report = parallel.broadcast(SESSION, "Hello", "en-US", listeners(pairs), settingsLookup(),
                LatencyTrace.begin());

        assertThat(report.deliveredCount()).isEqualTo(12);
        for (RecordingConnection connection : connections) {
            assertThat(connection.sentOfType(TranslationMessage.class)).hasSize(1);
        }
        translationPool.shutdown();
        deliveryPool.shutdown();
    }

    @Test
    void validatesTextAndLanguage() {
        DefaultTranslationFanoutService service = service();

        assertThat(service.validateRequest("Hello", "en")).isTrue();
        assertThat(service.validateRequest("   ", "en")).isFalse();
        assertThat(service.validateRequest(null, "en")).isFalse();
        assertThat(service.validateRequest("Hello", "")).isFalse();
    }

    @Test
    void onDemandSynthesisRejectsInvalidRequest() {
        TtsResponseMessage response = service().synthesizeOnDemand("", "es", null, ClientSettings.empty());

        assertThat(response.success()).isFalse();
        assertThat(response.errorMessage()).isEqualTo("Invalid TTS request: text and languageCode are required");
    }

    @Test
    void onDemandSynthesisReturnsAudio() {
        TtsResponseMessage response = service().synthesizeOnDemand("Hola", "es", null, null);

        assertThat(response.success()).isTrue();
        assertThat(response.audioData()).isNotEmpty();
        assertThat(response.timestamp()).isEqualTo(clock.millis());
    }

    @Test
    void onDemandSynthesisHonoursClientSpeech() {
        TtsResponseMessage response = service().synthesizeOnDemand("Hola", "es", null,
                new ClientSettings(null, true));

        assertThat(response.success()).isTrue();
        assertThat(response.speechParams()).isNotNull();
        assertThat(response.audioData()).isNull();
    }

    @Test
    void onDemandSynthesisReportsProviderFailure() {
        SpeechSynthesisProvider broken = mock(SpeechSynthesisProvider.class);
        when(broken.synthesize(any(), any(), any())).thenThrow(new ProviderException("quota exceeded", "mock"));

        TtsResponseMessage response = service(broken).synthesizeOnDemand("Hola", "es", "alloy", null);

        assertThat(response.success()).isFalse();
        assertThat(response.errorMessage()).startsWith("Speech synthesis failed:").contains("quota exceeded");
    }

    @Test
    void onDemandSynthesisContainsUnexpectedFailure() {
        SpeechSynthesisProvider crashing = mock(SpeechSynthesisProvider.class);
        when(crashing.synthesize(any(), any(), any())).thenThrow(new IllegalStateException("native crash"));

        TtsResponseMessage response = service(crashing).synthesizeOnDemand("Hello", "es", null,
                ClientSettings.empty());

        assertThat(response.success()).isFalse();
        assertThat(response.errorMessage()).contains("native crash");
    }
}
