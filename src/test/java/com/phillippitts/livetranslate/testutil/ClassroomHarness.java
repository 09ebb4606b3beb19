package com.phillippitts.livetranslate.testutil;

import com.phillippitts.livetranslate.config.properties.ClassroomProperties;
import com.phillippitts.livetranslate.config.properties.DeliveryProperties;
import com.phillippitts.livetranslate.config.properties.SessionLifecycleProperties;
import com.phillippitts.livetranslate.protocol.inbound.InboundMessage;
import com.phillippitts.livetranslate.protocol.outbound.ClassroomCodeMessage;
import com.phillippitts.livetranslate.service.classroom.ClassroomSessionDirectory;
import com.phillippitts.livetranslate.service.delivery.DefaultTranslationFanoutService;
import com.phillippitts.livetranslate.service.dispatch.ConnectionCloser;
import com.phillippitts.livetranslate.service.dispatch.ConnectionLifecycle;
import com.phillippitts.livetranslate.service.dispatch.MessageHandler;
import com.phillippitts.livetranslate.service.dispatch.MessageRouter;
import com.phillippitts.livetranslate.service.dispatch.handler.AudioHandler;
import com.phillippitts.livetranslate.service.dispatch.handler.PingHandler;
import com.phillippitts.livetranslate.service.dispatch.handler.PongHandler;
import com.phillippitts.livetranslate.service.dispatch.handler.RegisterHandler;
import com.phillippitts.livetranslate.service.dispatch.handler.SettingsHandler;
import com.phillippitts.livetranslate.service.dispatch.handler.TranscriptionHandler;
import com.phillippitts.livetranslate.service.dispatch.handler.TtsRequestHandler;
import com.phillippitts.livetranslate.service.lifecycle.SessionLifecycleService;
import com.phillippitts.livetranslate.service.metrics.LiveTranslateMetrics;
import com.phillippitts.livetranslate.service.persistence.InMemorySessionRepository;
import com.phillippitts.livetranslate.service.registry.ConnectionRegistry;
import com.phillippitts.livetranslate.service.synthesis.SilentWavSynthesisProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.scheduling.TaskScheduler;

import java.util.List;

import static org.mockito.Mockito.mock;

/**
 * Fully wired message pipeline over in-memory collaborators: synchronous executors, a mutable
 * clock and a mock {@link TaskScheduler} so delayed closes can be inspected and run by hand.
 */
public class ClassroomHarness {

    public final MutableClock clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
    public final ClassroomProperties classroomProps = new ClassroomProperties();
    public final DeliveryProperties deliveryProps = new DeliveryProperties();
    public final SessionLifecycleProperties lifecycleProps = new SessionLifecycleProperties();
    public final FakeTranslationProvider translator = new FakeTranslationProvider()
            .translating("es", "Hola")
            .translating("fr", "Bonjour");
    public final TaskScheduler scheduler = mock(TaskScheduler.class);

    public final ConnectionRegistry registry = new ConnectionRegistry(deliveryProps);
    public final ClassroomSessionDirectory directory = new ClassroomSessionDirectory(classroomProps, clock);
    public final InMemorySessionRepository repository = new InMemorySessionRepository();
    public final SessionLifecycleService lifecycle = new SessionLifecycleService(repository, clock);
    public final DefaultTranslationFanoutService fanout = new DefaultTranslationFanoutService(translator,
            new SilentWavSynthesisProvider(), new SyncExecutor(), new SyncExecutor(), repository, deliveryProps,
            new LiveTranslateMetrics(new SimpleMeterRegistry()), clock);
    public final ConnectionCloser closer = new ConnectionCloser(scheduler, clock, classroomProps);
    public final ConnectionLifecycle connections = new ConnectionLifecycle(registry, directory, lifecycle, closer,
            clock);
    public final MessageRouter router;

    public ClassroomHarness() {
        List<MessageHandler<? extends InboundMessage>> handlers = List.of(
                new RegisterHandler(deliveryProps, lifecycleProps),
                new TranscriptionHandler(deliveryProps),
                new TtsRequestHandler(),
                new AudioHandler(deliveryProps),
                new SettingsHandler(),
                new PingHandler(clock),
                new PongHandler());
        router = new MessageRouter(handlers, registry, directory, repository, fanout, lifecycle, closer);
    }

    /** Opens a connection without a classroom code on its URL. */
    public RecordingConnection open(String id) {
        return open(id, null);
    }

    public RecordingConnection open(String id, String classroomCode) {
        RecordingConnection connection = new RecordingConnection(id);
        connections.onOpen(connection, classroomCode);
        return connection;
    }

    public void send(RecordingConnection connection, String frame) {
        router.route(connection, frame);
    }

    /** Registers a presenter and returns the classroom code it was given. */
    public String registerPresenter(RecordingConnection presenter, String language) {
        send(presenter, "{\"type\":\"register\",\"role\":\"teacher\",\"languageCode\":\"" + language + "\"}");
        return presenter.lastOfType(ClassroomCodeMessage.class).code();
    }

    public void registerListener(RecordingConnection listener, String language, String classroomCode) {
        send(listener, "{\"type\":\"register\",\"role\":\"student\",\"languageCode\":\"" + language
                + "\",\"classroomCode\":\"" + classroomCode + "\",\"name\":\"Ana\"}");
    }
}
