package com.phillippitts.livetranslate.service.dispatch.handler;

import com.phillippitts.livetranslate.domain.ClientSettings;
import com.phillippitts.livetranslate.domain.PersistedSession;
import com.phillippitts.livetranslate.domain.Role;
import com.phillippitts.livetranslate.protocol.outbound.ClassroomCodeMessage;
import com.phillippitts.livetranslate.protocol.outbound.RegisterAck;
import com.phillippitts.livetranslate.testutil.ClassroomHarness;
import com.phillippitts.livetranslate.testutil.RecordingConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RegisterHandlerTest {

    private static final String PRESENTER_REGISTER =
            "{\"type\":\"register\",\"role\":\"teacher\",\"languageCode\":\"en-US\",\"presenterId\":\"teacher-7\"}";

    private ClassroomHarness harness;

    @BeforeEach
    void setUp() {
        harness = new ClassroomHarness();
    }

    @Test
    void presenterWithoutLanguageGetsDefault() {
        RecordingConnection presenter = harness.open("p-1");

        harness.send(presenter, "{\"type\":\"register\",\"role\":\"presenter\"}");

        assertThat(presenter.lastOfType(RegisterAck.class).languageCode()).isEqualTo("en-US");
        assertThat(harness.registry.getRole(presenter)).isEqualTo(Role.PRESENTER);
    }

    @Test
    void registerStoresSettings() {
        RecordingConnection listener = harness.open("l-1");

        harness.send(listener, "{\"type\":\"register\",\"role\":\"student\",\"languageCode\":\"es\","
                + "\"settings\":{\"useClientSpeech\":true}}");

        RegisterAck ack = listener.lastOfType(RegisterAck.class);
        assertThat(ack.role()).isEqualTo(Role.LISTENER);
        assertThat(ack.settings()).isEqualTo(new ClientSettings(null, true));
        assertThat(harness.registry.getSettings(listener).useClientSpeech()).isTrue();
    }

    @Test
    void listenerWithoutCodeIsAcknowledgedButJoinsNothing() {
        RecordingConnection listener = harness.open("l-1");

        harness.send(listener, "{\"type\":\"register\",\"role\":\"student\",\"languageCode\":\"es\"}");

        assertThat(listener.lastOfType(RegisterAck.class).languageCode()).isEqualTo("es");
        assertThat(harness.registry.getSessionId(listener)).isEqualTo("l-1");
        assertThat(harness.repository.findActiveSessions()).isEmpty();
    }

    @Test
    void reconnectingPresenterReclaimsActiveSessionAndCode() {
        RecordingConnection first = harness.open("p-1");
        harness.send(first, PRESENTER_REGISTER);
        String code = first.lastOfType(ClassroomCodeMessage.class).code();
        harness.registerListener(harness.open("l-1", code), "es", code);
        assertThat(harness.repository.getSessionById("p-1").orElseThrow().presenterId()).isEqualTo("teacher-7");

        harness.connections.onClose(first, 1001);
        RecordingConnection second = harness.open("p-2");
        harness.send(second, PRESENTER_REGISTER);

        ClassroomCodeMessage restored = second.lastOfType(ClassroomCodeMessage.class);
        assertThat(restored.code()).isEqualTo(code);
        assertThat(restored.sessionId()).isEqualTo("p-1");
        assertThat(harness.registry.getSessionId(second)).isEqualTo("p-1");
        assertThat(harness.registry.getPresenters("p-1")).containsExactly(second);
    }

    @Test
    void presenterReactivatesRecentlyEndedSession() {
        RecordingConnection first = harness.open("p-1");
        harness.send(first, PRESENTER_REGISTER);
        String code = first.lastOfType(ClassroomCodeMessage.class).code();
        harness.registerListener(harness.open("l-1", code), "es", code);
        harness.lifecycle.endSession("p-1", "test");
        harness.clock.advance(Duration.ofMinutes(5));

        RecordingConnection second = harness.open("p-2");
        harness.send(second, PRESENTER_REGISTER);

        PersistedSession session = harness.repository.getSessionById("p-1").orElseThrow();
        assertThat(session.active()).isTrue();
        assertThat(session.endTime()).isNull();
        assertThat(second.lastOfType(ClassroomCodeMessage.class).code()).isEqualTo(code);
    }

    @Test
    void sessionEndedOutsideWindowIsNotReclaimed() {
        RecordingConnection first = harness.open("p-1");
        harness.send(first, PRESENTER_REGISTER);
        String code = first.lastOfType(ClassroomCodeMessage.class).code();
        harness.registerListener(harness.open("l-1", code), "es", code);
        harness.lifecycle.endSession("p-1", "test");
        harness.clock.advance(Duration.ofMinutes(11));

        RecordingConnection second = harness.open("p-2");
        harness.send(second, PRESENTER_REGISTER);

        assertThat(harness.repository.getSessionById("p-1").orElseThrow().active()).isFalse();
        assertThat(second.lastOfType(ClassroomCodeMessage.class).sessionId()).isEqualTo("p-2");
    }

    @Test
    void reclaimEndsDuplicateSessionsInSameLanguage() {
        harness.repository.createSession(PersistedSession.started("old-room", "en-US", "es", null, 1,
                harness.clock.instant()));
        RecordingConnection first = harness.open("p-1");
        harness.send(first, PRESENTER_REGISTER);
        String code = first.lastOfType(ClassroomCodeMessage.class).code();
        harness.registerListener(harness.open("l-1", code), "es", code);

        harness.connections.onClose(first, 1001);
        harness.send(harness.open("p-2"), PRESENTER_REGISTER);

        assertThat(harness.repository.getSessionById("old-room").orElseThrow().active()).isFalse();
        assertThat(harness.repository.getSessionById("p-1").orElseThrow().active()).isTrue();
    }
}
