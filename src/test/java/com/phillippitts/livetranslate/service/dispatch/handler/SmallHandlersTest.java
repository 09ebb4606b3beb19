package com.phillippitts.livetranslate.service.dispatch.handler;

import com.phillippitts.livetranslate.domain.ClientSettings;
import com.phillippitts.livetranslate.protocol.inbound.AudioMessage;
import com.phillippitts.livetranslate.protocol.inbound.PingMessage;
import com.phillippitts.livetranslate.protocol.inbound.SettingsMessage;
import com.phillippitts.livetranslate.protocol.inbound.TranscriptionMessage;
import com.phillippitts.livetranslate.protocol.inbound.TtsRequestMessage;
import com.phillippitts.livetranslate.protocol.outbound.PongReply;
import com.phillippitts.livetranslate.protocol.outbound.SettingsAck;
import com.phillippitts.livetranslate.protocol.outbound.TranslationMessage;
import com.phillippitts.livetranslate.protocol.outbound.TtsResponseMessage;
import com.phillippitts.livetranslate.service.dispatch.HandlerContext;
import com.phillippitts.livetranslate.testutil.ClassroomHarness;
import com.phillippitts.livetranslate.testutil.RecordingConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SmallHandlersTest {

    private ClassroomHarness harness;

    @BeforeEach
    void setUp() {
        harness = new ClassroomHarness();
    }

    private HandlerContext contextFor(RecordingConnection connection) {
        return harness.router.contextFor(connection);
    }

    @Test
    void pingEchoesOriginalTimestamp() {
        RecordingConnection connection = harness.open("c-1");

        new PingHandler(harness.clock).handle(new PingMessage(1234L), contextFor(connection));

        PongReply pong = connection.lastOfType(PongReply.class);
        assertThat(pong.timestamp()).isEqualTo(harness.clock.millis());
        assertThat(pong.originalTimestamp()).isEqualTo(1234L);
    }

    @Test
    void pingWithoutTimestamp() {
        RecordingConnection connection = harness.open("c-1");

        new PingHandler(harness.clock).handle(new PingMessage(null), contextFor(connection));

        assertThat(connection.lastOfType(PongReply.class).originalTimestamp()).isNull();
    }

    @Test
    void settingsAreMergedAndEchoed() {
        RecordingConnection connection = harness.open("c-1");
        SettingsHandler handler = new SettingsHandler();

        handler.handle(new SettingsMessage(new ClientSettings("google", null)), contextFor(connection));
        handler.handle(new SettingsMessage(new ClientSettings(null, true)), contextFor(connection));

        SettingsAck ack = connection.lastOfType(SettingsAck.class);
        assertThat(ack.settings()).isEqualTo(new ClientSettings("google", true));
        assertThat(harness.registry.getSettings(connection)).isEqualTo(ack.settings());
    }

    @Test
    void transcriptionFromListenerIsIgnored() {
        RecordingConnection presenter = harness.open("p-1");
        String code = harness.registerPresenter(presenter, "en-US");
        RecordingConnection listener = harness.open("l-1", code);
        harness.registerListener(listener, "es", code);
        int before = listener.sent().size();

        new TranscriptionHandler(harness.deliveryProps)
                .handle(new TranscriptionMessage("Hello"), contextFor(listener));

        assertThat(listener.sent()).hasSize(before);
        assertThat(listener.sentOfType(TranslationMessage.class)).isEmpty();
        assertThat(harness.repository.getTranscripts("p-1")).isEmpty();
    }

    @Test
    void ttsRequestRespectsConnectionSettings() {
        RecordingConnection connection = harness.open("c-1");
        harness.registry.setSettings(connection, new ClientSettings(null, true));

        new TtsRequestHandler().handle(new TtsRequestMessage("Hola", "es", null), contextFor(connection));

        TtsResponseMessage response = connection.lastOfType(TtsResponseMessage.class);
        assertThat(response.success()).isTrue();
        assertThat(response.speechParams().languageCode()).isEqualTo("es");
    }

    @Test
    void invalidTtsRequestIsAnsweredWithError() {
        RecordingConnection connection = harness.open("c-1");

        new TtsRequestHandler().handle(new TtsRequestMessage(null, "es", null), contextFor(connection));

        TtsResponseMessage response = connection.lastOfType(TtsResponseMessage.class);
        assertThat(response.success()).isFalse();
        assertThat(response.toJson().getJSONObject("error").getString("code")).isEqualTo("TTS_ERROR");
    }

    @Test
    void audioIsAcceptedSilently() {
        RecordingConnection presenter = harness.open("p-1");
        harness.registerPresenter(presenter, "en-US");
        int before = presenter.sent().size();

        new AudioHandler(harness.deliveryProps).handle(new AudioMessage("a".repeat(500)), contextFor(presenter));
        new AudioHandler(harness.deliveryProps).handle(new AudioMessage("tiny"), contextFor(presenter));

        assertThat(presenter.sent()).hasSize(before);
    }
}
