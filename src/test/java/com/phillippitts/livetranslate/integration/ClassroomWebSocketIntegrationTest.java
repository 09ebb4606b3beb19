package com.phillippitts.livetranslate.integration;

import com.phillippitts.livetranslate.protocol.MessageCodec;
import com.phillippitts.livetranslate.service.persistence.SessionRepository;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Presenter and listeners over real sockets: register, join by code, broadcast.
 */
@Tag("integration")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ClassroomWebSocketIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private SessionRepository repository;

    private final List<WebSocketSession> opened = new ArrayList<>();

    @AfterEach
    void closeSockets() throws Exception {
        for (WebSocketSession session : opened) {
            if (session.isOpen()) {
                session.close();
            }
        }
    }

    @Test
    void presenterTranscriptionReachesListener() throws Exception {
        CollectingHandler presenter = new CollectingHandler();
        WebSocketSession presenterSocket = connect("", presenter);
        presenterSocket.sendMessage(new TextMessage(
                "{\"type\":\"register\",\"role\":\"teacher\",\"languageCode\":\"en-US\"}"));

        await().atMost(5, SECONDS).until(() -> presenter.firstOfType("classroom_code").isPresent());
        JSONObject classroom = presenter.firstOfType("classroom_code").orElseThrow();
        String code = classroom.getString("code");
        String sessionId = classroom.getString("sessionId");

        CollectingHandler listener = new CollectingHandler();
        WebSocketSession listenerSocket = connect("?class=" + code, listener);
        listenerSocket.sendMessage(new TextMessage(
                "{\"type\":\"register\",\"role\":\"student\",\"languageCode\":\"es\",\"name\":\"Ana\"}"));

        await().atMost(5, SECONDS).until(() -> presenter.firstOfType("student_joined").isPresent());
        assertThat(repository.getSessionById(sessionId)).hasValueSatisfying(s ->
                assertThat(s.listenerCount()).isEqualTo(1));

        presenterSocket.sendMessage(new TextMessage("{\"type\":\"transcription\",\"text\":\"Hello class\"}"));

        await().atMost(5, SECONDS).until(() -> listener.firstOfType("translation").isPresent());
        JSONObject translation = listener.firstOfType("translation").orElseThrow();
        assertThat(translation.getString("originalText")).isEqualTo("Hello class");
        assertThat(translation.getString("targetLanguage")).isEqualTo("es");
        assertThat(translation.getJSONObject("latency").has("components")).isTrue();
        byte[] wav = Base64.getDecoder().decode(translation.getString("audioData"));
        assertThat(new String(wav, 0, 4, StandardCharsets.US_ASCII)).isEqualTo("RIFF");
        assertThat(listener.closeStatus).isNull();
    }

    @Test
    void clientSpeechListenerGetsSpeechInstructions() throws Exception {
        CollectingHandler presenter = new CollectingHandler();
        WebSocketSession presenterSocket = connect("", presenter);
        presenterSocket.sendMessage(new TextMessage(
                "{\"type\":\"register\",\"role\":\"teacher\",\"languageCode\":\"en-US\"}"));
        await().atMost(5, SECONDS).until(() -> presenter.firstOfType("classroom_code").isPresent());
        String code = presenter.firstOfType("classroom_code").orElseThrow().getString("code");

        CollectingHandler listener = new CollectingHandler();
        WebSocketSession listenerSocket = connect("?class=" + code, listener);
        listenerSocket.sendMessage(new TextMessage("{\"type\":\"register\",\"role\":\"student\","
                + "\"languageCode\":\"fr\",\"settings\":{\"useClientSpeech\":true}}"));
        await().atMost(5, SECONDS).until(() -> presenter.firstOfType("student_joined").isPresent());

        presenterSocket.sendMessage(new TextMessage("{\"type\":\"transcription\",\"text\":\"Good morning\"}"));

        await().atMost(5, SECONDS).until(() -> listener.firstOfType("translation").isPresent());
        JSONObject translation = listener.firstOfType("translation").orElseThrow();
        assertThat(translation.getBoolean("useClientSpeech")).isTrue();
        assertThat(translation.getJSONObject("speechParams").getString("type")).isEqualTo("browser-speech");
        assertThat(translation.getString("audioData")).isEmpty();
    }

    @Test
    void largeAudioFrameKeepsPresenterConnected() throws Exception {
        CollectingHandler presenter = new CollectingHandler();
        WebSocketSession presenterSocket = connect("", presenter);
        presenterSocket.sendMessage(new TextMessage(
                "{\"type\":\"register\",\"role\":\"teacher\",\"languageCode\":\"en-US\"}"));
        await().atMost(5, SECONDS).until(() -> presenter.firstOfType("classroom_code").isPresent());

        presenterSocket.sendMessage(new TextMessage(
                "{\"type\":\"audio\",\"data\":\"" + "A".repeat(20_000) + "\"}"));
        presenterSocket.sendMessage(new TextMessage("{\"type\":\"ping\",\"timestamp\":7}"));

        await().atMost(5, SECONDS).until(() -> presenter.firstOfType("pong").isPresent());
        assertThat(presenter.closeStatus).isNull();
        assertThat(presenterSocket.isOpen()).isTrue();
    }

    @Test
    void invalidClassroomCodeIsRejectedAndClosed() throws Exception {
        CollectingHandler listener = new CollectingHandler();
        connect("?class=AB12CD", listener);

        await().atMost(5, SECONDS).until(() -> listener.closeStatus != null);
        JSONObject error = listener.firstOfType("error").orElseThrow();
        assertThat(error.getString("code")).isEqualTo("INVALID_CLASSROOM");
        assertThat(listener.closeStatus.getCode()).isEqualTo(CloseStatus.POLICY_VIOLATION.getCode());
    }

    @Test
    void pingIsAnswered() throws Exception {
        CollectingHandler client = new CollectingHandler();
        WebSocketSession socket = connect("", client);

        socket.sendMessage(new TextMessage("{\"type\":\"ping\",\"timestamp\":99}"));

        await().atMost(5, SECONDS).until(() -> client.firstOfType("pong").isPresent());
        assertThat(client.firstOfType("pong").orElseThrow().getLong("originalTimestamp")).isEqualTo(99L);
    }

    private WebSocketSession connect(String query, CollectingHandler handler) throws Exception {
        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(MessageCodec.MAX_FRAME_SIZE);
        WebSocketSession session = new StandardWebSocketClient(container)
                .execute(handler, "ws://localhost:" + port + "/ws" + query)
                .get(5, SECONDS);
        opened.add(session);
        return session;
    }

    private static class CollectingHandler extends TextWebSocketHandler {
        private final List<JSONObject> received = new CopyOnWriteArrayList<>();
        private volatile CloseStatus closeStatus;

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            received.add(new JSONObject(message.getPayload()));
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            closeStatus = status;
        }

        Optional<JSONObject> firstOfType(String type) {
            return received.stream().filter(m -> type.equals(m.optString("type"))).findFirst();
        }
    }
}
