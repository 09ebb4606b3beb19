package com.phillippitts.livetranslate.logging;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.filter.AbstractFilter;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.apache.logging.log4j.util.ReadOnlyStringMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Validates that the request id set by MdcFilter reaches controller log events.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class LoggingFormatIntegrationTest {

    private static final String CONTROLLER_LOGGER =
            "com.phillippitts.livetranslate.presentation.controller.SessionController";

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    private InMemoryAppender appender;
    private Logger logger;

    @BeforeEach
    void setUpAppender() {
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        logger = ctx.getLogger(CONTROLLER_LOGGER);
        appender = new InMemoryAppender("test-appender");
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDownAppender() {
        if (logger != null && appender != null) {
            logger.removeAppender(appender);
            appender.stop();
        }
    }

    @Test
    void shouldIncludeRequestIdInStructuredLogs() {
        String requestId = "req-42";
        HttpHeaders headers = new HttpHeaders();
        headers.add("X-Request-ID", requestId);

        ResponseEntity<String> response = restTemplate.exchange(
                "http://localhost:" + port + "/api/sessions/active",
                HttpMethod.GET,
                new HttpEntity<>(headers),
                String.class);

        assertThat(response.getStatusCode().is2xxSuccessful()).isTrue();

        await().atMost(3, SECONDS).until(() ->
                appender.getEvents().stream().anyMatch(e -> e.getMessage() != null
                        && e.getMessage().getFormattedMessage().contains("Active sessions requested")));

        LogEvent event = appender.getEvents().stream()
                .filter(e -> e.getMessage() != null
                        && e.getMessage().getFormattedMessage().contains("Active sessions requested"))
                .findFirst()
                .orElseThrow();

        ReadOnlyStringMap contextData = event.getContextData();
        assertThat(contextData).isNotNull();
        assertEquals(requestId, contextData.getValue("requestId"));
        assertEquals("GET", contextData.getValue("method"));
        assertThat(event.getLoggerName()).isEqualTo(CONTROLLER_LOGGER);
    }

    private static class InMemoryAppender extends AbstractAppender {
        private final List<LogEvent> events = new CopyOnWriteArrayList<>();

        protected InMemoryAppender(String name) {
            super(name, new AbstractFilter() {}, PatternLayout.createDefaultLayout(), true, null);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }

        List<LogEvent> getEvents() {
            return Collections.unmodifiableList(events);
        }
    }
}
