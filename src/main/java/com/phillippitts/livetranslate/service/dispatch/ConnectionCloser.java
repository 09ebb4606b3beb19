package com.phillippitts.livetranslate.service.dispatch;

import com.phillippitts.livetranslate.config.ThreadPoolConfig;
import com.phillippitts.livetranslate.config.properties.ClassroomProperties;
import com.phillippitts.livetranslate.service.registry.ClientConnection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Closes rejected connections after a short delay so the error frame sent just before is
 * flushed to the client first.
 */
@Component
public class ConnectionCloser {

    private static final Logger LOG = LogManager.getLogger(ConnectionCloser.class);

    /** WebSocket close status "policy violation". */
    public static final int POLICY_VIOLATION = 1008;
    public static final String INVALID_CLASSROOM_REASON = "Invalid classroom session";

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration delay;

    public ConnectionCloser(@Qualifier("taskScheduler") TaskScheduler scheduler, Clock clock,
                            ClassroomProperties props) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.delay = Duration.ofMillis(props.getInvalidCodeCloseDelayMs());
    }

    public void closeInvalidClassroom(ClientConnection connection) {
        closeLater(connection, POLICY_VIOLATION, INVALID_CLASSROOM_REASON);
    }

    public void closeLater(ClientConnection connection, int code, String reason) {
        LOG.info("Closing connection {} in {} ms: {}", connection.id(), delay.toMillis(), reason);
        // scheduler threads do not inherit ThreadContext
        Runnable close = ThreadPoolConfig.mdcPropagatingDecorator()
                .decorate(() -> connection.close(code, reason));
        scheduler.schedule(close, clock.instant().plus(delay));
    }
}
