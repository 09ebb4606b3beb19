package com.phillippitts.livetranslate.service.dispatch.handler;

import com.phillippitts.livetranslate.config.properties.DeliveryProperties;
import com.phillippitts.livetranslate.config.properties.SessionLifecycleProperties;
import com.phillippitts.livetranslate.domain.ClientSettings;
import com.phillippitts.livetranslate.domain.PersistedSession;
import com.phillippitts.livetranslate.domain.Role;
import com.phillippitts.livetranslate.exception.InvalidSessionException;
import com.phillippitts.livetranslate.protocol.MessageType;
import com.phillippitts.livetranslate.protocol.inbound.RegisterMessage;
import com.phillippitts.livetranslate.protocol.outbound.ClassroomCodeMessage;
import com.phillippitts.livetranslate.protocol.outbound.RegisterAck;
import com.phillippitts.livetranslate.protocol.outbound.StudentJoinedMessage;
import com.phillippitts.livetranslate.service.classroom.ClassroomCodeEntry;
import com.phillippitts.livetranslate.service.dispatch.HandlerContext;
import com.phillippitts.livetranslate.service.dispatch.MessageHandler;
import com.phillippitts.livetranslate.service.lifecycle.SessionLifecycleService;
import com.phillippitts.livetranslate.service.registry.ClientConnection;
import com.phillippitts.livetranslate.service.registry.ConnectionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Assigns a role to a connection.
 *
 * <p><b>Presenter:</b> obtains or renews a classroom code. No durable session is created here;
 * that waits for the first listener so presenters who never get an audience leave nothing
 * behind. With a {@code presenterId} the presenter reclaims its active or recently ended
 * session, including the classroom code listeners already hold.
 *
 * <p><b>Listener:</b> resolves the classroom code (from the message or the connection URL),
 * joins that session, creates or updates the durable session, and notifies the presenters.
 * A listener is counted into {@code listenerCount} once per connection however often it
 * registers.
 */
@Component
public class RegisterHandler implements MessageHandler<RegisterMessage> {

    private static final Logger LOG = LogManager.getLogger(RegisterHandler.class);

    private final DeliveryProperties deliveryProps;
    private final SessionLifecycleProperties lifecycleProps;

    public RegisterHandler(DeliveryProperties deliveryProps, SessionLifecycleProperties lifecycleProps) {
        this.deliveryProps = deliveryProps;
        this.lifecycleProps = lifecycleProps;
    }

    @Override
    public MessageType type() {
        return MessageType.REGISTER;
    }

    @Override
    public Class<RegisterMessage> messageClass() {
        return RegisterMessage.class;
    }

    @Override
    public void handle(RegisterMessage message, HandlerContext context) {
        ConnectionRegistry registry = context.registry();
        ClientConnection connection = context.connection();

        Role previousRole = registry.getRole(connection);
        if (previousRole != null && previousRole != message.role()) {
            LOG.info("Connection {} changes role {} -> {}", connection.id(), previousRole, message.role());
        }
        registry.setRole(connection, message.role());
        if (message.languageCode() != null) {
            registry.setLanguage(connection, message.languageCode());
        }
        ClientSettings settings = registry.updateSettings(connection, message.settings());

        if (message.role() == Role.PRESENTER) {
            registerPresenter(message, context, settings);
        } else {
            registerListener(message, context, settings);
        }
    }

    private void registerPresenter(RegisterMessage message, HandlerContext context, ClientSettings settings) {
        ConnectionRegistry registry = context.registry();
        ClientConnection connection = context.connection();
        String language = languageOr(registry.getLanguage(connection), deliveryProps.getDefaultPresenterLanguage());
        String sessionId = registry.getSessionId(connection);
        Optional<ClassroomCodeEntry> restored = Optional.empty();

        String presenterId = message.presenterId();
        if (presenterId != null && !presenterId.isBlank()) {
            registry.setPresenterId(connection, presenterId);
            Optional<PersistedSession> reclaimed = reclaimSession(presenterId, context.lifecycle());
            if (reclaimed.isPresent()) {
                PersistedSession session = reclaimed.get();
                String previousSessionId = sessionId;
                sessionId = session.sessionId();
                registry.setSessionId(connection, sessionId);
                if (session.classCode() != null) {
                    restored = context.directory().restoreClassroomSession(session.classCode(), sessionId);
                }
                context.lifecycle().updatePresenter(sessionId, presenterId, language);
                context.lifecycle().endDuplicatePresenterSessions(sessionId, language);
                context.lifecycle().migrateOrphanedListeners(previousSessionId, sessionId);
                LOG.info("Presenter {} reclaimed session {}", presenterId, sessionId);
            }
        }

        context.reply(new RegisterAck(Role.PRESENTER, language, settings));

        String finalSessionId = sessionId;
        ClassroomCodeEntry entry = restored.orElseGet(() -> context.directory().generateCode(finalSessionId));
        context.directory().markPresenterReconnected(sessionId);
        context.reply(new ClassroomCodeMessage(entry.code(), sessionId, entry.expiresAt().toEpochMilli()));
        LOG.info("Presenter {} registered ({}) with classroom code {}", connection.id(), language, entry.code());
    }

    private Optional<PersistedSession> reclaimSession(String presenterId, SessionLifecycleService lifecycle) {
        Optional<PersistedSession> active = lifecycle.findActiveSessionByPresenterId(presenterId);
        if (active.isPresent()) {
            return active;
        }
        return lifecycle.findRecentSessionByPresenterId(presenterId,
                        lifecycleProps.getPresenterReconnectWindowMinutes())
                .flatMap(recent -> lifecycle.reactivateSession(recent.sessionId()));
    }

    private void registerListener(RegisterMessage message, HandlerContext context, ClientSettings settings) {
        ConnectionRegistry registry = context.registry();
        ClientConnection connection = context.connection();
        String language = registry.getLanguage(connection);

        String code = message.classroomCode() != null ? message.classroomCode() : registry.getClassroomCode(connection);
        if (code == null || code.isBlank()) {
            context.reply(new RegisterAck(Role.LISTENER, language, settings));
            LOG.info("Listener {} registered without a classroom code", connection.id());
            return;
        }
        ClassroomCodeEntry entry = context.directory().getByCode(code)
                .orElseThrow(() -> new InvalidSessionException(code));

        String sessionId = entry.sessionId();
        registry.setClassroomCode(connection, entry.code());
        registry.setSessionId(connection, sessionId);
        context.reply(new RegisterAck(Role.LISTENER, language, settings));

        List<ClientConnection> presenters = registry.getPresenters(sessionId);
        ClientConnection presenter = presenters.isEmpty() ? null : presenters.get(0);
        String presenterLanguage = presenter == null
                ? deliveryProps.getDefaultPresenterLanguage()
                : languageOr(registry.getLanguage(presenter), deliveryProps.getDefaultPresenterLanguage());
        String presenterId = presenter == null ? null : registry.getPresenterId(presenter);

        boolean countThisConnection = !registry.isListenerCounted(connection);
        context.lifecycle().recordListenerJoin(sessionId, presenterId, presenterLanguage,
                        languageOr(language, deliveryProps.getDefaultListenerLanguage()), entry.code(),
                        countThisConnection)
                .ifPresent(join -> {
                    if (countThisConnection) {
                        registry.markListenerCounted(connection);
                    }
                });

        StudentJoinedMessage joined = new StudentJoinedMessage(connection.id(), message.name(),
                languageOr(language, deliveryProps.getDefaultListenerLanguage()));
        for (ClientConnection p : presenters) {
            context.sendTo(p, joined);
        }
        LOG.info("Listener {} joined session {} ({}) via code {}", connection.id(), sessionId, language,
                entry.code());
    }

    private static String languageOr(String language, String fallback) {
        return language == null || language.isBlank() ? fallback : language;
    }
}
