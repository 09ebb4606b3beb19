package com.phillippitts.livetranslate.service.dispatch;

import com.phillippitts.livetranslate.protocol.MessageType;
import com.phillippitts.livetranslate.protocol.inbound.InboundMessage;

/**
 * Handles one inbound message type.
 *
 * <p>Handlers only coordinate: translation, synthesis and persistence logic stay in the
 * collaborators exposed by {@link HandlerContext}. They may throw
 * {@link com.phillippitts.livetranslate.exception.InvalidMessageException} or
 * {@link com.phillippitts.livetranslate.exception.InvalidSessionException}; the router turns
 * those into error payloads.
 *
 * @param <M> message record this handler accepts
 */
public interface MessageHandler<M extends InboundMessage> {

    MessageType type();

    Class<M> messageClass();

    void handle(M message, HandlerContext context);
}
