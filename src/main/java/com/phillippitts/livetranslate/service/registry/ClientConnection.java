package com.phillippitts.livetranslate.service.registry;

import com.phillippitts.livetranslate.exception.DeliveryException;
import com.phillippitts.livetranslate.protocol.outbound.OutboundMessage;

/**
 * Transport-neutral handle on one client socket.
 *
 * <p>Implementations must allow {@link #send(OutboundMessage)} from several threads; the
 * delivery pool writes to different listeners concurrently and the same listener may receive
 * a retry while another payload is in flight.
 */
public interface ClientConnection {

    /** Stable id for the lifetime of the socket. */
    String id();

    /**
     * Writes one message.
     *
     * @throws DeliveryException if the socket is closed or the write fails
     */
    void send(OutboundMessage message);

    /** Closes the socket with a WebSocket close code; a no-op if already closed. */
    void close(int code, String reason);

    boolean isOpen();
}
