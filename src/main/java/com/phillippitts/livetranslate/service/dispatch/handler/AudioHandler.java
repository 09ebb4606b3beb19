package com.phillippitts.livetranslate.service.dispatch.handler;

import com.phillippitts.livetranslate.config.properties.DeliveryProperties;
import com.phillippitts.livetranslate.domain.Role;
import com.phillippitts.livetranslate.protocol.MessageType;
import com.phillippitts.livetranslate.protocol.inbound.AudioMessage;
import com.phillippitts.livetranslate.service.dispatch.HandlerContext;
import com.phillippitts.livetranslate.service.dispatch.MessageHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Accepts presenter audio chunks. Speech recognition happens on the client, so chunks are only
 * acknowledged in the log; chunks below the configured minimum are dropped as noise.
 */
@Component
public class AudioHandler implements MessageHandler<AudioMessage> {

    private static final Logger LOG = LogManager.getLogger(AudioHandler.class);

    private final DeliveryProperties props;

    public AudioHandler(DeliveryProperties props) {
        this.props = props;
    }

    @Override
    public MessageType type() {
        return MessageType.AUDIO;
    }

    @Override
    public Class<AudioMessage> messageClass() {
        return AudioMessage.class;
    }

    @Override
    public void handle(AudioMessage message, HandlerContext context) {
        if (context.registry().getRole(context.connection()) != Role.PRESENTER) {
            LOG.debug("Ignoring audio from non-presenter {}", context.connection().id());
            return;
        }
        int length = message.data().length();
        if (length < props.getMinAudioLength()) {
            LOG.debug("Dropping audio chunk of {} chars from {} (minimum {})", length, context.connection().id(),
                    props.getMinAudioLength());
            return;
        }
        LOG.debug("Received audio chunk of {} chars from {}", length, context.connection().id());
    }
}
