package com.phillippitts.livetranslate.presentation.websocket;

import com.phillippitts.livetranslate.protocol.MessageCodec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the classroom WebSocket endpoint.
 *
 * <p>Clients connect with {@code ws://host:port/ws} (presenters) or
 * {@code ws://host:port/ws?class=ABC123} (listeners following a shared link).
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ClassroomWebSocketHandler handler;
    private final String path;
    private final String[] allowedOrigins;

    public WebSocketConfig(ClassroomWebSocketHandler handler,
                           @Value("${live-translate.websocket.path:/ws}") String path,
                           @Value("${live-translate.websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.handler = handler;
        this.path = path;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, path)
                .setAllowedOriginPatterns(allowedOrigins);
    }

    /**
     * Lifts the container's 8 KB frame default to {@link MessageCodec#MAX_FRAME_SIZE}, so audio
     * chunks and long transcriptions reach the codec.
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(MessageCodec.MAX_FRAME_SIZE);
        container.setMaxBinaryMessageBufferSize(MessageCodec.MAX_FRAME_SIZE);
        return container;
    }
}
