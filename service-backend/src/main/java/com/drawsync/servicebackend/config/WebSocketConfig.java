package com.drawsync.servicebackend.config;

import com.drawsync.servicebackend.websocket.CanvasSocketHandler;
import com.drawsync.servicebackend.websocket.JwtHandshakeInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the room coordination endpoint.
 *
 * Clients connect with {@code ws://host:port/ws/rooms?token=<jwt>} and then send
 * {@code join-room}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final CanvasSocketHandler canvasSocketHandler;
    private final JwtHandshakeInterceptor jwtHandshakeInterceptor;
    private final CorsProperties corsProperties;

    public WebSocketConfig(CanvasSocketHandler canvasSocketHandler,
                           JwtHandshakeInterceptor jwtHandshakeInterceptor,
                           CorsProperties corsProperties) {
        this.canvasSocketHandler = canvasSocketHandler;
        this.jwtHandshakeInterceptor = jwtHandshakeInterceptor;
        this.corsProperties = corsProperties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(canvasSocketHandler, "/ws/rooms")
                .addInterceptors(jwtHandshakeInterceptor)
                .setAllowedOriginPatterns(corsProperties.originPatterns());
    }
}
