package com.drawsync.servicebackend.websocket;

import com.drawsync.servicebackend.coordinator.ClientConnection;
import com.drawsync.servicebackend.message.ServerEvent;
import com.drawsync.servicebackend.security.AuthenticatedUser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * {@link ClientConnection} over a Spring WebSocket session. Sends are serialized through a
 * {@link ConcurrentWebSocketSessionDecorator} since several room lanes may write to the same
 * connection.
 */
public class WebSocketClientConnection implements ClientConnection {
    private static final Logger log = LoggerFactory.getLogger(WebSocketClientConnection.class);

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ConcurrentWebSocketSessionDecorator session;
    private final AuthenticatedUser user;
    private final ObjectMapper objectMapper;

    public WebSocketClientConnection(WebSocketSession session, AuthenticatedUser user, ObjectMapper objectMapper) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        this.user = user;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public Long userId() {
        return user.id();
    }

    @Override
    public String username() {
        return user.username();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(ServerEvent event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} event: {}", event.type(), e.getMessage(), e);
            return;
        }
        try {
            session.sendMessage(new TextMessage(json));
        } catch (IOException | SessionLimitExceededException e) {
            log.warn("Failed to send {} to connection {}: {}", event.type(), id(), e.getMessage());
        }
    }

    /**
     * Drops the event when an earlier send to this connection is still pending.
     */
    @Override
    public void sendVolatile(ServerEvent event) {
        if (session.getBufferSize() > 0) {
            log.trace("Dropped {} for busy connection {}", event.type(), id());
            return;
        }
        send(event);
    }
}
