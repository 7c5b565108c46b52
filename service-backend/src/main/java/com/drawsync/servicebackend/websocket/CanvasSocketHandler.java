package com.drawsync.servicebackend.websocket;

import com.drawsync.servicebackend.coordinator.ClientConnection;
import com.drawsync.servicebackend.coordinator.CoordinatorException;
import com.drawsync.servicebackend.coordinator.ErrorCode;
import com.drawsync.servicebackend.coordinator.RoomCoordinator;
import com.drawsync.servicebackend.message.ClientEvent;
import com.drawsync.servicebackend.message.ServerEvent;
import com.drawsync.servicebackend.security.AuthenticatedUser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Real-time room channel. Decodes client events, hands them to the {@link RoomCoordinator}
 * and reports rejections back to the sending connection only.
 *
 * <p>Connection identity comes from the handshake ({@link JwtHandshakeInterceptor}); user ids
 * inside event payloads are never trusted.
 */
@Component
public class CanvasSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(CanvasSocketHandler.class);

    // WebSocket session id -> connection
    private final ConcurrentHashMap<String, WebSocketClientConnection> connections = new ConcurrentHashMap<>();

    private final RoomCoordinator coordinator;
    private final ObjectMapper objectMapper;

    public CanvasSocketHandler(RoomCoordinator coordinator, ObjectMapper objectMapper) {
        this.coordinator = coordinator;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        Object principal = session.getAttributes().get(JwtHandshakeInterceptor.USER_ATTRIBUTE);
        if (!(principal instanceof AuthenticatedUser user)) {
            log.warn("WebSocket connection {} rejected: no authenticated user", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Authentication required"));
            return;
        }
        connections.put(session.getId(), new WebSocketClientConnection(session, user, objectMapper));
        log.info("Room channel connected: user={}, connection={}, open_connections={}",
                user.id(), session.getId(), connections.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketClientConnection connection = connections.get(session.getId());
        if (connection == null) {
            log.warn("Received message from unregistered connection: {}", session.getId());
            return;
        }

        ClientEvent event;
        try {
            event = objectMapper.readValue(message.getPayload(), ClientEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Malformed event from connection {}: {}", session.getId(), e.getOriginalMessage());
            connection.send(ServerEvent.error(ErrorCode.INVALID_REQUEST, "Malformed event"));
            return;
        }
        if (event.type() == null) {
            connection.send(ServerEvent.error(ErrorCode.INVALID_REQUEST, "Event type is required"));
            return;
        }
        if (event.userId() != null && !event.userId().equals(connection.userId())) {
            log.warn("Connection {} sent userId {} but is authenticated as {}; using the latter",
                    session.getId(), event.userId(), connection.userId());
        }

        try {
            dispatch(connection, event).whenComplete((ignored, failure) -> {
                if (failure != null) {
                    reportFailure(connection, event.type(), failure);
                }
            });
        } catch (CoordinatorException e) {
            reportFailure(connection, event.type(), e);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketClientConnection connection = connections.remove(session.getId());
        if (connection == null) {
            return;
        }
        log.info("Room channel disconnected: user={}, connection={}, status={}",
                connection.userId(), session.getId(), status);
        coordinator.disconnect(connection).whenComplete((ignored, failure) -> {
            if (failure != null) {
                log.error("Cleanup after disconnect of connection {} failed: {}",
                        session.getId(), unwrap(failure).getMessage(), unwrap(failure));
            }
        });
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on connection {}: {}", session.getId(), exception.getMessage());
    }

    int openConnections() {
        return connections.size();
    }

    private CompletableFuture<?> dispatch(ClientConnection connection, ClientEvent event) {
        return switch (event.type()) {
            case "join-room" -> coordinator.join(connection,
                    event.roomIdentifier() != null ? event.roomIdentifier() : event.roomId());
            case "leave-room" -> coordinator.leave(connection);
            case "cursor-move" -> event.x() == null || event.y() == null
                    ? CompletableFuture.completedFuture(null)
                    : coordinator.cursorMove(connection, roomId(event), event.x(), event.y());
            case "drawing-update" -> coordinator.drawingUpdate(connection, roomId(event),
                    event.element(), Boolean.TRUE.equals(event.persist()));
            case "request-lock" -> coordinator.requestLock(connection, roomId(event), event.objectId());
            case "release-lock" -> coordinator.releaseLock(connection, roomId(event), event.objectId());
            case "clear-canvas" -> coordinator.clearCanvas(connection, roomId(event));
            case "kick-participant" -> coordinator.kick(connection, roomId(event), event.targetUserId());
            case "ban-participant" -> coordinator.ban(connection, roomId(event), event.targetUserId());
            case "promote-participant" -> coordinator.promote(connection, roomId(event), event.targetUserId());
            case "demote-participant" -> coordinator.demote(connection, roomId(event), event.targetUserId());
            case "ping" -> {
                connection.send(ServerEvent.pong());
                yield CompletableFuture.completedFuture(null);
            }
            default -> throw new CoordinatorException(ErrorCode.INVALID_REQUEST, "Unknown event type: " + event.type());
        };
    }

    private static Long roomId(ClientEvent event) {
        if (event.roomId() == null || event.roomId().isBlank()) {
            return null;
        }
        try {
            return Long.valueOf(event.roomId().trim());
        } catch (NumberFormatException e) {
            throw new CoordinatorException(ErrorCode.INVALID_REQUEST, "roomId must be numeric", e);
        }
    }

    private void reportFailure(ClientConnection connection, String type, Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof CoordinatorException rejected) {
            log.warn("{} from user {} rejected: {} {}", type, connection.userId(), rejected.getCode(), rejected.getMessage());
            connection.send(ServerEvent.error(rejected.getCode(), rejected.getMessage()));
        } else if (cause instanceof DataAccessException) {
            log.error("{} from user {} failed in the room store: {}", type, connection.userId(), cause.getMessage(), cause);
            connection.send(ServerEvent.error(ErrorCode.PERSISTENCE_FAILURE, "Room store unavailable"));
        } else {
            log.error("Error handling {} from user {}: {}", type, connection.userId(), cause.getMessage(), cause);
            connection.send(ServerEvent.error(ErrorCode.INVALID_REQUEST, "Failed to process " + type));
        }
    }

    private static Throwable unwrap(Throwable failure) {
        return failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
    }
}
