package com.drawsync.servicebackend.coordinator;

import com.drawsync.servicebackend.coordinator.LockTable.LockDecision;
import com.drawsync.servicebackend.coordinator.LockTable.ReleaseResult;
import com.drawsync.servicebackend.coordinator.ModerationEnforcer.Action;
import com.drawsync.servicebackend.coordinator.store.ParticipantRecord;
import com.drawsync.servicebackend.coordinator.store.ParticipantRole;
import com.drawsync.servicebackend.coordinator.store.RoomRecord;
import com.drawsync.servicebackend.coordinator.store.RoomStateStore;
import com.drawsync.servicebackend.message.ServerEvent;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Entry point for every real-time room event. Resolves the caller's room binding, then runs
 * the event as a command on that room's lane, where it mutates room state and fans out.
 *
 * <p>Every operation completes its future exceptionally with a {@link CoordinatorException}
 * when the request is rejected; nothing about a rejection is broadcast.
 */
public class RoomCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RoomCoordinator.class);

    private final SessionRegistry registry;
    private final RoomStateStore store;
    private final PresenceBroadcaster presence;
    private final RoomStateSynchronizer synchronizer;
    private final ModerationEnforcer moderation;

    public RoomCoordinator(SessionRegistry registry, RoomStateStore store) {
        this.registry = registry;
        this.store = store;
        this.presence = new PresenceBroadcaster(store);
        this.synchronizer = new RoomStateSynchronizer(store, presence);
        this.moderation = new ModerationEnforcer(store);
    }

    /**
     * Binds the connection to the room named by id or join code and sends it the room state.
     * A connection already bound to a room leaves that room first.
     */
    public CompletableFuture<RoomSnapshot> join(ClientConnection connection, String roomIdentifier) {
        RoomRecord room;
        try {
            room = resolveRoom(roomIdentifier);
        } catch (CoordinatorException e) {
            return CompletableFuture.failedFuture(e);
        }
        return leave(connection)
                .thenCompose(ignored -> onLiveRoom(room.id(), session -> joinRoom(session, room, connection)));
    }

    public CompletableFuture<Void> leave(ClientConnection connection) {
        Optional<ConnectionContext> context = registry.context(connection.id());
        if (context.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        Optional<RoomSession> session = registry.room(context.get().roomId());
        if (session.isEmpty()) {
            registry.unbind(connection.id(), context.get().roomId());
            return CompletableFuture.completedFuture(null);
        }
        RoomSession room = session.get();
        return room.run(() -> detachConnection(room, connection.id(), true));
    }

    /**
     * Transport-level close. Same cleanup as an explicit leave.
     */
    public CompletableFuture<Void> disconnect(ClientConnection connection) {
        log.debug("Connection {} of user {} disconnected", connection.id(), connection.userId());
        return leave(connection);
    }

    public CompletableFuture<Void> cursorMove(ClientConnection connection, Long roomId, double x, double y) {
        Optional<ConnectionContext> context = registry.context(connection.id());
        if (context.isEmpty() || (roomId != null && !roomId.equals(context.get().roomId()))) {
            return CompletableFuture.completedFuture(null);
        }
        return registry.room(context.get().roomId())
                .map(session -> session.run(() -> {
                    if (isBound(connection, session)) {
                        presence.relayCursor(session, connection, x, y);
                    }
                }))
                .orElseGet(() -> CompletableFuture.completedFuture(null));
    }

    /**
     * Relays an element to the rest of the room and, when {@code persist} is set, queues it
     * for the next flush.
     */
    public CompletableFuture<Void> drawingUpdate(ClientConnection connection, Long roomId, JsonNode element, boolean persist) {
        if (element == null || element.isNull()) {
            return CompletableFuture.failedFuture(
                    new CoordinatorException(ErrorCode.INVALID_REQUEST, "element is required"));
        }
        return onBoundRoom(connection, roomId, session -> {
            DrawingElement drawing = persist ? DrawingElement.from(element) : null;
            session.broadcast(ServerEvent.drawingUpdate(session.roomId(), connection.userId(), element, persist), connection.id());
            if (drawing != null) {
                session.buffer().enqueue(drawing);
            }
            return null;
        });
    }

    public CompletableFuture<LockDecision> requestLock(ClientConnection connection, Long roomId, String objectId) {
        if (objectId == null || objectId.isBlank()) {
            return CompletableFuture.failedFuture(
                    new CoordinatorException(ErrorCode.INVALID_REQUEST, "objectId is required"));
        }
        return onBoundRoom(connection, roomId, session -> {
            LockDecision decision = session.locks().request(objectId, connection.userId(), connection.id());
            if (decision.granted()) {
                session.broadcast(ServerEvent.objectLocked(objectId, connection.userId()), null);
            } else {
                connection.send(ServerEvent.lockDenied(objectId, decision.lock().holderUserId()));
            }
            return decision;
        });
    }

    public CompletableFuture<Void> releaseLock(ClientConnection connection, Long roomId, String objectId) {
        if (objectId == null || objectId.isBlank()) {
            return CompletableFuture.failedFuture(
                    new CoordinatorException(ErrorCode.INVALID_REQUEST, "objectId is required"));
        }
        return onBoundRoom(connection, roomId, session -> {
            ReleaseResult result = session.locks().release(objectId, connection.userId());
            if (result == ReleaseResult.HELD_BY_OTHER) {
                throw new CoordinatorException(ErrorCode.UNAUTHORIZED, "Lock on " + objectId + " is held by another user");
            }
            if (result == ReleaseResult.RELEASED) {
                session.broadcast(ServerEvent.objectUnlocked(objectId), null);
            }
            return null;
        });
    }

    /**
     * Empties the canvas for everyone. The buffer is reset before the next flush can drain it,
     * and the persisted list is reset on the persistence lane ahead of any later batch.
     */
    public CompletableFuture<Void> clearCanvas(ClientConnection connection, Long roomId) {
        return onBoundRoom(connection, roomId, session -> {
            long generation = session.buffer().reset();
            session.broadcast(ServerEvent.canvasCleared(session.roomId(), connection.userId()), null);
            Long id = session.roomId();
            session.persistClear(() -> store.clearElements(id));
            log.info("Room {} cleared by user {} (buffer generation {})", id, connection.userId(), generation);
            return null;
        });
    }

    public CompletableFuture<Void> kick(ClientConnection connection, Long roomId, Long targetUserId) {
        return moderate(connection, roomId, Action.KICK, targetUserId);
    }

    public CompletableFuture<Void> ban(ClientConnection connection, Long roomId, Long targetUserId) {
        return moderate(connection, roomId, Action.BAN, targetUserId);
    }

    public CompletableFuture<ParticipantRole> promote(ClientConnection connection, Long roomId, Long targetUserId) {
        return changeRole(connection, roomId, targetUserId, ParticipantRole.MODERATOR);
    }

    public CompletableFuture<ParticipantRole> demote(ClientConnection connection, Long roomId, Long targetUserId) {
        return changeRole(connection, roomId, targetUserId, ParticipantRole.MEMBER);
    }

    /**
     * Roster of a room, live when the room has a session, otherwise straight from the store
     * with everyone offline.
     */
    public CompletableFuture<List<RosterEntry>> roster(Long roomId) {
        Optional<RoomSession> session = registry.room(roomId);
        if (session.isPresent()) {
            return session.get().call(() -> presence.roster(session.get()));
        }
        return CompletableFuture.supplyAsync(() -> store.findActiveParticipants(roomId).stream()
                .map(participant -> RosterEntry.of(participant, false))
                .toList(), Runnable::run);
    }

    public CompletableFuture<Optional<RoomActivity>> activity(Long roomId) {
        return registry.room(roomId)
                .map(session -> session.call(() -> Optional.of(new RoomActivity(
                        session.roomId(),
                        session.connectionCount(),
                        session.locks().activeLocks(),
                        session.buffer().pendingCount()))))
                .orElseGet(() -> CompletableFuture.completedFuture(Optional.empty()));
    }

    public int activeRoomCount() {
        return registry.rooms().size();
    }

    public int connectionCount() {
        return registry.connectionCount();
    }

    private CompletableFuture<Void> moderate(ClientConnection connection, Long roomId, Action action, Long targetUserId) {
        return onBoundRoom(connection, roomId, session -> {
            moderation.moderate(session, action, connection.userId(), targetUserId);
            evict(session, targetUserId, action == Action.KICK ? "kicked" : "banned");
            presence.broadcastRoster(session);
            return null;
        });
    }

    private CompletableFuture<ParticipantRole> changeRole(ClientConnection connection, Long roomId,
                                                         Long targetUserId, ParticipantRole role) {
        return onBoundRoom(connection, roomId, session -> {
            ParticipantRole applied = moderation.changeRole(session, connection.userId(), targetUserId, role);
            presence.broadcastRoster(session);
            return applied;
        });
    }

    private RoomSnapshot joinRoom(RoomSession session, RoomRecord room, ClientConnection connection) {
        if (!connection.isOpen()) {
            throw new CoordinatorException(ErrorCode.NOT_FOUND, "Connection is closed");
        }
        ParticipantRecord participant = admit(room, connection.userId());
        store.touchLastSeen(room.id(), connection.userId());

        session.attach(connection);
        registry.bind(new ConnectionContext(connection.id(), connection.userId(), room.id(), registry.clock().instant()));
        // A close during the store calls above found no binding to clean up; once bound, a
        // later close is cleaned up by disconnect.
        if (!connection.isOpen()) {
            abandonJoin(session, connection, room.id());
            throw new CoordinatorException(ErrorCode.NOT_FOUND, "Connection is closed");
        }

        RoomSnapshot snapshot;
        try {
            snapshot = synchronizer.snapshot(session, room);
        } catch (RuntimeException e) {
            abandonJoin(session, connection, room.id());
            throw new CoordinatorException(ErrorCode.PERSISTENCE_FAILURE, "Failed to load room state", e);
        }

        log.info("User {} joined room {} on connection {} ({} connected)",
                connection.userId(), room.id(), connection.id(), session.connectionCount());
        session.broadcast(ServerEvent.userJoined(connection.userId(), connection.username(), participant.role()), connection.id());
        session.broadcast(ServerEvent.participantsUpdated(snapshot.roster()), null);
        connection.send(ServerEvent.roomState(snapshot));
        return snapshot;
    }

    private void abandonJoin(RoomSession session, ClientConnection connection, Long roomId) {
        session.detach(connection.id());
        registry.unbind(connection.id(), roomId);
        registry.retireIfIdle(session);
    }

    private ParticipantRecord admit(RoomRecord room, Long userId) {
        Optional<ParticipantRecord> existing = store.findParticipant(room.id(), userId);
        if (existing.isPresent()) {
            if (existing.get().banned()) {
                log.warn("Banned user {} tried to join room {}", userId, room.id());
                throw new CoordinatorException(ErrorCode.BANNED, "You are banned from this room");
            }
            return existing.get();
        }
        if (userId.equals(room.ownerId())) {
            return store.createParticipant(room.id(), userId, ParticipantRole.OWNER);
        }
        if (room.publicRoom()) {
            return store.createParticipant(room.id(), userId, ParticipantRole.MEMBER);
        }
        throw new CoordinatorException(ErrorCode.NOT_FOUND, "Not a participant of this room");
    }

    private RoomRecord resolveRoom(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new CoordinatorException(ErrorCode.INVALID_REQUEST, "Room id or code is required");
        }
        String trimmed = identifier.trim();
        Optional<RoomRecord> room = trimmed.chars().allMatch(Character::isDigit)
                ? store.findRoomById(Long.valueOf(trimmed))
                : store.findRoomByCode(trimmed.toUpperCase(Locale.ROOT));
        return room.filter(RoomRecord::active)
                .orElseThrow(() -> new CoordinatorException(ErrorCode.NOT_FOUND, "Room not found"));
    }

    /**
     * Unbinds a connection: force-releases its locks, tells the room, and retires the session
     * if nothing is left in it.
     */
    private void detachConnection(RoomSession session, String connectionId, boolean rebroadcast) {
        Optional<ConnectionContext> context = registry.unbind(connectionId, session.roomId());
        if (context.isEmpty()) {
            return;
        }
        Long userId = context.get().userId();
        session.detach(connectionId);
        for (ObjectLock lock : session.locks().releaseAllHeldBy(connectionId)) {
            session.broadcast(ServerEvent.objectUnlocked(lock.objectId()), null);
        }
        try {
            store.touchLastSeen(session.roomId(), userId);
        } catch (RuntimeException e) {
            log.warn("Failed to update last seen of user {} in room {}: {}", userId, session.roomId(), e.getMessage());
        }
        log.info("User {} left room {} on connection {}", userId, session.roomId(), connectionId);
        session.broadcast(ServerEvent.userLeft(userId), connectionId);
        if (rebroadcast) {
            presence.broadcastRoster(session);
        }
        registry.retireIfIdle(session);
    }

    private void evict(RoomSession session, Long userId, String reason) {
        for (ClientConnection target : session.connectionsOf(userId)) {
            target.send(ServerEvent.removedFromRoom(session.roomId(), reason));
            detachConnection(session, target.id(), false);
        }
    }

    private boolean isBound(ClientConnection connection, RoomSession session) {
        return registry.context(connection.id())
                .map(context -> context.roomId().equals(session.roomId()))
                .orElse(false);
    }

    private <T> CompletableFuture<T> onBoundRoom(ClientConnection connection, Long roomId, Function<RoomSession, T> command) {
        ConnectionContext context = registry.context(connection.id()).orElse(null);
        if (context == null) {
            return CompletableFuture.failedFuture(new CoordinatorException(ErrorCode.NOT_FOUND, "Not joined to a room"));
        }
        if (roomId != null && !roomId.equals(context.roomId())) {
            return CompletableFuture.failedFuture(new CoordinatorException(ErrorCode.NOT_FOUND, "Not joined to room " + roomId));
        }
        Optional<RoomSession> session = registry.room(context.roomId());
        if (session.isEmpty()) {
            return CompletableFuture.failedFuture(new CoordinatorException(ErrorCode.NOT_FOUND, "Room session not found"));
        }
        RoomSession room = session.get();
        return room.call(() -> {
            if (!isBound(connection, room)) {
                throw new CoordinatorException(ErrorCode.NOT_FOUND, "Not joined to a room");
            }
            return command.apply(room);
        });
    }

    /**
     * Runs the command on the room's live session, opening a new one if the session found
     * was retired before the command reached it.
     */
    private <T> CompletableFuture<T> onLiveRoom(Long roomId, Function<RoomSession, T> command) {
        RoomSession session = registry.openRoom(roomId);
        CompletableFuture<Optional<T>> attempt = session.call(() -> {
            if (session.isRetired()) {
                return Optional.empty();
            }
            try {
                return Optional.of(command.apply(session));
            } catch (RuntimeException e) {
                registry.retireIfIdle(session);
                throw e;
            }
        });
        return attempt.thenCompose(result -> result
                .map(CompletableFuture::completedFuture)
                .orElseGet(() -> onLiveRoom(roomId, command)));
    }
}
