package com.drawsync.servicebackend.coordinator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Tracks live rooms and which connection is bound to which room and user.
 */
public class SessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentHashMap<Long, RoomSession> rooms = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ConnectionContext> contexts = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration lockTimeout;
    private final Executor commandExecutor;
    private final Executor persistenceExecutor;

    public SessionRegistry(Clock clock, Duration lockTimeout,
                           Executor commandExecutor, Executor persistenceExecutor) {
        this.clock = clock;
        this.lockTimeout = lockTimeout;
        this.commandExecutor = commandExecutor;
        this.persistenceExecutor = persistenceExecutor;
    }

    public RoomSession openRoom(Long roomId) {
        return rooms.computeIfAbsent(roomId, id -> {
            log.info("Room session {} opened", id);
            return new RoomSession(id, clock, lockTimeout, commandExecutor, persistenceExecutor);
        });
    }

    public Optional<RoomSession> room(Long roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    public Collection<RoomSession> rooms() {
        return List.copyOf(rooms.values());
    }

    public void bind(ConnectionContext context) {
        contexts.put(context.connectionId(), context);
    }

    public Optional<ConnectionContext> context(String connectionId) {
        return Optional.ofNullable(contexts.get(connectionId));
    }

    /**
     * Removes the binding only if it still points at the given room.
     */
    public Optional<ConnectionContext> unbind(String connectionId, Long roomId) {
        ConnectionContext context = contexts.get(connectionId);
        if (context == null || !context.roomId().equals(roomId)) {
            return Optional.empty();
        }
        return contexts.remove(connectionId, context) ? Optional.of(context) : Optional.empty();
    }

    public int connectionCount() {
        return contexts.size();
    }

    /**
     * Drops the room session when it has no connections and nothing left to write.
     * Must run on the room's command lane.
     */
    public boolean retireIfIdle(RoomSession session) {
        if (session.isRetired() || !session.isIdle()) {
            return false;
        }
        session.retire();
        rooms.remove(session.roomId(), session);
        log.info("Room session {} retired", session.roomId());
        return true;
    }

    public Clock clock() {
        return clock;
    }
}
