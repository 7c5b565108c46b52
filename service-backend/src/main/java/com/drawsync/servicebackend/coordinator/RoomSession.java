package com.drawsync.servicebackend.coordinator;

import com.drawsync.servicebackend.message.ServerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * In-memory state of one live room: its connections, lock table and write buffer.
 *
 * <p>All of it is owned by the room's command lane. Commands submitted through
 * {@link #call(Supplier)} run one at a time in submission order, and any fan-out they do
 * completes before the next command starts. Store writes go through the separate persistence
 * lane so a slow store never delays drawing traffic.
 */
public class RoomSession {
    private static final Logger log = LoggerFactory.getLogger(RoomSession.class);

    private final Long roomId;
    private final ConcurrentHashMap<String, ClientConnection> connections = new ConcurrentHashMap<>();
    private final LockTable locks;
    private final WriteBuffer buffer;
    private final SerialExecutor commandLane;
    private final SerialExecutor persistenceLane;
    private final AtomicInteger queuedWrites = new AtomicInteger();
    private final AtomicInteger pendingClears = new AtomicInteger();
    private volatile boolean retired;

    public RoomSession(Long roomId, Clock clock, Duration lockTimeout,
                       Executor commandExecutor, Executor persistenceExecutor) {
        this.roomId = roomId;
        this.locks = new LockTable(clock, lockTimeout);
        this.buffer = new WriteBuffer(roomId);
        this.commandLane = new SerialExecutor(commandExecutor);
        this.persistenceLane = new SerialExecutor(persistenceExecutor);
    }

    public <T> CompletableFuture<T> call(Supplier<T> command) {
        CompletableFuture<T> result = new CompletableFuture<>();
        commandLane.execute(() -> {
            try {
                result.complete(command.get());
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });
        return result;
    }

    public CompletableFuture<Void> run(Runnable command) {
        return call(() -> {
            command.run();
            return null;
        });
    }

    public void persist(Runnable write) {
        queuedWrites.incrementAndGet();
        persistenceLane.execute(() -> {
            try {
                write.run();
            } catch (RuntimeException e) {
                log.error("Persistence task for room {} failed: {}", roomId, e.getMessage(), e);
            } finally {
                queuedWrites.decrementAndGet();
            }
        });
    }

    /**
     * Queues a reset of the persisted element list. Until it has run, the store still holds
     * pre-clear elements and {@link #isClearPending()} is true.
     */
    public void persistClear(Runnable clear) {
        pendingClears.incrementAndGet();
        persist(() -> {
            try {
                clear.run();
            } finally {
                pendingClears.decrementAndGet();
            }
        });
    }

    public boolean isClearPending() {
        return pendingClears.get() > 0;
    }

    public Long roomId() {
        return roomId;
    }

    public LockTable locks() {
        return locks;
    }

    public WriteBuffer buffer() {
        return buffer;
    }

    public void attach(ClientConnection connection) {
        connections.put(connection.id(), connection);
    }

    public ClientConnection detach(String connectionId) {
        return connections.remove(connectionId);
    }

    public Collection<ClientConnection> connections() {
        return List.copyOf(connections.values());
    }

    public int connectionCount() {
        return connections.size();
    }

    public List<ClientConnection> connectionsOf(Long userId) {
        return connections.values().stream()
                .filter(connection -> connection.userId().equals(userId))
                .toList();
    }

    public Set<Long> connectedUserIds() {
        return connections.values().stream()
                .map(ClientConnection::userId)
                .collect(Collectors.toSet());
    }

    /**
     * Sends to every connection of the room except {@code excludeConnectionId} (may be null).
     */
    public void broadcast(ServerEvent event, String excludeConnectionId) {
        for (ClientConnection connection : connections.values()) {
            if (!connection.id().equals(excludeConnectionId) && connection.isOpen()) {
                connection.send(event);
            }
        }
    }

    public void broadcastVolatile(ServerEvent event, String excludeConnectionId) {
        for (ClientConnection connection : connections.values()) {
            if (!connection.id().equals(excludeConnectionId) && connection.isOpen()) {
                connection.sendVolatile(event);
            }
        }
    }

    /**
     * True when nothing would be lost by dropping this session: no connections, nothing
     * buffered and no store write still queued on the persistence lane.
     */
    public boolean isIdle() {
        return connections.isEmpty() && buffer.isIdle() && queuedWrites.get() == 0;
    }

    public boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
        locks.clear();
    }
}
