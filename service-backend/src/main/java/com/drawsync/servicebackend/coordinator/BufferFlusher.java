package com.drawsync.servicebackend.coordinator;

import com.drawsync.servicebackend.coordinator.store.RoomStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically moves every room's buffered elements into the store, one append per room.
 *
 * <p>Each flush drains the buffer on the room's command lane, writes on its persistence lane,
 * and reports back on the command lane: completed batches are forgotten, failed ones are
 * restored so the next tick retries them.
 */
public class BufferFlusher {
    private static final Logger log = LoggerFactory.getLogger(BufferFlusher.class);

    private final SessionRegistry registry;
    private final RoomStateStore store;
    private final Duration interval;
    private ScheduledExecutorService scheduler;

    public BufferFlusher(SessionRegistry registry, RoomStateStore store, Duration interval) {
        this.registry = registry;
        this.store = store;
        this.interval = interval;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "room-buffer-flush");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::flushAll, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Buffer flusher started, interval={}", interval);
    }

    public synchronized void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            log.info("Buffer flusher stopped");
        }
    }

    public void flushAll() {
        for (RoomSession session : registry.rooms()) {
            try {
                flushRoom(session);
            } catch (RuntimeException e) {
                log.error("Failed to schedule flush for room {}: {}", session.roomId(), e.getMessage(), e);
            }
        }
    }

    public CompletableFuture<Optional<FlushBatch>> flushRoom(RoomSession session) {
        return session.call(() -> {
            Optional<FlushBatch> batch = session.buffer().drain();
            if (batch.isPresent()) {
                session.persist(() -> write(session, batch.get()));
            } else {
                registry.retireIfIdle(session);
            }
            return batch;
        });
    }

    private void write(RoomSession session, FlushBatch batch) {
        if (!session.buffer().isCurrent(batch)) {
            log.debug("Skipping flush of {} elements for room {}: canvas was cleared", batch.elements().size(), batch.roomId());
            session.run(() -> session.buffer().complete(batch));
            return;
        }
        try {
            store.appendElements(batch.roomId(), batch.elements());
        } catch (RuntimeException e) {
            log.error("Failed to flush {} elements for room {}, retrying next tick: {}",
                    batch.elements().size(), batch.roomId(), e.getMessage());
            session.run(() -> session.buffer().restore(batch));
            return;
        }
        session.buffer().markWritten(batch);
        log.debug("Flushed {} elements for room {}", batch.elements().size(), batch.roomId());
        session.run(() -> {
            session.buffer().complete(batch);
            registry.retireIfIdle(session);
        });
    }
}
