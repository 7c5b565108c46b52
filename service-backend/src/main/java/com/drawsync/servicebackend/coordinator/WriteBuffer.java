package com.drawsync.servicebackend.coordinator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pending, not yet durable elements of one room, keyed by element id (last value wins).
 * Confined to the room's command lane except for {@link #isCurrent(FlushBatch)} and
 * {@link #markWritten(FlushBatch)}, which the persistence lane calls.
 */
public class WriteBuffer {
    private final Long roomId;
    private final AtomicLong generation = new AtomicLong();
    private LinkedHashMap<String, DrawingElement> pending = new LinkedHashMap<>();
    private FlushBatch inFlight;
    private volatile FlushBatch written;

    public WriteBuffer(Long roomId) {
        this.roomId = roomId;
    }

    public void enqueue(DrawingElement element) {
        pending.put(element.id(), element);
    }

    /**
     * Takes everything pending as one batch and leaves the buffer empty, so elements enqueued
     * while the batch is being written land in the next batch. Returns empty while a previous
     * batch is still in flight.
     */
    public Optional<FlushBatch> drain() {
        if (inFlight != null || pending.isEmpty()) {
            return Optional.empty();
        }
        LinkedHashMap<String, DrawingElement> unique = new LinkedHashMap<>();
        pending.values().forEach(element -> unique.put(element.id(), element));
        inFlight = new FlushBatch(roomId, generation.get(), List.copyOf(unique.values()));
        pending = new LinkedHashMap<>();
        return Optional.of(inFlight);
    }

    /**
     * Records that the batch is in the store, ahead of its completion on the command lane.
     */
    public void markWritten(FlushBatch batch) {
        written = batch;
    }

    public void complete(FlushBatch batch) {
        if (inFlight == batch) {
            inFlight = null;
        }
        if (written == batch) {
            written = null;
        }
    }

    /**
     * Puts a failed batch back in front of whatever was enqueued since. Newer pending values
     * for the same id win. Batches from before a clear are dropped.
     */
    public void restore(FlushBatch batch) {
        if (inFlight == batch) {
            inFlight = null;
        }
        if (!isCurrent(batch)) {
            return;
        }
        LinkedHashMap<String, DrawingElement> merged = new LinkedHashMap<>();
        batch.elements().forEach(element -> merged.put(element.id(), element));
        merged.putAll(pending);
        pending = merged;
    }

    /**
     * Drops pending and in-flight elements and starts a new generation.
     */
    public long reset() {
        pending = new LinkedHashMap<>();
        inFlight = null;
        written = null;
        return generation.incrementAndGet();
    }

    public boolean isCurrent(FlushBatch batch) {
        return batch.generation() == generation.get();
    }

    /**
     * In-flight and pending elements, deduplicated by id with pending values winning. An
     * in-flight batch already marked written is left out since the store has it.
     */
    public List<DrawingElement> unflushed() {
        LinkedHashMap<String, DrawingElement> all = new LinkedHashMap<>();
        if (inFlight != null && inFlight != written) {
            inFlight.elements().forEach(element -> all.put(element.id(), element));
        }
        all.putAll(pending);
        return new ArrayList<>(all.values());
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean isIdle() {
        return pending.isEmpty() && inFlight == null;
    }
}
