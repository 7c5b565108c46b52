package com.drawsync.servicebackend.coordinator;

import com.drawsync.servicebackend.coordinator.store.RoomRecord;
import com.drawsync.servicebackend.coordinator.store.RoomStateStore;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public class RoomStateSynchronizer {
    private final RoomStateStore store;
    private final PresenceBroadcaster presence;

    public RoomStateSynchronizer(RoomStateStore store, PresenceBroadcaster presence) {
        this.store = store;
        this.presence = presence;
    }

    /**
     * Composes the join snapshot. Runs on the room's command lane after the joining connection
     * has been attached, so the joiner shows up as connected in its own roster.
     *
     * <p>An element is listed once: a persisted copy is dropped when the buffer still holds a
     * value for the same id. While a clear is queued the store's elements are stale and none
     * are listed.
     */
    public RoomSnapshot snapshot(RoomSession session, RoomRecord room) {
        List<DrawingElement> pending = session.buffer().unflushed();
        Set<String> pendingIds = pending.stream().map(DrawingElement::id).collect(Collectors.toSet());
        List<DrawingElement> persisted = session.isClearPending()
                ? List.of()
                : store.readElements(room.id()).stream()
                        .filter(element -> !pendingIds.contains(element.id()))
                        .toList();
        return new RoomSnapshot(
                room.id(),
                room.roomCode(),
                room.name(),
                persisted,
                pending,
                session.locks().activeLocks(),
                presence.roster(session)
        );
    }
}
