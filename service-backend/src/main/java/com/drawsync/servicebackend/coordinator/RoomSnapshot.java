package com.drawsync.servicebackend.coordinator;

import java.util.List;

/**
 * Everything a newly joined connection needs to render the room: persisted elements, elements
 * still waiting for a flush, live locks and the roster.
 */
public record RoomSnapshot(
        Long roomId,
        String roomCode,
        String name,
        List<DrawingElement> persistedElements,
        List<DrawingElement> pendingElements,
        List<ObjectLock> activeLocks,
        List<RosterEntry> roster
) {
}
