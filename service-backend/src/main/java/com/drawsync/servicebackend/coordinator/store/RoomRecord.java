package com.drawsync.servicebackend.coordinator.store;

/**
 * Read-only view of a persisted room, as much of it as the coordinator needs.
 */
public record RoomRecord(
        Long id,
        String roomCode,
        String name,
        boolean publicRoom,
        Long ownerId,
        boolean active
) {
}
