package com.drawsync.servicebackend.coordinator.store;

import com.drawsync.servicebackend.coordinator.DrawingElement;

import java.util.List;
import java.util.Optional;

/**
 * Durable side of a drawing room. The coordinator reads the element list once per join,
 * appends flushed batches, and manages participant rows through this contract.
 *
 * <p>Implementations may block; callers never invoke them while holding in-memory room state
 * in an inconsistent shape.
 */
public interface RoomStateStore {

    Optional<RoomRecord> findRoomById(Long roomId);

    Optional<RoomRecord> findRoomByCode(String roomCode);

    /**
     * Full persisted element list of the room, in append order.
     */
    List<DrawingElement> readElements(Long roomId);

    /**
     * Appends one batch to the room's element list in a single write.
     */
    void appendElements(Long roomId, List<DrawingElement> batch);

    void clearElements(Long roomId);

    Optional<ParticipantRecord> findParticipant(Long roomId, Long userId);

    /**
     * Non-banned participants of the room.
     */
    List<ParticipantRecord> findActiveParticipants(Long roomId);

    ParticipantRecord createParticipant(Long roomId, Long userId, ParticipantRole role);

    void updateRole(Long roomId, Long userId, ParticipantRole role);

    void setBanned(Long roomId, Long userId, boolean banned);

    void touchLastSeen(Long roomId, Long userId);

    /**
     * Deletes the participant row, which also drops the user from the room's membership.
     */
    void deleteParticipant(Long roomId, Long userId);
}
