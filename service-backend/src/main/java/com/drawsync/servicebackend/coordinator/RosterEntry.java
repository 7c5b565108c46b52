package com.drawsync.servicebackend.coordinator;

import com.drawsync.servicebackend.coordinator.store.ParticipantRecord;
import com.drawsync.servicebackend.coordinator.store.ParticipantRole;

import java.time.Instant;

public record RosterEntry(
        Long userId,
        String username,
        String avatar,
        ParticipantRole role,
        Instant joinedAt,
        Instant lastSeen,
        boolean connected
) {
    public static RosterEntry of(ParticipantRecord participant, boolean connected) {
        return new RosterEntry(
                participant.userId(),
                participant.username(),
                participant.avatar(),
                participant.role(),
                participant.joinedAt(),
                participant.lastSeen(),
                connected
        );
    }
}
