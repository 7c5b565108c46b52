package com.drawsync.servicebackend.coordinator.store;

import java.time.Instant;

public record ParticipantRecord(
        Long roomId,
        Long userId,
        String username,
        String avatar,
        ParticipantRole role,
        boolean banned,
        Instant joinedAt,
        Instant lastSeen
) {
}
