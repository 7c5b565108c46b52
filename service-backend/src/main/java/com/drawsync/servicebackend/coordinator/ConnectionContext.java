package com.drawsync.servicebackend.coordinator;

import java.time.Instant;

public record ConnectionContext(String connectionId, Long userId, Long roomId, Instant joinedAt) {
}
