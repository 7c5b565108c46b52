package com.drawsync.servicebackend.coordinator;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

public record ObjectLock(
        String objectId,
        Long holderUserId,
        @JsonIgnore String holderConnectionId,
        Instant acquiredAt
) {
}
