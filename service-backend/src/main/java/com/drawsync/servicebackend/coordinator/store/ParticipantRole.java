package com.drawsync.servicebackend.coordinator.store;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ParticipantRole {
    @JsonProperty("owner")
    OWNER,
    @JsonProperty("moderator")
    MODERATOR,
    @JsonProperty("member")
    MEMBER;

    public boolean canModerate() {
        return this == OWNER || this == MODERATOR;
    }
}
