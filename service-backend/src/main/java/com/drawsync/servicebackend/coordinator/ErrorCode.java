package com.drawsync.servicebackend.coordinator;

public enum ErrorCode {
    NOT_FOUND,
    UNAUTHORIZED,
    BANNED,
    CONFLICT,
    PERSISTENCE_FAILURE,
    CANNOT_ACT_ON_SELF,
    INVALID_REQUEST
}
