package com.drawsync.servicebackend.room;

public enum RoomVisibility {
    PUBLIC,
    PRIVATE
}
