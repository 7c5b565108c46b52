package com.drawsync.servicebackend.web.dto;

import com.drawsync.servicebackend.coordinator.ObjectLock;
import com.drawsync.servicebackend.coordinator.RoomActivity;

import java.util.List;

public record RoomSessionDto(Long roomId, boolean live, int connections, List<ObjectLock> activeLocks, int pendingElements) {
    public static RoomSessionDto from(RoomActivity activity) {
        return new RoomSessionDto(activity.roomId(), true, activity.connections(),
                activity.activeLocks(), activity.pendingElements());
    }

    public static RoomSessionDto idle(Long roomId) {
        return new RoomSessionDto(roomId, false, 0, List.of(), 0);
    }
}
