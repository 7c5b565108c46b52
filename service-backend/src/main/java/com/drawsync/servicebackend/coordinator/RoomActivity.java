package com.drawsync.servicebackend.coordinator;

import java.util.List;

public record RoomActivity(Long roomId, int connections, List<ObjectLock> activeLocks, int pendingElements) {
}
