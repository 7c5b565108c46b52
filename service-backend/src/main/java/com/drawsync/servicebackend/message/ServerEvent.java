package com.drawsync.servicebackend.message;

import com.drawsync.servicebackend.coordinator.ErrorCode;
import com.drawsync.servicebackend.coordinator.RoomSnapshot;
import com.drawsync.servicebackend.coordinator.RosterEntry;
import com.drawsync.servicebackend.coordinator.store.ParticipantRole;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Coordinator to client event: {@code {"type": ..., "data": {...}}}.
 */
public record ServerEvent(String type, Object data) {

    public static ServerEvent roomState(RoomSnapshot snapshot) {
        return new ServerEvent("room-state", snapshot);
    }

    public static ServerEvent userJoined(Long userId, String username, ParticipantRole role) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("userId", userId);
        data.put("user", username);
        data.put("role", role);
        return new ServerEvent("user-joined", data);
    }

    public static ServerEvent userLeft(Long userId) {
        return new ServerEvent("user-left", Map.of("userId", userId));
    }

    public static ServerEvent participantsUpdated(List<RosterEntry> roster) {
        return new ServerEvent("participants-updated", Map.of("participants", roster));
    }

    public static ServerEvent cursorUpdate(Long userId, double x, double y) {
        return new ServerEvent("cursor-update", Map.of("userId", userId, "x", x, "y", y));
    }

    public static ServerEvent drawingUpdate(Long roomId, Long userId, JsonNode element, boolean persist) {
        return new ServerEvent("drawing-update", Map.of(
                "roomId", roomId,
                "userId", userId,
                "element", element,
                "persist", persist));
    }

    public static ServerEvent objectLocked(String objectId, Long userId) {
        return new ServerEvent("object-locked", Map.of("objectId", objectId, "userId", userId));
    }

    public static ServerEvent objectUnlocked(String objectId) {
        return new ServerEvent("object-unlocked", Map.of("objectId", objectId));
    }

    public static ServerEvent lockDenied(String objectId, Long lockedBy) {
        return new ServerEvent("lock-denied", Map.of("objectId", objectId, "lockedBy", lockedBy));
    }

    public static ServerEvent canvasCleared(Long roomId, Long userId) {
        return new ServerEvent("canvas-cleared", Map.of("roomId", roomId, "userId", userId));
    }

    public static ServerEvent participantKicked(Long userId) {
        return new ServerEvent("participant-kicked", Map.of("userId", userId));
    }

    public static ServerEvent participantBanned(Long userId) {
        return new ServerEvent("participant-banned", Map.of("userId", userId));
    }

    public static ServerEvent removedFromRoom(Long roomId, String reason) {
        return new ServerEvent("removed-from-room", Map.of("roomId", roomId, "reason", reason));
    }

    public static ServerEvent roleUpdated(Long userId, ParticipantRole role) {
        return new ServerEvent("role-updated", Map.of("userId", userId, "role", role));
    }

    public static ServerEvent pong() {
        return new ServerEvent("pong", Map.of());
    }

    public static ServerEvent error(ErrorCode code, String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("code", code);
        data.put("message", message);
        return new ServerEvent("error", data);
    }
}
