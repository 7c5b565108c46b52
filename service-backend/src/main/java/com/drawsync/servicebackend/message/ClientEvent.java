package com.drawsync.servicebackend.message;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Client to coordinator event. Which fields are used depends on {@code type}.
 *
 * <p>{@code userId} and {@code actingUserId} are informational only; the coordinator acts as
 * the user bound to the connection at handshake.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientEvent(
        String type,            // "join-room", "drawing-update", "request-lock", ...
        String roomId,
        @JsonAlias("roomCode") String roomIdentifier,
        Long userId,
        String objectId,
        Double x,
        Double y,
        JsonNode element,
        @JsonAlias("saveToDb") Boolean persist,
        Long targetUserId,
        @JsonAlias("moderatorId") Long actingUserId
) {
}
