package com.drawsync.servicebackend.coordinator;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One drawing element as sent by the canvas client. The payload is kept verbatim; only the
 * identity and owning layer are read out of it.
 */
public record DrawingElement(String id, String layerId, @JsonValue JsonNode data) {

    public static DrawingElement from(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new CoordinatorException(ErrorCode.INVALID_REQUEST, "Drawing element must be an object");
        }
        JsonNode id = node.get("id");
        if (id == null || id.isNull() || id.asText().isBlank()) {
            throw new CoordinatorException(ErrorCode.INVALID_REQUEST, "Drawing element id is required");
        }
        JsonNode layer = node.hasNonNull("layerId") ? node.get("layerId") : node.get("layer");
        String layerId = layer == null || layer.isNull() ? null : layer.asText();
        return new DrawingElement(id.asText(), layerId, node);
    }
}
