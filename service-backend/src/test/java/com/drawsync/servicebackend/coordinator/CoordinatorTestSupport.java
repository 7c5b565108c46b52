package com.drawsync.servicebackend.coordinator;

import com.drawsync.servicebackend.message.ServerEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

final class CoordinatorTestSupport {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CoordinatorTestSupport() {
    }

    static ErrorCode errorCode(CompletableFuture<?> future) {
        CompletionException failure = assertThrows(CompletionException.class, future::join);
        return assertInstanceOf(CoordinatorException.class, failure.getCause()).getCode();
    }

    static ObjectNode element(String id, String stroke) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", id);
        node.put("layerId", "layer-1");
        node.put("stroke", stroke);
        return node;
    }

    static Map<?, ?> data(ServerEvent event) {
        return (Map<?, ?>) event.data();
    }

    @SuppressWarnings("unchecked")
    static List<RosterEntry> roster(ServerEvent participantsUpdated) {
        return (List<RosterEntry>) data(participantsUpdated).get("participants");
    }

    static List<String> ids(List<DrawingElement> elements) {
        return elements.stream().map(DrawingElement::id).toList();
    }

    static String stroke(DrawingElement element) {
        return element.data().get("stroke").asText();
    }
}
