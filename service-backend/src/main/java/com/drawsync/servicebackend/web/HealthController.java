package com.drawsync.servicebackend.web;

import com.drawsync.servicebackend.coordinator.RoomCoordinator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Health check endpoint reporting the coordinator's live load.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final RoomCoordinator coordinator;

    public HealthController(RoomCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "activeRooms", coordinator.activeRoomCount(),
                "connections", coordinator.connectionCount(),
                "roomChannel", "/ws/rooms"));
    }
}
