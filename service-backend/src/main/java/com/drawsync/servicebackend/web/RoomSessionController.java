package com.drawsync.servicebackend.web;

import com.drawsync.servicebackend.coordinator.RoomCoordinator;
import com.drawsync.servicebackend.coordinator.RosterEntry;
import com.drawsync.servicebackend.web.dto.RoomSessionDto;
import jakarta.validation.constraints.Positive;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Read-only view of the coordinator's live room state.
 */
@RestController
@Validated
@RequestMapping("/api/rooms/{roomId}")
public class RoomSessionController {
    private final RoomCoordinator coordinator;

    public RoomSessionController(RoomCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @GetMapping("/roster")
    public CompletableFuture<List<RosterEntry>> roster(@PathVariable @Positive Long roomId) {
        return coordinator.roster(roomId);
    }

    @GetMapping("/session")
    public CompletableFuture<RoomSessionDto> session(@PathVariable @Positive Long roomId) {
        return coordinator.activity(roomId)
                .thenApply(activity -> activity.map(RoomSessionDto::from).orElseGet(() -> RoomSessionDto.idle(roomId)));
    }
}
