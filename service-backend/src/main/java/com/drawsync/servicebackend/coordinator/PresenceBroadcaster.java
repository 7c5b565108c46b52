package com.drawsync.servicebackend.coordinator;

import com.drawsync.servicebackend.coordinator.store.RoomStateStore;
import com.drawsync.servicebackend.message.ServerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Live roster and cursor fan-out for a room.
 */
public class PresenceBroadcaster {
    private static final Logger log = LoggerFactory.getLogger(PresenceBroadcaster.class);

    private final RoomStateStore store;

    public PresenceBroadcaster(RoomStateStore store) {
        this.store = store;
    }

    /**
     * Non-banned participants of the room, flagged with whether they have a live connection.
     */
    public List<RosterEntry> roster(RoomSession session) {
        Set<Long> connected = session.connectedUserIds();
        return store.findActiveParticipants(session.roomId()).stream()
                .map(participant -> RosterEntry.of(participant, connected.contains(participant.userId())))
                .toList();
    }

    public void broadcastRoster(RoomSession session) {
        List<RosterEntry> roster;
        try {
            roster = roster(session);
        } catch (RuntimeException e) {
            log.error("Failed to load roster for room {}: {}", session.roomId(), e.getMessage(), e);
            return;
        }
        session.broadcast(ServerEvent.participantsUpdated(roster), null);
    }

    public void relayCursor(RoomSession session, ClientConnection from, double x, double y) {
        session.broadcastVolatile(ServerEvent.cursorUpdate(from.userId(), x, y), from.id());
    }
}
