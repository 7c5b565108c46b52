package com.drawsync.servicebackend.room;

import com.drawsync.servicebackend.coordinator.CoordinatorException;
import com.drawsync.servicebackend.coordinator.DrawingElement;
import com.drawsync.servicebackend.coordinator.ErrorCode;
import com.drawsync.servicebackend.coordinator.store.ParticipantRecord;
import com.drawsync.servicebackend.coordinator.store.ParticipantRole;
import com.drawsync.servicebackend.coordinator.store.RoomRecord;
import com.drawsync.servicebackend.coordinator.store.RoomStateStore;
import com.drawsync.servicebackend.user.AppUser;
import com.drawsync.servicebackend.user.AppUserRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
public class JpaRoomStateStore implements RoomStateStore {
    private static final Logger log = LoggerFactory.getLogger(JpaRoomStateStore.class);

    private final RoomRepository rooms;
    private final ParticipantRepository participants;
    private final RoomElementRepository elements;
    private final AppUserRepository users;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public JpaRoomStateStore(RoomRepository rooms,
                             ParticipantRepository participants,
                             RoomElementRepository elements,
                             AppUserRepository users) {
        this.rooms = rooms;
        this.participants = participants;
        this.elements = elements;
        this.users = users;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RoomRecord> findRoomById(Long roomId) {
        return rooms.findById(roomId).map(JpaRoomStateStore::toRecord);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RoomRecord> findRoomByCode(String roomCode) {
        return rooms.findByRoomCodeIgnoreCase(roomCode).map(JpaRoomStateStore::toRecord);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DrawingElement> readElements(Long roomId) {
        return elements.findByRoomIdOrderByIdAsc(roomId).stream()
                .map(this::toElement)
                .toList();
    }

    @Override
    @Transactional
    public void appendElements(Long roomId, List<DrawingElement> batch) {
        if (batch.isEmpty()) {
            return;
        }
        Room room = requireRoom(roomId);
        List<RoomElement> rows = batch.stream()
                .map(element -> new RoomElement(room, element.id(), element.layerId(), writePayload(element)))
                .toList();
        elements.saveAll(rows);
        room.touch();
        log.debug("Appended {} elements to room {}", rows.size(), roomId);
    }

    @Override
    @Transactional
    public void clearElements(Long roomId) {
        int removed = elements.deleteAllInRoom(roomId);
        rooms.findById(roomId).ifPresent(Room::touch);
        log.info("Removed {} persisted elements from room {}", removed, roomId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ParticipantRecord> findParticipant(Long roomId, Long userId) {
        return participants.findByRoomIdAndUserId(roomId, userId).map(JpaRoomStateStore::toRecord);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ParticipantRecord> findActiveParticipants(Long roomId) {
        return participants.findByRoomIdAndBannedFalseOrderByJoinedAtAsc(roomId).stream()
                .map(JpaRoomStateStore::toRecord)
                .toList();
    }

    @Override
    @Transactional
    public ParticipantRecord createParticipant(Long roomId, Long userId, ParticipantRole role) {
        Room room = requireRoom(roomId);
        AppUser user = users.findById(userId)
                .orElseThrow(() -> new CoordinatorException(ErrorCode.NOT_FOUND, "User " + userId + " not found"));
        Participant saved = participants.save(new Participant(room, user, role));
        log.info("User '{}' admitted to room {} as {}", user.getUsername(), roomId, role);
        return toRecord(saved);
    }

    @Override
    @Transactional
    public void updateRole(Long roomId, Long userId, ParticipantRole role) {
        requireParticipant(roomId, userId).setRole(role);
    }

    @Override
    @Transactional
    public void setBanned(Long roomId, Long userId, boolean banned) {
        requireParticipant(roomId, userId).setBanned(banned);
    }

    @Override
    @Transactional
    public void touchLastSeen(Long roomId, Long userId) {
        participants.findByRoomIdAndUserId(roomId, userId)
                .ifPresent(participant -> participant.setLastSeen(Instant.now()));
    }

    @Override
    @Transactional
    public void deleteParticipant(Long roomId, Long userId) {
        participants.delete(requireParticipant(roomId, userId));
    }

    private Room requireRoom(Long roomId) {
        return rooms.findById(roomId)
                .orElseThrow(() -> new CoordinatorException(ErrorCode.NOT_FOUND, "Room " + roomId + " not found"));
    }

    private Participant requireParticipant(Long roomId, Long userId) {
        return participants.findByRoomIdAndUserId(roomId, userId)
                .orElseThrow(() -> new CoordinatorException(ErrorCode.NOT_FOUND, "Participant not found"));
    }

    private String writePayload(DrawingElement element) {
        try {
            return objectMapper.writeValueAsString(element.data());
        } catch (JsonProcessingException e) {
            throw new CoordinatorException(ErrorCode.PERSISTENCE_FAILURE, "Failed to serialize element " + element.id(), e);
        }
    }

    private DrawingElement toElement(RoomElement row) {
        try {
            return new DrawingElement(row.getElementId(), row.getLayerId(), objectMapper.readTree(row.getPayload()));
        } catch (JsonProcessingException e) {
            throw new CoordinatorException(ErrorCode.PERSISTENCE_FAILURE, "Corrupt element " + row.getElementId(), e);
        }
    }

    private static RoomRecord toRecord(Room room) {
        return new RoomRecord(
                room.getId(),
                room.getRoomCode(),
                room.getName(),
                room.getVisibility() == RoomVisibility.PUBLIC,
                room.getOwner().getId(),
                room.isActive()
        );
    }

    private static ParticipantRecord toRecord(Participant participant) {
        AppUser user = participant.getUser();
        return new ParticipantRecord(
                participant.getRoom().getId(),
                user.getId(),
                user.getUsername(),
                user.getAvatar(),
                participant.getRole(),
                participant.isBanned(),
                participant.getJoinedAt(),
                participant.getLastSeen()
        );
    }
}
