package com.drawsync.servicebackend.room;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ParticipantRepository extends JpaRepository<Participant, Long> {
    @EntityGraph(attributePaths = "user")
    Optional<Participant> findByRoomIdAndUserId(Long roomId, Long userId);

    @EntityGraph(attributePaths = "user")
    List<Participant> findByRoomIdAndBannedFalseOrderByJoinedAtAsc(Long roomId);
}
