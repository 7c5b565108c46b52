package com.drawsync.servicebackend.room;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface RoomElementRepository extends JpaRepository<RoomElement, Long> {
    List<RoomElement> findByRoomIdOrderByIdAsc(Long roomId);

    @Modifying
    @Query("delete from RoomElement e where e.room.id = :roomId")
    int deleteAllInRoom(@Param("roomId") Long roomId);
}
