package com.drawsync.servicebackend.room;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * One flushed drawing element. Rows are only ever appended (or all deleted on clear); a later
 * edit of the same element id becomes a new row.
 */
@Entity
@Table(name = "room_elements", indexes = @Index(name = "idx_room_elements_room", columnList = "room_id"))
public class RoomElement {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "room_id")
    private Room room;

    @Column(nullable = false, length = 128)
    private String elementId;

    @Column(length = 128)
    private String layerId;

    @Lob
    @Column(nullable = false)
    private String payload;

    @Column(nullable = false)
    private Instant flushedAt = Instant.now();

    protected RoomElement() {
    }

    public RoomElement(Room room, String elementId, String layerId, String payload) {
        this.room = room;
        this.elementId = elementId;
        this.layerId = layerId;
        this.payload = payload;
    }

    public Long getId() {
        return id;
    }

    public String getElementId() {
        return elementId;
    }

    public String getLayerId() {
        return layerId;
    }

    public String getPayload() {
        return payload;
    }

    public Instant getFlushedAt() {
        return flushedAt;
    }
}
