package com.drawsync.servicebackend.room;

import com.drawsync.servicebackend.coordinator.store.ParticipantRole;
import com.drawsync.servicebackend.user.AppUser;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * Membership of one user in one room. Kicking deletes the row; banning keeps it flagged.
 */
@Entity
@Table(name = "participants",
        uniqueConstraints = @UniqueConstraint(name = "uk_participants_room_user", columnNames = {"room_id", "user_id"}))
public class Participant {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "room_id")
    private Room room;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id")
    private AppUser user;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ParticipantRole role = ParticipantRole.MEMBER;

    @Column(nullable = false)
    private boolean banned;

    @Column(nullable = false)
    private Instant joinedAt = Instant.now();

    @Column(nullable = false)
    private Instant lastSeen = Instant.now();

    protected Participant() {
    }

    public Participant(Room room, AppUser user, ParticipantRole role) {
        this.room = room;
        this.user = user;
        this.role = role;
    }

    public Long getId() {
        return id;
    }

    public Room getRoom() {
        return room;
    }

    public AppUser getUser() {
        return user;
    }

    public ParticipantRole getRole() {
        return role;
    }

    public void setRole(ParticipantRole role) {
        this.role = role;
    }

    public boolean isBanned() {
        return banned;
    }

    public void setBanned(boolean banned) {
        this.banned = banned;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public void setLastSeen(Instant lastSeen) {
        this.lastSeen = lastSeen;
    }
}
