package com.drawsync.servicebackend.coordinator;

import com.drawsync.servicebackend.coordinator.store.ParticipantRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.drawsync.servicebackend.coordinator.CoordinatorTestSupport.data;
import static com.drawsync.servicebackend.coordinator.CoordinatorTestSupport.element;
import static com.drawsync.servicebackend.coordinator.CoordinatorTestSupport.errorCode;
import static com.drawsync.servicebackend.coordinator.CoordinatorTestSupport.roster;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Kick, ban and role changes as driven through the coordinator.
 */
class ModerationEnforcerTest {
    private static final Long ROOM = 10L;

    private InMemoryRoomStateStore store;
    private SessionRegistry registry;
    private RoomCoordinator coordinator;

    private RecordingConnection owner;
    private RecordingConnection moderator;
    private RecordingConnection bob;
    private RecordingConnection dave;

    @BeforeEach
    void setUp() {
        store = new InMemoryRoomStateStore();
        store.addUser(1L, "owner");
        store.addUser(2L, "alice");
        store.addUser(3L, "bob");
        store.addUser(4L, "dave");
        store.addRoom(ROOM, "ABC123", true, 1L);
        store.addParticipant(ROOM, 1L, ParticipantRole.OWNER, false);
        store.addParticipant(ROOM, 2L, ParticipantRole.MODERATOR, false);
        store.addParticipant(ROOM, 3L, ParticipantRole.MEMBER, false);
        store.addParticipant(ROOM, 4L, ParticipantRole.MEMBER, false);

        registry = new SessionRegistry(new MutableClock(Instant.parse("2026-01-01T10:00:00Z")),
                Duration.ofSeconds(30), Runnable::run, Runnable::run);
        coordinator = new RoomCoordinator(registry, store);

        owner = new RecordingConnection("c1", 1L, "owner");
        moderator = new RecordingConnection("c2", 2L, "alice");
        bob = new RecordingConnection("c3", 3L, "bob");
        dave = new RecordingConnection("c4", 4L, "dave");
        List<RecordingConnection> everyone = List.of(owner, moderator, bob, dave);
        everyone.forEach(connection -> coordinator.join(connection, "10").join());
        everyone.forEach(RecordingConnection::clearEvents);
    }

    @Test
    void memberCannotKick() {
        assertEquals(ErrorCode.UNAUTHORIZED, errorCode(coordinator.kick(bob, ROOM, 4L)));

        assertTrue(store.findParticipant(ROOM, 4L).isPresent());
        assertTrue(registry.context("c4").isPresent());
        assertTrue(owner.events().isEmpty());
    }

    @Test
    void ownerKicksMember() {
        coordinator.kick(owner, ROOM, 3L).join();

        assertTrue(store.findParticipant(ROOM, 3L).isEmpty());
        assertEquals("kicked", data(bob.lastOfType("removed-from-room")).get("reason"));
        assertTrue(registry.context("c3").isEmpty());
        assertEquals(3L, data(moderator.lastOfType("participant-kicked")).get("userId"));
        assertEquals(3L, data(dave.lastOfType("user-left")).get("userId"));
        List<RosterEntry> roster = roster(moderator.lastOfType("participants-updated"));
        assertTrue(roster.stream().noneMatch(entry -> entry.userId().equals(3L)));

        assertEquals(ErrorCode.NOT_FOUND, errorCode(coordinator.drawingUpdate(bob, ROOM, element("e1", "red"), true)));
        assertEquals(ParticipantRole.MEMBER, coordinator.join(bob, "10").join().roster().stream()
                .filter(entry -> entry.userId().equals(3L)).findFirst().orElseThrow().role());
    }

    @Test
    void bannedMemberLosesLocksAndCannotRejoin() {
        coordinator.requestLock(bob, ROOM, "obj-1").join();

        coordinator.ban(moderator, ROOM, 3L).join();

        assertTrue(store.findParticipant(ROOM, 3L).orElseThrow().banned());
        assertEquals("banned", data(bob.lastOfType("removed-from-room")).get("reason"));
        assertEquals(3L, data(owner.lastOfType("participant-banned")).get("userId"));
        assertEquals("obj-1", data(owner.lastOfType("object-unlocked")).get("objectId"));
        assertTrue(coordinator.requestLock(dave, ROOM, "obj-1").join().granted());

        assertEquals(ErrorCode.BANNED, errorCode(coordinator.join(bob, "10")));
    }

    @Test
    void moderatorCanOnlyActOnMembers() {
        RecordingConnection secondModerator = new RecordingConnection("c5", 5L, "erin");
        store.addUser(5L, "erin");
        store.addParticipant(ROOM, 5L, ParticipantRole.MODERATOR, false);
        coordinator.join(secondModerator, "10").join();

        assertEquals(ErrorCode.UNAUTHORIZED, errorCode(coordinator.kick(moderator, ROOM, 1L)));
        assertEquals(ErrorCode.UNAUTHORIZED, errorCode(coordinator.ban(moderator, ROOM, 5L)));
        assertTrue(registry.context("c5").isPresent());

        coordinator.kick(owner, ROOM, 5L).join();
        assertTrue(registry.context("c5").isEmpty());
    }

    @Test
    void selfAndUnknownTargetsAreRejected() {
        assertEquals(ErrorCode.CANNOT_ACT_ON_SELF, errorCode(coordinator.kick(owner, ROOM, 1L)));
        assertEquals(ErrorCode.CANNOT_ACT_ON_SELF, errorCode(coordinator.ban(moderator, ROOM, 2L)));
        assertEquals(ErrorCode.NOT_FOUND, errorCode(coordinator.ban(owner, ROOM, 42L)));
        assertEquals(ErrorCode.INVALID_REQUEST, errorCode(coordinator.kick(owner, ROOM, null)));
        assertNull(bob.lastOfType("participant-banned"));
    }

    @Test
    void ownerPromotesAndDemotes() {
        assertEquals(ParticipantRole.MODERATOR, coordinator.promote(owner, ROOM, 3L).join());
        assertEquals(ParticipantRole.MODERATOR, store.findParticipant(ROOM, 3L).orElseThrow().role());
        assertEquals(3L, data(dave.lastOfType("role-updated")).get("userId"));

        coordinator.kick(bob, ROOM, 4L).join();
        assertTrue(registry.context("c4").isEmpty());

        assertEquals(ParticipantRole.MEMBER, coordinator.demote(owner, ROOM, 3L).join());
        assertEquals(ParticipantRole.MEMBER, store.findParticipant(ROOM, 3L).orElseThrow().role());
    }

    @Test
    void onlyOwnerChangesRolesAndOnlyBetweenMemberAndModerator() {
        assertEquals(ErrorCode.UNAUTHORIZED, errorCode(coordinator.promote(moderator, ROOM, 3L)));
        assertEquals(ErrorCode.INVALID_REQUEST, errorCode(coordinator.promote(owner, ROOM, 2L)));
        assertEquals(ErrorCode.INVALID_REQUEST, errorCode(coordinator.demote(owner, ROOM, 3L)));
        assertEquals(ParticipantRole.MEMBER, store.findParticipant(ROOM, 3L).orElseThrow().role());
    }
}
