package com.drawsync.servicebackend.coordinator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.drawsync.servicebackend.coordinator.CoordinatorTestSupport.element;
import static com.drawsync.servicebackend.coordinator.CoordinatorTestSupport.ids;
import static com.drawsync.servicebackend.coordinator.CoordinatorTestSupport.stroke;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BufferFlusherTest {
    private static final Long ROOM = 10L;

    private InMemoryRoomStateStore store;
    private ManualExecutor persistence;
    private SessionRegistry registry;
    private RoomCoordinator coordinator;
    private BufferFlusher flusher;
    private RecordingConnection alice;
    private RecordingConnection bob;

    @BeforeEach
    void setUp() {
        store = new InMemoryRoomStateStore();
        store.addUser(1L, "alice");
        store.addUser(2L, "bob");
        store.addRoom(ROOM, "ABC123", true, 1L);

        persistence = new ManualExecutor();
        registry = new SessionRegistry(new MutableClock(Instant.parse("2026-01-01T10:00:00Z")),
                Duration.ofSeconds(30), Runnable::run, persistence);
        coordinator = new RoomCoordinator(registry, store);
        flusher = new BufferFlusher(registry, store, Duration.ofSeconds(5));

        alice = new RecordingConnection("c1", 1L, "alice");
        bob = new RecordingConnection("c2", 2L, "bob");
        coordinator.join(alice, "10").join();
        coordinator.join(bob, "10").join();
    }

    @AfterEach
    void tearDown() {
        flusher.shutdown();
    }

    private void tick() {
        flusher.flushAll();
        persistence.runAll();
    }

    @Test
    void nonPersistentUpdatesNeverReachTheStore() {
        coordinator.drawingUpdate(alice, ROOM, element("e1", "red"), false).join();

        tick();

        assertTrue(store.appendedBatches().isEmpty());
    }

    @Test
    void repeatedUpdatesOfOneElementFlushAsOneCopy() {
        coordinator.drawingUpdate(alice, ROOM, element("e1", "red"), true).join();
        coordinator.drawingUpdate(bob, ROOM, element("e1", "blue"), true).join();

        tick();

        List<DrawingElement> persisted = store.readElements(ROOM);
        assertEquals(List.of("e1"), ids(persisted));
        assertEquals("blue", stroke(persisted.get(0)));
    }

    @Test
    void elementsOfDisconnectedUserAreFlushedExactlyOnce() {
        coordinator.drawingUpdate(alice, ROOM, element("e1", "red"), true).join();
        coordinator.drawingUpdate(alice, ROOM, element("e2", "red"), true).join();
        coordinator.disconnect(alice).join();
        coordinator.disconnect(bob).join();
        assertEquals(1, coordinator.activeRoomCount());

        tick();
        tick();

        assertEquals(List.of("e1", "e2"), ids(store.readElements(ROOM)));
        assertEquals(1, store.appendedBatches().size());
        assertEquals(0, coordinator.activeRoomCount());
    }

    @Test
    void failedFlushIsRetriedWithNewestValues() {
        store.failNextAppends(1);
        coordinator.drawingUpdate(alice, ROOM, element("e1", "red"), true).join();
        coordinator.drawingUpdate(alice, ROOM, element("e2", "red"), true).join();

        tick();
        assertTrue(store.readElements(ROOM).isEmpty());
        assertEquals(2, coordinator.activity(ROOM).join().orElseThrow().pendingElements());

        coordinator.drawingUpdate(bob, ROOM, element("e2", "green"), true).join();
        tick();

        List<DrawingElement> persisted = store.readElements(ROOM);
        assertEquals(List.of("e1", "e2"), ids(persisted));
        assertEquals("green", stroke(persisted.get(1)));
    }

    @Test
    void updatesArrivingDuringFlushLandInTheNextBatch() {
        coordinator.drawingUpdate(alice, ROOM, element("e1", "red"), true).join();
        assertTrue(flusher.flushRoom(registry.room(ROOM).orElseThrow()).join().isPresent());
        coordinator.drawingUpdate(alice, ROOM, element("e2", "red"), true).join();

        assertTrue(flusher.flushRoom(registry.room(ROOM).orElseThrow()).join().isEmpty());
        persistence.runAll();
        tick();

        assertEquals(List.of(List.of("e1"), List.of("e2")),
                store.appendedBatches().stream().map(CoordinatorTestSupport::ids).toList());
    }

    @Test
    void clearDuringFlushDiscardsTheStaleBatch() {
        store.appendElements(ROOM, List.of(DrawingElement.from(element("old", "grey"))));
        coordinator.drawingUpdate(alice, ROOM, element("e1", "red"), true).join();
        flusher.flushAll();
        assertEquals(1, persistence.pending());

        coordinator.clearCanvas(bob, ROOM).join();
        coordinator.drawingUpdate(alice, ROOM, element("e2", "blue"), true).join();
        persistence.runAll();

        assertTrue(store.readElements(ROOM).isEmpty());

        tick();
        assertEquals(List.of("e2"), ids(store.readElements(ROOM)));
    }

    @Test
    void joinWhileClearIsQueuedSeesNoStaleElements() {
        coordinator.drawingUpdate(alice, ROOM, element("e1", "red"), true).join();
        tick();
        coordinator.clearCanvas(bob, ROOM).join();
        coordinator.drawingUpdate(alice, ROOM, element("e2", "blue"), true).join();
        assertEquals(1, persistence.pending());

        store.addUser(3L, "carol");
        RoomSnapshot snapshot = coordinator.join(new RecordingConnection("c3", 3L, "carol"), "10").join();

        assertTrue(snapshot.persistedElements().isEmpty());
        assertEquals(List.of("e2"), ids(snapshot.pendingElements()));
    }

    @Test
    void roomWithQueuedClearStaysLiveUntilTheClearRuns() {
        coordinator.drawingUpdate(alice, ROOM, element("e1", "red"), true).join();
        tick();
        coordinator.clearCanvas(bob, ROOM).join();
        coordinator.disconnect(alice).join();
        coordinator.disconnect(bob).join();

        assertEquals(1, coordinator.activeRoomCount());

        tick();
        assertTrue(store.readElements(ROOM).isEmpty());
        tick();
        assertEquals(0, coordinator.activeRoomCount());
    }

    @Test
    void joinDuringWriteListsEachElementOnce() {
        coordinator.drawingUpdate(alice, ROOM, element("e1", "red"), true).join();
        flusher.flushAll();
        store.appendElements(ROOM, List.of(DrawingElement.from(element("e1", "red"))));

        store.addUser(3L, "carol");
        RoomSnapshot snapshot = coordinator.join(new RecordingConnection("c3", 3L, "carol"), "10").join();

        assertTrue(snapshot.persistedElements().isEmpty());
        assertEquals(List.of("e1"), ids(snapshot.pendingElements()));
    }

    @Test
    void scheduledFlushWritesWithoutExplicitTicks() throws InterruptedException {
        ExecutorService commands = Executors.newFixedThreadPool(2);
        ExecutorService writes = Executors.newFixedThreadPool(1);
        try {
            SessionRegistry liveRegistry = new SessionRegistry(new MutableClock(Instant.now()),
                    Duration.ofSeconds(30), commands, writes);
            RoomCoordinator live = new RoomCoordinator(liveRegistry, store);
            BufferFlusher scheduled = new BufferFlusher(liveRegistry, store, Duration.ofMillis(50));
            RecordingConnection carol = new RecordingConnection("c9", 2L, "bob");
            live.join(carol, "10").join();
            live.drawingUpdate(carol, ROOM, element("e9", "pink"), true).join();

            scheduled.start();
            long deadline = System.currentTimeMillis() + 5_000;
            while (store.readElements(ROOM).isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            scheduled.shutdown();

            assertEquals(List.of("e9"), ids(store.readElements(ROOM)));
        } finally {
            commands.shutdownNow();
            writes.shutdownNow();
        }
    }
}
