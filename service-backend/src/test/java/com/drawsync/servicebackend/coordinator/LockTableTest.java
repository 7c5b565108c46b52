package com.drawsync.servicebackend.coordinator;

import com.drawsync.servicebackend.coordinator.LockTable.LockDecision;
import com.drawsync.servicebackend.coordinator.LockTable.ReleaseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LockTableTest {
    private static final Instant START = Instant.parse("2026-01-01T10:00:00Z");

    private MutableClock clock;
    private LockTable locks;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        locks = new LockTable(clock, Duration.ofSeconds(30));
    }

    @Test
    void grantsFreeObject() {
        LockDecision decision = locks.request("shape-1", 1L, "c1");

        assertTrue(decision.granted());
        assertEquals(1L, decision.lock().holderUserId());
        assertEquals(START, decision.lock().acquiredAt());
        assertEquals(1, locks.activeLocks().size());
    }

    @Test
    void deniesOtherUserWhileHeldAndReportsHolder() {
        locks.request("shape-1", 1L, "c1");
        clock.advance(Duration.ofSeconds(29));

        LockDecision decision = locks.request("shape-1", 2L, "c2");

        assertFalse(decision.granted());
        assertEquals(1L, decision.lock().holderUserId());
        assertEquals(1L, locks.holder("shape-1").orElseThrow().holderUserId());
    }

    @Test
    void lockOlderThanTimeoutGoesToNextRequester() {
        locks.request("shape-1", 1L, "c1");
        clock.advance(Duration.ofSeconds(30));

        LockDecision decision = locks.request("shape-1", 2L, "c2");

        assertTrue(decision.granted());
        assertEquals(2L, locks.holder("shape-1").orElseThrow().holderUserId());
    }

    @Test
    void holderRequestingAgainRefreshesTimestamp() {
        locks.request("shape-1", 1L, "c1");
        clock.advance(Duration.ofSeconds(20));
        assertTrue(locks.request("shape-1", 1L, "c1").granted());

        clock.advance(Duration.ofSeconds(20));

        assertFalse(locks.request("shape-1", 2L, "c2").granted());
        assertEquals(START.plusSeconds(20), locks.holder("shape-1").orElseThrow().acquiredAt());
    }

    @Test
    void releaseOnlyByHolder() {
        locks.request("shape-1", 1L, "c1");

        assertEquals(ReleaseResult.HELD_BY_OTHER, locks.release("shape-1", 2L));
        assertTrue(locks.holder("shape-1").isPresent());
        assertEquals(ReleaseResult.RELEASED, locks.release("shape-1", 1L));
        assertEquals(ReleaseResult.NOT_LOCKED, locks.release("shape-1", 1L));
    }

    @Test
    void releaseAllHeldByConnectionIncludesExpiredLocks() {
        locks.request("shape-2", 1L, "c1");
        locks.request("shape-1", 1L, "c1");
        locks.request("shape-3", 1L, "c1-other-tab");
        locks.request("shape-4", 2L, "c2");
        clock.advance(Duration.ofMinutes(5));

        List<ObjectLock> released = locks.releaseAllHeldBy("c1");

        assertEquals(List.of("shape-1", "shape-2"), released.stream().map(ObjectLock::objectId).toList());
        assertEquals(2, locks.size());
    }

    @Test
    void activeLocksOmitExpiredEntries() {
        locks.request("shape-1", 1L, "c1");
        clock.advance(Duration.ofSeconds(10));
        locks.request("shape-2", 2L, "c2");
        clock.advance(Duration.ofSeconds(25));

        assertEquals(List.of("shape-2"), locks.activeLocks().stream().map(ObjectLock::objectId).toList());
        assertEquals(2, locks.size());
    }
}
