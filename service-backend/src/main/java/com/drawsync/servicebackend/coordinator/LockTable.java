package com.drawsync.servicebackend.coordinator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Object locks of one room. Mutated only from the room's command lane; the map is concurrent
 * so diagnostics can read it from elsewhere.
 *
 * <p>Expiry is lazy: a lock older than the timeout stays in the table until someone else
 * requests the same object.
 */
public class LockTable {
    private static final Logger log = LoggerFactory.getLogger(LockTable.class);

    private final ConcurrentHashMap<String, ObjectLock> locks = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration timeout;

    public LockTable(Clock clock, Duration timeout) {
        this.clock = clock;
        this.timeout = timeout;
    }

    public enum ReleaseResult { RELEASED, NOT_LOCKED, HELD_BY_OTHER }

    /**
     * Outcome of a lock request. {@code lock} is the granted lock, or the current holder's
     * lock when denied.
     */
    public record LockDecision(boolean granted, ObjectLock lock) {
    }

    public LockDecision request(String objectId, Long userId, String connectionId) {
        Instant now = clock.instant();
        ObjectLock current = locks.get(objectId);
        if (current != null && !current.holderUserId().equals(userId) && !isExpired(current, now)) {
            log.debug("Lock on {} denied to user {}, held by {}", objectId, userId, current.holderUserId());
            return new LockDecision(false, current);
        }
        if (current != null && !current.holderUserId().equals(userId)) {
            log.debug("Lock on {} expired for user {}, handing over to {}", objectId, current.holderUserId(), userId);
        }
        ObjectLock granted = new ObjectLock(objectId, userId, connectionId, now);
        locks.put(objectId, granted);
        return new LockDecision(true, granted);
    }

    public ReleaseResult release(String objectId, Long userId) {
        ObjectLock current = locks.get(objectId);
        if (current == null) {
            return ReleaseResult.NOT_LOCKED;
        }
        if (!current.holderUserId().equals(userId)) {
            return ReleaseResult.HELD_BY_OTHER;
        }
        locks.remove(objectId);
        return ReleaseResult.RELEASED;
    }

    /**
     * Force-releases every lock acquired through the given connection, expired or not.
     */
    public List<ObjectLock> releaseAllHeldBy(String connectionId) {
        List<ObjectLock> released = new ArrayList<>();
        for (ObjectLock lock : List.copyOf(locks.values())) {
            if (lock.holderConnectionId().equals(connectionId) && locks.remove(lock.objectId(), lock)) {
                released.add(lock);
            }
        }
        released.sort(Comparator.comparing(ObjectLock::objectId));
        return released;
    }

    public Optional<ObjectLock> holder(String objectId) {
        return Optional.ofNullable(locks.get(objectId));
    }

    /**
     * Locks that are still within the timeout.
     */
    public List<ObjectLock> activeLocks() {
        Instant now = clock.instant();
        return locks.values().stream()
                .filter(lock -> !isExpired(lock, now))
                .sorted(Comparator.comparing(ObjectLock::objectId))
                .toList();
    }

    public int size() {
        return locks.size();
    }

    public void clear() {
        locks.clear();
    }

    private boolean isExpired(ObjectLock lock, Instant now) {
        return Duration.between(lock.acquiredAt(), now).compareTo(timeout) >= 0;
    }
}
