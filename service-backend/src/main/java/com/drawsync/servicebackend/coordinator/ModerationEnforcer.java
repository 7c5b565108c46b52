package com.drawsync.servicebackend.coordinator;

import com.drawsync.servicebackend.coordinator.store.ParticipantRecord;
import com.drawsync.servicebackend.coordinator.store.ParticipantRole;
import com.drawsync.servicebackend.coordinator.store.RoomStateStore;
import com.drawsync.servicebackend.message.ServerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks and applies privileged participant actions. Runs on the room's command lane.
 */
public class ModerationEnforcer {
    private static final Logger log = LoggerFactory.getLogger(ModerationEnforcer.class);

    private final RoomStateStore store;

    public ModerationEnforcer(RoomStateStore store) {
        this.store = store;
    }

    public enum Action { KICK, BAN }

    /**
     * Kicks (deletes the participant) or bans (flags it, keeping the row) and tells the room.
     * Evicting the target's live connections is left to the caller.
     */
    public ParticipantRecord moderate(RoomSession session, Action action, Long actingUserId, Long targetUserId) {
        Long roomId = session.roomId();
        ParticipantRecord acting = requireModerator(roomId, actingUserId);
        ParticipantRecord target = requireTarget(roomId, actingUserId, targetUserId);

        if (acting.role() == ParticipantRole.MODERATOR && target.role() != ParticipantRole.MEMBER) {
            throw new CoordinatorException(ErrorCode.UNAUTHORIZED, "Moderators can only act on members");
        }

        if (action == Action.KICK) {
            store.deleteParticipant(roomId, targetUserId);
            log.info("User {} kicked user {} from room {}", actingUserId, targetUserId, roomId);
            session.broadcast(ServerEvent.participantKicked(targetUserId), null);
        } else {
            store.setBanned(roomId, targetUserId, true);
            log.info("User {} banned user {} from room {}", actingUserId, targetUserId, roomId);
            session.broadcast(ServerEvent.participantBanned(targetUserId), null);
        }
        return target;
    }

    /**
     * Owner-only role change: member to moderator or moderator back to member.
     */
    public ParticipantRole changeRole(RoomSession session, Long actingUserId, Long targetUserId, ParticipantRole newRole) {
        Long roomId = session.roomId();
        ParticipantRecord acting = requireParticipant(roomId, actingUserId);
        if (acting.role() != ParticipantRole.OWNER) {
            throw new CoordinatorException(ErrorCode.UNAUTHORIZED, "Only the room owner can change roles");
        }
        ParticipantRecord target = requireTarget(roomId, actingUserId, targetUserId);

        ParticipantRole expected = newRole == ParticipantRole.MODERATOR ? ParticipantRole.MEMBER : ParticipantRole.MODERATOR;
        if (newRole == ParticipantRole.OWNER || target.role() != expected) {
            throw new CoordinatorException(ErrorCode.INVALID_REQUEST,
                    "Cannot change role from " + target.role() + " to " + newRole);
        }

        store.updateRole(roomId, targetUserId, newRole);
        log.info("User {} changed role of user {} in room {} to {}", actingUserId, targetUserId, roomId, newRole);
        session.broadcast(ServerEvent.roleUpdated(targetUserId, newRole), null);
        return newRole;
    }

    private ParticipantRecord requireModerator(Long roomId, Long userId) {
        ParticipantRecord acting = requireParticipant(roomId, userId);
        if (!acting.role().canModerate()) {
            throw new CoordinatorException(ErrorCode.UNAUTHORIZED, "Not authorized");
        }
        return acting;
    }

    private ParticipantRecord requireParticipant(Long roomId, Long userId) {
        return store.findParticipant(roomId, userId)
                .filter(participant -> !participant.banned())
                .orElseThrow(() -> new CoordinatorException(ErrorCode.UNAUTHORIZED, "Not authorized"));
    }

    private ParticipantRecord requireTarget(Long roomId, Long actingUserId, Long targetUserId) {
        if (targetUserId == null) {
            throw new CoordinatorException(ErrorCode.INVALID_REQUEST, "targetUserId is required");
        }
        if (targetUserId.equals(actingUserId)) {
            throw new CoordinatorException(ErrorCode.CANNOT_ACT_ON_SELF, "Cannot perform action on yourself");
        }
        return store.findParticipant(roomId, targetUserId)
                .orElseThrow(() -> new CoordinatorException(ErrorCode.NOT_FOUND, "Participant not found"));
    }
}
