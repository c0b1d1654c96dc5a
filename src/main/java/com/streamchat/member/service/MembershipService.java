package com.streamchat.member.service;

import com.streamchat.config.ChatProperties;
import com.streamchat.event.ChatEvent;
import com.streamchat.event.ChatEventPublisher;
import com.streamchat.exception.ChatForbiddenException;
import com.streamchat.member.model.ChatRoles;
import com.streamchat.member.model.ChatUser;
import com.streamchat.member.model.ChatUserProfile;
import com.streamchat.member.model.PublicUser;
import com.streamchat.member.model.UserIdentity;
import com.streamchat.message.model.ChatMessage;
import com.streamchat.message.service.MessageRecorder;
import com.streamchat.room.model.RoomState;
import com.streamchat.room.service.RoomRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * MembershipService
 * ──────────────────────────────────────────────────────────────
 * Presence of users in rooms.
 * - join: membership record, replay of recent history, join notices
 * - leave: idempotent removal, leave notices, eviction scheduling once the room is empty
 * All state changes run under the room lock, so the member count always equals the number of
 * present ChatUser entries.
 */
@Service
public class MembershipService {

    private static final Logger logger = LoggerFactory.getLogger(MembershipService.class);

    private final RoomRegistry roomRegistry;
    private final MessageRecorder messageRecorder;
    private final ChatEventPublisher eventPublisher;
    private final UserColorPalette colorPalette;
    private final ChatProperties chatProperties;
    private final Clock clock;

    public MembershipService(
            RoomRegistry roomRegistry,
            MessageRecorder messageRecorder,
            ChatEventPublisher eventPublisher,
            UserColorPalette colorPalette,
            ChatProperties chatProperties,
            Clock clock) {

        this.roomRegistry = roomRegistry;
        this.messageRecorder = messageRecorder;
        this.eventPublisher = eventPublisher;
        this.colorPalette = colorPalette;
        this.chatProperties = chatProperties;
        this.clock = clock;
    }

    @Getter
    public static class JoinResult {
        private final String roomId;
        private final ChatUser user;
        private final List<ChatMessage> recentMessages;
        private final int userCount;

        JoinResult(String roomId, ChatUser user, List<ChatMessage> recentMessages, int userCount) {
            this.roomId = roomId;
            this.user = user;
            this.recentMessages = recentMessages;
            this.userCount = userCount;
        }
    }

    /**
     * @method join
     * @brief Registers {@code identity} in {@code room}. A room deleted by eviction between
     *        lookup and lock is re-resolved by id and the join retried on the live instance.
     * @throws ChatForbiddenException the user is on the room's ban list
     */
    public JoinResult join(RoomState room, UserIdentity identity) {
        RoomState target = room;
        while (true) {
            RoomState candidate = target;
            Optional<JoinResult> result = candidate.withLock(() -> joinLocked(candidate, identity));
            if (result.isPresent()) {
                return result.get();
            }
            logger.info("[join retry] room closed before join, re-resolving: roomId={}", candidate.getId());
            target = roomRegistry.getOrCreate(candidate.getId());
        }
    }

    private Optional<JoinResult> joinLocked(RoomState room, UserIdentity identity) {
        if (!room.isActive()) {
            return Optional.empty();
        }
        if (room.isBanned(identity.getUserId())) {
            throw new ChatForbiddenException("You are banned from this chat");
        }

        Instant now = clock.instant();
        ChatUser user = new ChatUser(
                identity.getUserId(),
                identity.getUsername(),
                identity.getDisplayName(),
                identity.getRoles().isEmpty() ? Set.of(ChatRoles.VIEWER) : identity.getRoles(),
                now,
                colorPalette.resolve(identity.getUserId(), identity.getColor()));

        room.putMember(user, now);
        eventPublisher.subscribe(room.getId(), user.getId());

        // replay is taken before the join notice is recorded
        List<ChatMessage> recent = room.getHistory().recent(chatProperties.getReplaySize());
        int userCount = room.getMemberCount();

        eventPublisher.sendToUser(user.getId(),
                new ChatEvent.RoomJoined(room.getId(), ChatUserProfile.of(user), recent, userCount));
        eventPublisher.broadcastExcept(room.getId(), user.getId(), new ChatEvent.UserJoined(PublicUser.of(user)));
        messageRecorder.systemMessage(room, user.getDisplayName() + " joined the chat");

        logger.info("[join] roomId={}, userId={}, username={}, userCount={}",
                room.getId(), user.getId(), user.getUsername(), userCount);
        return Optional.of(new JoinResult(room.getId(), user, recent, userCount));
    }

    /**
     * @method leave
     * @brief Removes the user from the room. Leaving a room one is not in, or a room that no
     *        longer exists, is a no-op.
     * @return true if a membership was actually removed
     */
    public boolean leave(String roomId, String userId) {
        Optional<RoomState> found = roomRegistry.get(roomId);
        if (found.isEmpty()) {
            return false;
        }
        RoomState room = found.get();

        boolean left = room.withLock(() -> {
            Optional<ChatUser> removed = room.removeMember(userId, clock.instant());
            if (removed.isEmpty()) {
                return false;
            }
            ChatUser user = removed.get();
            eventPublisher.unsubscribe(room.getId(), userId);
            eventPublisher.broadcast(room.getId(), new ChatEvent.UserLeft(userId, user.getUsername()));
            messageRecorder.systemMessage(room, user.getDisplayName() + " left the chat");

            logger.info("[leave] roomId={}, userId={}, userCount={}", room.getId(), userId, room.getMemberCount());
            return true;
        });

        if (left) {
            roomRegistry.scheduleEvictionIfEmpty(room);
        }
        return left;
    }

    public static boolean isModerator(ChatUser user) {
        return user.isModerator();
    }
}
