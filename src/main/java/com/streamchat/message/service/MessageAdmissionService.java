package com.streamchat.message.service;

import com.streamchat.config.ChatProperties;
import com.streamchat.exception.ChatForbiddenException;
import com.streamchat.exception.ChatNotFoundException;
import com.streamchat.exception.InvalidChatRequestException;
import com.streamchat.exception.RateLimitedException;
import com.streamchat.member.model.ChatRoles;
import com.streamchat.member.model.ChatUser;
import com.streamchat.message.filter.ContentFilter;
import com.streamchat.message.model.ChatMessage;
import com.streamchat.message.model.MessageKind;
import com.streamchat.room.model.RoomSettings;
import com.streamchat.room.model.RoomState;
import com.streamchat.room.service.RoomRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * MessageAdmissionService
 * ──────────────────────────────────────────────────────────────
 * Runs an incoming chat message through the room's admission checks, in order, stopping at the
 * first failure:
 *   1) membership  2) ban  3) mute (expired mutes are cleared here)  4) slow mode
 *   5) subscriber-only  6) word filter (redacts, never rejects)
 * An accepted message is recorded into history and broadcast as new-message.
 */
@Service
public class MessageAdmissionService {

    private static final Logger logger = LoggerFactory.getLogger(MessageAdmissionService.class);

    public static final String FILTERED_REASON = "contained filtered words";

    private final RoomRegistry roomRegistry;
    private final ContentFilter contentFilter;
    private final MessageRecorder messageRecorder;
    private final ChatProperties chatProperties;
    private final Clock clock;

    public MessageAdmissionService(
            RoomRegistry roomRegistry,
            ContentFilter contentFilter,
            MessageRecorder messageRecorder,
            ChatProperties chatProperties,
            Clock clock) {

        this.roomRegistry = roomRegistry;
        this.contentFilter = contentFilter;
        this.messageRecorder = messageRecorder;
        this.chatProperties = chatProperties;
        this.clock = clock;
    }

    /**
     * @method submit
     * @return the accepted (possibly redacted) message
     * @throws ChatNotFoundException   room absent, or sender not in the room
     * @throws ChatForbiddenException  banned, muted, or subscriber-only violation
     * @throws RateLimitedException    slow mode, with the remaining wait in whole seconds
     */
    public ChatMessage submit(String roomId, String userId, String body, String replyToId) {
        RoomState room = roomRegistry.require(roomId);

        return room.withLock(() -> {
            Instant now = clock.instant();
            ChatUser user = requireSender(room, userId);
            validateBody(body);

            if (user.isBanned()) {
                throw new ChatForbiddenException("You are banned from this chat");
            }
            checkMute(user, now);

            RoomSettings settings = room.getRoom().getSettings();
            if (settings.isSlowMode() && !user.isModerator()) {
                checkSlowMode(room, userId, settings.getSlowModeInterval(), now);
            }
            if (settings.isSubscriberOnly() && !user.hasRole(ChatRoles.SUBSCRIBER) && !user.isModerator()) {
                throw new ChatForbiddenException("This chat is in subscriber-only mode");
            }

            String filtered = contentFilter.redact(body, settings.getFilterPatterns());
            boolean moderated = !filtered.equals(body);

            ChatMessage message = ChatMessage.builder()
                    .id(MessageRecorder.newMessageId())
                    .roomId(room.getId())
                    .userId(userId)
                    .username(user.getUsername())
                    .body(filtered)
                    .timestamp(now)
                    .kind(MessageKind.MESSAGE)
                    .replyToId(replyToId)
                    .moderated(moderated)
                    .moderationReason(moderated ? FILTERED_REASON : null)
                    .build();

            messageRecorder.record(room, message);
            room.touch(now);

            logger.debug("[message] roomId={}, userId={}, moderated={}, length={}",
                    room.getId(), userId, moderated, filtered.length());
            return message;
        });
    }

    private ChatUser requireSender(RoomState room, String userId) {
        Optional<ChatUser> sender = room.findMember(userId);
        if (sender.isPresent()) {
            return sender.get();
        }
        if (room.isBanned(userId)) {
            throw new ChatForbiddenException("You are banned from this chat");
        }
        throw new ChatNotFoundException("You are not in this room");
    }

    private void checkMute(ChatUser user, Instant now) {
        if (!user.isMuted()) {
            return;
        }
        if (user.isMuteActive(now)) {
            throw new ChatForbiddenException("You are muted in this chat");
        }
        // expiry observed lazily, on the first send after it
        user.clearMute();
    }

    /**
     * Remaining wait is rounded up, so a fractional remainder is never reported as 0 while the
     * message is still being blocked.
     */
    private void checkSlowMode(RoomState room, String userId, int intervalSeconds, Instant now) {
        Optional<ChatMessage> last = room.getHistory().lastMessageBy(userId, MessageKind.MESSAGE);
        if (last.isEmpty()) {
            return;
        }
        long elapsedMillis = Duration.between(last.get().getTimestamp(), now).toMillis();
        long intervalMillis = intervalSeconds * 1000L;
        if (elapsedMillis < intervalMillis) {
            long waitSeconds = (long) Math.ceil((intervalMillis - elapsedMillis) / 1000.0);
            throw new RateLimitedException(waitSeconds);
        }
    }

    private void validateBody(String body) {
        if (body == null || body.isBlank()) {
            throw new InvalidChatRequestException("Message must not be empty");
        }
        if (body.length() > chatProperties.getMaxMessageLength()) {
            throw new InvalidChatRequestException(
                    "Message exceeds " + chatProperties.getMaxMessageLength() + " characters");
        }
    }
}
