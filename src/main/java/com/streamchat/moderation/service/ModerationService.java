package com.streamchat.moderation.service;

import com.streamchat.config.ChatProperties;
import com.streamchat.event.ChatEvent;
import com.streamchat.event.ChatEventPublisher;
import com.streamchat.exception.ChatForbiddenException;
import com.streamchat.exception.ChatNotFoundException;
import com.streamchat.exception.InvalidChatRequestException;
import com.streamchat.member.model.ChatUser;
import com.streamchat.message.model.ChatMessage;
import com.streamchat.message.service.MessageRecorder;
import com.streamchat.moderation.model.ModerationAction;
import com.streamchat.moderation.model.ModerationCommand;
import com.streamchat.room.model.RoomState;
import com.streamchat.room.service.RoomRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * ModerationService
 * ──────────────────────────────────────────────────────────────
 * Applies delete / ban / timeout / unmute against one room's state. Each action runs entirely
 * under the room lock: the state change, the targeted notice and the room broadcast are one
 * atomic step as far as the other members can observe.
 */
@Service
public class ModerationService {

    private static final Logger logger = LoggerFactory.getLogger(ModerationService.class);

    public static final String REMOVED_PLACEHOLDER = "[message removed by moderator]";
    private static final String DEFAULT_DELETE_REASON = "Removed by moderator";
    private static final String DEFAULT_BAN_REASON = "Banned by moderator";
    private static final String DEFAULT_TIMEOUT_REASON = "Timed out by moderator";

    private final RoomRegistry roomRegistry;
    private final MessageRecorder messageRecorder;
    private final ChatEventPublisher eventPublisher;
    private final ChatProperties chatProperties;
    private final Clock clock;

    public ModerationService(
            RoomRegistry roomRegistry,
            MessageRecorder messageRecorder,
            ChatEventPublisher eventPublisher,
            ChatProperties chatProperties,
            Clock clock) {

        this.roomRegistry = roomRegistry;
        this.messageRecorder = messageRecorder;
        this.eventPublisher = eventPublisher;
        this.chatProperties = chatProperties;
        this.clock = clock;
    }

    /**
     * @method apply
     * @throws ChatForbiddenException the caller is not a moderator present in the room
     * @throws ChatNotFoundException  room, message or target user absent
     */
    public void apply(String roomId, String moderatorId, ModerationCommand command) {
        if (command.getAction() == null) {
            throw new InvalidChatRequestException("Moderation action is required");
        }
        RoomState room = roomRegistry.require(roomId);

        room.runLocked(() -> {
            ChatUser moderator = room.findMember(moderatorId)
                    .filter(ChatUser::isModerator)
                    .orElseThrow(() -> new ChatForbiddenException("You do not have permission to moderate"));

            switch (command.getAction()) {
                case DELETE -> deleteMessage(room, moderator, command);
                case BAN -> ban(room, moderator, command);
                case TIMEOUT -> timeout(room, moderator, command);
                case UNMUTE -> unmute(room, moderator, command);
            }
            logger.info("[moderation] action={}, roomId={}, moderator={}, targetId={}, messageId={}",
                    command.getAction().getWireName(), room.getId(), moderator.getUsername(),
                    command.getTargetId(), command.getMessageId());
        });
    }

    private void deleteMessage(RoomState room, ChatUser moderator, ModerationCommand command) {
        if (command.getMessageId() == null) {
            throw new InvalidChatRequestException("Message ID is required");
        }
        ChatMessage message = room.getHistory().findById(command.getMessageId())
                .orElseThrow(() -> new ChatNotFoundException("Message not found"));

        String reason = command.getReason() != null ? command.getReason() : DEFAULT_DELETE_REASON;
        message.redact(REMOVED_PLACEHOLDER, reason);

        eventPublisher.broadcast(room.getId(), new ChatEvent.MessageModerated(
                message.getId(), ModerationAction.DELETE.getWireName(), moderator.getId(), reason));
    }

    private void ban(RoomState room, ChatUser moderator, ModerationCommand command) {
        ChatUser target = requireTarget(room, moderator, command);
        String reason = command.getReason() != null ? command.getReason() : DEFAULT_BAN_REASON;

        target.ban();
        room.addBan(target.getId());

        // notify first, the target stops receiving room events once unsubscribed
        eventPublisher.sendToUser(target.getId(), new ChatEvent.Moderation(
                room.getId(), ModerationAction.BAN.getWireName(), moderator.getId(), reason, null, null));
        eventPublisher.unsubscribe(room.getId(), target.getId());
        room.removeMember(target.getId(), clock.instant());

        messageRecorder.moderationNotice(room, target.getDisplayName() + " has been banned by moderator");
        eventPublisher.broadcast(room.getId(), new ChatEvent.UserBanned(target.getId(), moderator.getId()));
    }

    private void timeout(RoomState room, ChatUser moderator, ModerationCommand command) {
        ChatUser target = requireTarget(room, moderator, command);
        long duration = command.getDurationSeconds() != null
                ? command.getDurationSeconds()
                : chatProperties.getDefaultTimeout().toSeconds();
        if (duration <= 0) {
            throw new InvalidChatRequestException("Timeout duration must be positive");
        }
        long maxDuration = chatProperties.getMaxTimeout().toSeconds();
        if (duration > maxDuration) {
            throw new InvalidChatRequestException("Timeout duration must not exceed " + maxDuration + " seconds");
        }
        String reason = command.getReason() != null ? command.getReason() : DEFAULT_TIMEOUT_REASON;

        Instant expiry = clock.instant().plusSeconds(duration);
        target.muteUntil(expiry);

        eventPublisher.sendToUser(target.getId(), new ChatEvent.Moderation(
                room.getId(), ModerationAction.TIMEOUT.getWireName(), moderator.getId(), reason, duration, expiry));
        messageRecorder.moderationNotice(room,
                target.getDisplayName() + " has been timed out for " + duration + " seconds");
        eventPublisher.broadcast(room.getId(), new ChatEvent.UserTimedOut(target.getId(), duration, moderator.getId()));
    }

    /* unmuting a user who is not muted still succeeds */
    private void unmute(RoomState room, ChatUser moderator, ModerationCommand command) {
        ChatUser target = requireTarget(room, moderator, command);
        target.clearMute();

        eventPublisher.sendToUser(target.getId(), new ChatEvent.Moderation(
                room.getId(), ModerationAction.UNMUTE.getWireName(), moderator.getId(), null, null, null));
        messageRecorder.moderationNotice(room, target.getDisplayName() + " has been unmuted");
    }

    private ChatUser requireTarget(RoomState room, ChatUser moderator, ModerationCommand command) {
        if (command.getTargetId() == null) {
            throw new InvalidChatRequestException("Target user is required");
        }
        if (command.getTargetId().equals(moderator.getId())) {
            throw new InvalidChatRequestException("You cannot moderate yourself");
        }
        return room.findMember(command.getTargetId())
                .orElseThrow(() -> new ChatNotFoundException("User not found"));
    }
}
