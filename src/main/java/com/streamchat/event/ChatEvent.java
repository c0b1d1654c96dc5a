package com.streamchat.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.streamchat.exception.ChatErrorCode;
import com.streamchat.member.model.ChatUserProfile;
import com.streamchat.member.model.PublicUser;
import com.streamchat.message.model.ChatMessage;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * @class ChatEvent
 * @brief Outbound event. The set of variants is closed: the constructor is private, so the
 *        nested classes below are the only events a transport can be asked to deliver.
 *
 * On the wire an event is framed as {@code {"type": <wire name>, "data": <variant fields>}}.
 */
public abstract class ChatEvent {

    private final ChatEventType type;

    private ChatEvent(ChatEventType type) {
        this.type = type;
    }

    @JsonIgnore
    public ChatEventType getType() {
        return type;
    }

    @Getter
    public static final class Registered extends ChatEvent {
        private final String userId;
        private final String username;
        private final String displayName;

        public Registered(String userId, String username, String displayName) {
            super(ChatEventType.REGISTERED);
            this.userId = userId;
            this.username = username;
            this.displayName = displayName;
        }
    }

    @Getter
    public static final class RoomJoined extends ChatEvent {
        private final String roomId;
        private final ChatUserProfile user;
        private final List<ChatMessage> recentMessages;
        private final int userCount;

        public RoomJoined(String roomId, ChatUserProfile user, List<ChatMessage> recentMessages, int userCount) {
            super(ChatEventType.ROOM_JOINED);
            this.roomId = roomId;
            this.user = user;
            this.recentMessages = List.copyOf(recentMessages);
            this.userCount = userCount;
        }
    }

    @Getter
    public static final class UserJoined extends ChatEvent {
        private final PublicUser user;

        public UserJoined(PublicUser user) {
            super(ChatEventType.USER_JOINED);
            this.user = user;
        }
    }

    @Getter
    public static final class UserLeft extends ChatEvent {
        private final String userId;
        private final String username;

        public UserLeft(String userId, String username) {
            super(ChatEventType.USER_LEFT);
            this.userId = userId;
            this.username = username;
        }
    }

    public static final class NewMessage extends ChatEvent {
        private final ChatMessage message;

        public NewMessage(ChatMessage message) {
            super(ChatEventType.NEW_MESSAGE);
            this.message = message;
        }

        @JsonUnwrapped
        public ChatMessage getMessage() {
            return message;
        }
    }

    @Getter
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class MessageModerated extends ChatEvent {
        private final String messageId;
        private final String action;
        private final String moderatorId;
        private final String reason;

        public MessageModerated(String messageId, String action, String moderatorId, String reason) {
            super(ChatEventType.MESSAGE_MODERATED);
            this.messageId = messageId;
            this.action = action;
            this.moderatorId = moderatorId;
            this.reason = reason;
        }
    }

    @Getter
    public static final class UserBanned extends ChatEvent {
        private final String userId;
        private final String moderatorId;

        public UserBanned(String userId, String moderatorId) {
            super(ChatEventType.USER_BANNED);
            this.userId = userId;
            this.moderatorId = moderatorId;
        }
    }

    @Getter
    public static final class UserTimedOut extends ChatEvent {
        private final String userId;
        private final long duration;
        private final String moderatorId;

        public UserTimedOut(String userId, long duration, String moderatorId) {
            super(ChatEventType.USER_TIMED_OUT);
            this.userId = userId;
            this.duration = duration;
            this.moderatorId = moderatorId;
        }
    }

    /** Targeted notice to the user a moderation action was applied to. */
    @Getter
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Moderation extends ChatEvent {
        private final String roomId;
        private final String action;
        private final String moderatorId;
        private final String reason;
        private final Long duration;
        private final Instant expiry;

        public Moderation(String roomId, String action, String moderatorId, String reason, Long duration, Instant expiry) {
            super(ChatEventType.MODERATION);
            this.roomId = roomId;
            this.action = action;
            this.moderatorId = moderatorId;
            this.reason = reason;
            this.duration = duration;
            this.expiry = expiry;
        }
    }

    @Getter
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Error extends ChatEvent {
        private final String message;
        private final ChatErrorCode code;
        private final Long retryAfterSeconds;

        public Error(String message, ChatErrorCode code, Long retryAfterSeconds) {
            super(ChatEventType.ERROR);
            this.message = message;
            this.code = code;
            this.retryAfterSeconds = retryAfterSeconds;
        }
    }
}
