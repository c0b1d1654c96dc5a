package com.streamchat.message.service;

import com.streamchat.event.ChatEvent;
import com.streamchat.event.ChatEventPublisher;
import com.streamchat.message.model.ChatMessage;
import com.streamchat.message.model.MessageKind;
import com.streamchat.room.model.RoomState;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * @class MessageRecorder
 * @brief Appends a message to its room's history and broadcasts it as {@code new-message}.
 *        Both steps always happen together, so nothing is broadcast unrecorded and nothing is
 *        recorded unbroadcast. Callers hold the room lock.
 */
@Component
public class MessageRecorder {

    private final ChatEventPublisher eventPublisher;
    private final Clock clock;

    public MessageRecorder(ChatEventPublisher eventPublisher, Clock clock) {
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public ChatMessage record(RoomState room, ChatMessage message) {
        room.getHistory().append(message);
        eventPublisher.broadcast(room.getId(), new ChatEvent.NewMessage(message));
        return message;
    }

    public ChatMessage systemMessage(RoomState room, String text) {
        return record(room, authoredBySystem(room, text, MessageKind.SYSTEM));
    }

    /* ban/timeout/unmute notices */
    public ChatMessage moderationNotice(RoomState room, String text) {
        return record(room, authoredBySystem(room, text, MessageKind.MODERATION));
    }

    public static String newMessageId() {
        return UUID.randomUUID().toString();
    }

    private ChatMessage authoredBySystem(RoomState room, String text, MessageKind kind) {
        return ChatMessage.builder()
                .id(newMessageId())
                .roomId(room.getId())
                .userId(ChatMessage.SYSTEM_USER_ID)
                .username(ChatMessage.SYSTEM_USERNAME)
                .body(text)
                .timestamp(clock.instant())
                .kind(kind)
                .build();
    }
}
