package com.streamchat.message.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * @class ChatMessage
 * @brief One entry of a room's history.
 *        Immutable once broadcast, except for {@link #redact(String, String)} which a moderator
 *        delete applies in place so the entry keeps its position in the history.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatMessage {

    public static final String SYSTEM_USER_ID = "system";
    public static final String SYSTEM_USERNAME = "System";

    private final String id;
    private final String roomId;
    private final String userId;

    /** author username as it was when the message was sent */
    private final String username;

    @JsonProperty("message")
    private String body;

    private final Instant timestamp;

    @JsonProperty("type")
    private final MessageKind kind;

    private final String replyToId;

    private boolean moderated;

    private String moderationReason;

    /**
     * Replaces the body with the moderator placeholder. Caller holds the room lock.
     */
    public void redact(String placeholder, String reason) {
        this.body = placeholder;
        this.moderated = true;
        this.moderationReason = reason;
    }

    public boolean isAuthoredBy(String candidateUserId, MessageKind candidateKind) {
        return kind == candidateKind && userId.equals(candidateUserId);
    }

    @Override
    public String toString() {
        return "ChatMessage{" +
                "id='" + id + '\'' +
                ", roomId='" + roomId + '\'' +
                ", userId='" + userId + '\'' +
                ", kind=" + kind +
                ", moderated=" + moderated +
                '}';
    }
}
