package com.streamchat.member.model;

import lombok.Getter;

import java.time.Instant;
import java.util.List;

/* Snapshot of a ChatUser sent to the user itself on room-joined. */
@Getter
public class ChatUserProfile {

    private final String id;
    private final String username;
    private final String displayName;
    private final List<String> roles;
    private final Instant joinedAt;
    private final String color;
    private final boolean muted;
    private final Instant muteExpiry;

    private ChatUserProfile(ChatUser user) {
        this.id = user.getId();
        this.username = user.getUsername();
        this.displayName = user.getDisplayName();
        this.roles = List.copyOf(user.getRoles());
        this.joinedAt = user.getJoinedAt();
        this.color = user.getColor();
        this.muted = user.isMuted();
        this.muteExpiry = user.getMuteExpiry();
    }

    public static ChatUserProfile of(ChatUser user) {
        return new ChatUserProfile(user);
    }
}
