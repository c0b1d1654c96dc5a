package com.streamchat.member.model;

import lombok.Getter;

/* Fields of a member visible to the rest of the room. */
@Getter
public class PublicUser {

    private final String id;
    private final String username;
    private final String displayName;
    private final String color;

    private PublicUser(ChatUser user) {
        this.id = user.getId();
        this.username = user.getUsername();
        this.displayName = user.getDisplayName();
        this.color = user.getColor();
    }

    public static PublicUser of(ChatUser user) {
        return new PublicUser(user);
    }
}
