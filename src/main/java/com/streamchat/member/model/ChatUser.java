package com.streamchat.member.model;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * @class ChatUser
 * @brief Room-scoped membership record. Exists only while the user is present in that room;
 *        all mutators are called with the owning room's lock held.
 */
@Getter
public class ChatUser {

    private final String id;
    private final String username;
    private final String displayName;
    private final Set<String> roles;
    private final Instant joinedAt;
    private final String color;

    private boolean banned;
    private boolean muted;
    private Instant muteExpiry;

    public ChatUser(String id, String username, String displayName, Set<String> roles, Instant joinedAt, String color) {
        this.id = id;
        this.username = username;
        this.displayName = displayName;
        this.roles = new LinkedHashSet<>(roles);
        this.joinedAt = joinedAt;
        this.color = color;
    }

    public Set<String> getRoles() {
        return Collections.unmodifiableSet(roles);
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    public boolean isModerator() {
        return ChatRoles.isModerator(roles);
    }

    public void grantRole(String role) {
        roles.add(role);
    }

    public void revokeRole(String role) {
        roles.remove(role);
    }

    public void ban() {
        this.banned = true;
    }

    /** Last write wins: a second timeout overwrites the expiry, durations never stack. */
    public void muteUntil(Instant expiry) {
        this.muted = true;
        this.muteExpiry = expiry;
    }

    public void clearMute() {
        this.muted = false;
        this.muteExpiry = null;
    }

    /**
     * A mute without expiry never lapses. An expired mute is reported inactive but is only
     * cleared by the admission check that observes it.
     */
    public boolean isMuteActive(Instant now) {
        return muted && (muteExpiry == null || muteExpiry.isAfter(now));
    }
}
