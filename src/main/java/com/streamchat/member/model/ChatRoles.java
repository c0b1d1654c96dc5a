package com.streamchat.member.model;

import java.util.Collection;
import java.util.Set;

/**
 * Role names recognised by the chat engine. Role sets are plain strings so that roles handed
 * over by the identity collaborator pass through untouched.
 */
public final class ChatRoles {

    public static final String VIEWER = "viewer";
    public static final String SUBSCRIBER = "subscriber";
    public static final String MODERATOR = "moderator";
    public static final String ADMIN = "admin";
    public static final String BROADCASTER = "broadcaster";

    public static final Set<String> MODERATOR_ROLES = Set.of(MODERATOR, ADMIN, BROADCASTER);

    private ChatRoles() {
    }

    public static boolean isModerator(Collection<String> roles) {
        return roles.stream().anyMatch(MODERATOR_ROLES::contains);
    }

    public static boolean isPrivileged(String role) {
        return MODERATOR_ROLES.contains(role);
    }
}
