package com.streamchat.member.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Set;

/**
 * Identity fields handed to {@code MembershipService.join}. Roles are trusted as given;
 * gating them is the job of the connection layer.
 */
@Getter
@Builder
public class UserIdentity {

    private final String userId;
    private final String username;
    private final String displayName;

    @Singular
    private final Set<String> roles;

    /** optional, {@code #RRGGBB}; anything else falls back to the palette */
    private final String color;
}
