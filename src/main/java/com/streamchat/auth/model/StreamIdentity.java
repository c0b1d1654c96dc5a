package com.streamchat.auth.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Verified identity supplied by the platform's auth service, decoded from its bearer token.
 */
@Getter
@Builder
@ToString
public class StreamIdentity {

    /** request / session attribute under which the filter and handshake store the identity */
    public static final String ATTRIBUTE = "streamIdentity";

    public static final String ROLE_VIEWER = "viewer";
    public static final String ROLE_STREAMER = "streamer";
    public static final String ROLE_ADMIN = "admin";

    /** granted authority of an admin token in the security context */
    public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";

    private final String userId;
    private final String username;

    /** platform role: viewer, streamer or admin */
    private final String role;

    /** the stream key owned by this user, if any */
    private final String streamKey;

    private final boolean allowedToStream;

    public boolean isAdmin() {
        return ROLE_ADMIN.equals(role);
    }

    public boolean ownsStream(String candidateStreamKey) {
        return allowedToStream && streamKey != null && streamKey.equals(candidateStreamKey);
    }
}
