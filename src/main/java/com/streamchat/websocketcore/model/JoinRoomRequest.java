package com.streamchat.websocketcore.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * Decoded {@code join-room} frame. A stream key takes precedence over a room id.
 */
@Getter
@Builder
public class JoinRoomRequest {

    private final String roomId;
    private final String streamKey;
    private final String username;
    private final String displayName;

    @Singular
    private final List<String> roles;

    private final String color;
}
