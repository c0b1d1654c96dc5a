package com.streamchat.websocketcore.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Inbound frame types.
 */
public enum ChatCommandType {

    REGISTER("register"),
    JOIN_ROOM("join-room"),
    SEND_MESSAGE("send-message"),
    MODERATE("moderate"),
    LEAVE_ROOM("leave-room");

    private final String wireName;

    ChatCommandType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<ChatCommandType> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(wireName)).findFirst();
    }
}
