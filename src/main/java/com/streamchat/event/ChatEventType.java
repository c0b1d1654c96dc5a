package com.streamchat.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChatEventType {

    REGISTERED("registered"),
    ROOM_JOINED("room-joined"),
    USER_JOINED("user-joined"),
    USER_LEFT("user-left"),
    NEW_MESSAGE("new-message"),
    MESSAGE_MODERATED("message-moderated"),
    USER_BANNED("user-banned"),
    USER_TIMED_OUT("user-timed-out"),
    MODERATION("moderation"),
    ERROR("error");

    private final String wireName;

    ChatEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
