package com.streamchat.message.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageKind {

    MESSAGE("message"),
    SYSTEM("system"),
    MODERATION("moderation");

    private final String wireName;

    MessageKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
