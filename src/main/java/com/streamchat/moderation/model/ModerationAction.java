package com.streamchat.moderation.model;

import com.streamchat.exception.InvalidChatRequestException;

import java.util.Arrays;
import java.util.Locale;

public enum ModerationAction {

    DELETE("delete"),
    BAN("ban"),
    TIMEOUT("timeout"),
    UNMUTE("unmute");

    private final String wireName;

    ModerationAction(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static ModerationAction fromWireName(String value) {
        if (value == null) {
            throw new InvalidChatRequestException("Moderation action is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(action -> action.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidChatRequestException("Unknown moderation action: " + value));
    }
}
