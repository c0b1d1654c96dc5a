package com.streamchat.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Chat policy knobs bound from {@code streamchat.chat.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "streamchat.chat")
public class ChatProperties {

    /** per-room history cap, oldest entries dropped first */
    private int historyLimit = 1000;

    /** messages replayed to a joining user */
    private int replaySize = 50;

    /** how long a non-persistent room may stay empty before it is deleted */
    private Duration emptyRoomGrace = Duration.ofMinutes(10);

    private Duration defaultTimeout = Duration.ofSeconds(300);

    /** longest timeout a moderator may hand out */
    private Duration maxTimeout = Duration.ofDays(14);

    private int defaultSlowModeInterval = 3;

    private int maxMessageLength = 500;

    /** global list, merged with each room's filtered words */
    private List<String> bannedWords = new ArrayList<>(List.of("inappropriate1", "inappropriate2", "inappropriate3"));

    /** honour privileged roles declared by the client itself (development only) */
    private boolean trustClientRoles = false;

    private int outboundPoolSize = 16;
}
