package com.streamchat.moderation.model;

import lombok.Builder;
import lombok.Getter;

/**
 * A moderator's request. {@code messageId} is used by delete, {@code targetId} by the other
 * actions, {@code durationSeconds} only by timeout (null means the configured default).
 */
@Getter
@Builder
public class ModerationCommand {

    private final ModerationAction action;
    private final String targetId;
    private final String messageId;
    private final Long durationSeconds;
    private final String reason;
}
