package com.streamchat.room.model;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * @class ChatRoom
 * @brief Metadata of a single chat room: identity, stream binding, moderator set and settings.
 *        Live membership and history live on {@link RoomState}; mutation goes through the
 *        room lock held by the owning state.
 */
@Getter
public class ChatRoom {

    /** rooms whose id carries this prefix are bound to a stream and never idle-evicted */
    public static final String STREAM_ROOM_PREFIX = "stream_";

    private final String id;
    private final String name;

    /** null for ad-hoc rooms */
    private final String streamKey;

    private final Instant createdAt;

    private final Set<String> moderatorIds = new LinkedHashSet<>();

    private volatile boolean active = true;

    private volatile RoomSettings settings;

    public ChatRoom(String id, String name, String streamKey, Instant createdAt, RoomSettings settings) {
        this.id = id;
        this.name = name;
        this.streamKey = streamKey;
        this.createdAt = createdAt;
        this.settings = settings;
    }

    public static String roomIdForStreamKey(String streamKey) {
        return STREAM_ROOM_PREFIX + streamKey;
    }

    public boolean isPersistent() {
        return id.startsWith(STREAM_ROOM_PREFIX);
    }

    public Set<String> getModeratorIds() {
        return Collections.unmodifiableSet(moderatorIds);
    }

    public boolean addModerator(String userId) {
        return moderatorIds.add(userId);
    }

    public boolean removeModerator(String userId) {
        return moderatorIds.remove(userId);
    }

    public void updateSettings(RoomSettings settings) {
        this.settings = settings;
    }

    void deactivate() {
        this.active = false;
    }

    @Override
    public String toString() {
        return "ChatRoom{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", streamKey='" + streamKey + '\'' +
                ", active=" + active +
                ", createdAt=" + createdAt +
                '}';
    }
}
