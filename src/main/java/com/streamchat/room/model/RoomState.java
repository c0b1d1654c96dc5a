package com.streamchat.room.model;

import com.streamchat.member.model.ChatUser;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * @class RoomState
 * @brief Everything one room owns: metadata, present members, bounded history, ban list and
 *        activity timestamps.
 *
 * Every read or write of members, history, ban list or timestamps happens inside
 * {@link #withLock(Supplier)}. Operations on different rooms never share a lock.
 */
public class RoomState {

    @Getter
    private final ChatRoom room;

    @Getter
    private final MessageHistory history;

    private final Map<String, ChatUser> members = new LinkedHashMap<>();

    /* user ids banned for the lifetime of this room */
    private final Set<String> bannedUserIds = new HashSet<>();

    private final ReentrantLock lock = new ReentrantLock();

    @Getter
    private Instant lastActivity;

    /* set when the last member leaves, cleared by the next join */
    @Getter
    private Instant emptySince;

    public RoomState(ChatRoom room, int historyCapacity, Instant now) {
        this.room = room;
        this.history = new MessageHistory(historyCapacity);
        this.lastActivity = now;
        this.emptySince = now;
    }

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(Runnable action) {
        withLock(() -> {
            action.run();
            return null;
        });
    }

    public String getId() {
        return room.getId();
    }

    // ────────────── [members] ──────────────

    public Optional<ChatUser> findMember(String userId) {
        return Optional.ofNullable(members.get(userId));
    }

    public void putMember(ChatUser user, Instant now) {
        members.put(user.getId(), user);
        emptySince = null;
        lastActivity = now;
    }

    public Optional<ChatUser> removeMember(String userId, Instant now) {
        ChatUser removed = members.remove(userId);
        if (removed != null && members.isEmpty()) {
            emptySince = now;
        }
        return Optional.ofNullable(removed);
    }

    public int getMemberCount() {
        return members.size();
    }

    public List<ChatUser> getMembers() {
        return Collections.unmodifiableList(new ArrayList<>(members.values()));
    }

    // ────────────── [ban list] ──────────────

    public void addBan(String userId) {
        bannedUserIds.add(userId);
    }

    public boolean isBanned(String userId) {
        return bannedUserIds.contains(userId);
    }

    // ────────────── [lifecycle] ──────────────

    public void touch(Instant now) {
        this.lastActivity = now;
    }

    public boolean isActive() {
        return room.isActive();
    }

    /** Marks the room dead; a joiner still holding this instance re-resolves the room. */
    public void close() {
        room.deactivate();
    }
}
