package com.streamchat.room.service;

import com.streamchat.config.ChatProperties;
import com.streamchat.exception.ChatNotFoundException;
import com.streamchat.exception.InvalidChatRequestException;
import com.streamchat.message.service.MessageRecorder;
import com.streamchat.room.model.ChatRoom;
import com.streamchat.room.model.RoomSettings;
import com.streamchat.room.model.RoomState;
import com.streamchat.room.store.IRoomStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * RoomRegistry
 * ──────────────────────────────────────────────────────────────
 * Owns the room id / stream key → room mapping.
 * - creation: on first reference, atomic insert-if-absent so a stream key never yields two rooms
 * - eviction: non-persistent rooms are deleted once they have been empty for the grace window;
 *   the condition is re-checked under the room lock when the eviction fires
 */
@Service
public class RoomRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RoomRegistry.class);

    private static final Pattern ROOM_REF_PATTERN = Pattern.compile("[A-Za-z0-9_.:\\-]{1,128}");

    private final IRoomStore roomStore;
    private final MessageRecorder messageRecorder;
    private final ChatProperties chatProperties;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public RoomRegistry(
            IRoomStore roomStore,
            MessageRecorder messageRecorder,
            ChatProperties chatProperties,
            TaskScheduler taskScheduler,
            Clock clock) {

        this.roomStore = roomStore;
        this.messageRecorder = messageRecorder;
        this.chatProperties = chatProperties;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    // ============================================================================================
    // lookup / creation
    // ============================================================================================

    /**
     * @method getOrCreateByStreamKey
     * @brief Active room bound to {@code streamKey}, created as {@code stream_{key}} if there is none.
     */
    public RoomState getOrCreateByStreamKey(String streamKey) {
        validateReference("stream key", streamKey);

        Optional<RoomState> existing = roomStore.findByStreamKey(streamKey).filter(RoomState::isActive);
        if (existing.isPresent()) {
            return existing.get();
        }
        return roomStore.computeIfAbsent(ChatRoom.roomIdForStreamKey(streamKey),
                id -> createRoom(id, "Stream Chat: " + streamKey, streamKey));
    }

    /**
     * @method getOrCreate
     * @brief Ad-hoc room keyed directly by id. An id carrying the stream prefix binds the
     *        matching stream key, so both lookups land on the same room.
     */
    public RoomState getOrCreate(String roomId) {
        validateReference("room id", roomId);

        return roomStore.computeIfAbsent(roomId, id -> {
            String streamKey = id.startsWith(ChatRoom.STREAM_ROOM_PREFIX)
                    ? id.substring(ChatRoom.STREAM_ROOM_PREFIX.length())
                    : null;
            String name = streamKey != null ? "Stream Chat: " + streamKey : "Chat Room " + id;
            return createRoom(id, name, streamKey);
        });
    }

    public Optional<RoomState> get(String roomId) {
        if (roomId == null) {
            return Optional.empty();
        }
        return roomStore.findById(roomId);
    }

    public RoomState require(String roomId) {
        return get(roomId).orElseThrow(() -> new ChatNotFoundException("Room not found"));
    }

    public Optional<RoomState> findByStreamKey(String streamKey) {
        if (streamKey == null) {
            return Optional.empty();
        }
        return roomStore.findByStreamKey(streamKey).filter(RoomState::isActive);
    }

    public Collection<RoomState> getRooms() {
        return roomStore.findAll();
    }

    // ============================================================================================
    // eviction
    // ============================================================================================

    /**
     * @method scheduleEvictionIfEmpty
     * @brief Called whenever a room's membership drops to zero. Persistent rooms are skipped.
     *        Nothing is cancelled on a later join; {@link #evictIfIdle(String)} re-checks instead.
     */
    public void scheduleEvictionIfEmpty(RoomState room) {
        if (room.getRoom().isPersistent()) {
            return;
        }
        boolean empty = room.withLock(() -> room.getMemberCount() == 0);
        if (!empty) {
            return;
        }
        Duration grace = chatProperties.getEmptyRoomGrace();
        Instant fireAt = clock.instant().plus(grace);
        taskScheduler.schedule(() -> evictIfIdle(room.getId()), fireAt);
        logger.info("[eviction scheduled] roomId={}, fireAt={}", room.getId(), fireAt);
    }

    /**
     * @method evictIfIdle
     * @brief Deletes the room and its history if it is still empty, has been empty for the full
     *        grace window, and is still the registered instance.
     * @return true if the room was deleted
     */
    public boolean evictIfIdle(String roomId) {
        Optional<RoomState> candidate = roomStore.findById(roomId);
        if (candidate.isEmpty()) {
            return false;
        }
        RoomState room = candidate.get();

        boolean evicted = room.withLock(() -> {
            if (room.getRoom().isPersistent() || !room.isActive() || room.getMemberCount() > 0) {
                return false;
            }
            Instant emptySince = room.getEmptySince();
            if (emptySince == null
                    || Duration.between(emptySince, clock.instant()).compareTo(chatProperties.getEmptyRoomGrace()) < 0) {
                return false;
            }
            if (!roomStore.remove(room)) {
                return false;
            }
            room.close();
            return true;
        });

        if (evicted) {
            logger.info("[room evicted] roomId={}", roomId);
        }
        return evicted;
    }

    /* backstop for evictions lost to a restart of the scheduler */
    public int evictIdleRooms() {
        int evicted = 0;
        for (RoomState room : roomStore.findAll()) {
            if (evictIfIdle(room.getId())) {
                evicted++;
            }
        }
        return evicted;
    }

    // ============================================================================================
    // internals
    // ============================================================================================

    private RoomState createRoom(String roomId, String name, String streamKey) {
        Instant now = clock.instant();
        ChatRoom chatRoom = new ChatRoom(roomId, name, streamKey, now,
                RoomSettings.defaults(chatProperties.getDefaultSlowModeInterval()));
        RoomState state = new RoomState(chatRoom, chatProperties.getHistoryLimit(), now);

        // not yet visible to other threads, no lock needed
        messageRecorder.systemMessage(state, "Welcome to " + name + "!");

        logger.info("[room created] roomId={}, name={}, streamKey={}", roomId, name, streamKey);
        return state;
    }

    private void validateReference(String label, String value) {
        if (value == null || !ROOM_REF_PATTERN.matcher(value).matches()) {
            throw new InvalidChatRequestException("Invalid " + label);
        }
    }
}
