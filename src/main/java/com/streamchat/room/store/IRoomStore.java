package com.streamchat.room.store;

import com.streamchat.room.model.RoomState;

import java.util.Collection;
import java.util.Optional;
import java.util.function.Function;

/**
 * Backing store of live rooms. The in-memory implementation is the only one today; a
 * persistent one can be swapped in without touching the room services.
 */
public interface IRoomStore {

    Optional<RoomState> findById(String roomId);

    Optional<RoomState> findByStreamKey(String streamKey);

    /**
     * Atomic insert-if-absent: {@code factory} runs at most once per absent id, and concurrent
     * callers for the same id all receive the same instance.
     */
    RoomState computeIfAbsent(String roomId, Function<String, RoomState> factory);

    /**
     * Removes the room only if {@code expected} is still the instance registered under its id.
     * @return true if removed
     */
    boolean remove(RoomState expected);

    Collection<RoomState> findAll();
}
