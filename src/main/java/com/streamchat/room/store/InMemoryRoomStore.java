package com.streamchat.room.store;

import com.streamchat.room.model.RoomState;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

@Repository
public class InMemoryRoomStore implements IRoomStore {

    /* room id → room */
    private final Map<String, RoomState> rooms = new ConcurrentHashMap<>();

    /* stream key → room id, written inside the rooms map's compute so both stay in step */
    private final Map<String, String> streamKeyIndex = new ConcurrentHashMap<>();

    @Override
    public Optional<RoomState> findById(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    @Override
    public Optional<RoomState> findByStreamKey(String streamKey) {
        return Optional.ofNullable(streamKeyIndex.get(streamKey)).map(rooms::get);
    }

    @Override
    public RoomState computeIfAbsent(String roomId, Function<String, RoomState> factory) {
        return rooms.computeIfAbsent(roomId, id -> {
            RoomState created = factory.apply(id);
            String streamKey = created.getRoom().getStreamKey();
            if (streamKey != null) {
                streamKeyIndex.put(streamKey, id);
            }
            return created;
        });
    }

    @Override
    public boolean remove(RoomState expected) {
        boolean removed = rooms.remove(expected.getId(), expected);
        String streamKey = expected.getRoom().getStreamKey();
        if (removed && streamKey != null) {
            streamKeyIndex.remove(streamKey, expected.getId());
        }
        return removed;
    }

    @Override
    public Collection<RoomState> findAll() {
        return new ArrayList<>(rooms.values());
    }
}
