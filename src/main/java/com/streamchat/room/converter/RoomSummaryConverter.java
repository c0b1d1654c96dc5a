package com.streamchat.room.converter;

import com.streamchat.room.dto.RoomSettingsDTO;
import com.streamchat.room.dto.RoomSummaryDTO;
import com.streamchat.room.model.ChatRoom;
import com.streamchat.room.model.RoomSettings;
import com.streamchat.room.model.RoomState;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * @class RoomSummaryConverter
 * @brief RoomState → RoomSummaryDTO. Reads live members and history, so callers hold the room lock.
 */
@Component
public class RoomSummaryConverter {

    public RoomSummaryDTO toDto(RoomState state) {
        if (state == null) {
            return null;
        }
        ChatRoom room = state.getRoom();
        return new RoomSummaryDTO(
                room.getId(),
                room.getName(),
                room.getStreamKey(),
                room.isPersistent(),
                state.getMemberCount(),
                state.getHistory().size(),
                room.getCreatedAt(),
                state.getLastActivity(),
                toDto(room.getSettings()),
                List.copyOf(room.getModeratorIds()));
    }

    public RoomSettingsDTO toDto(RoomSettings settings) {
        return new RoomSettingsDTO(
                settings.isSlowMode(),
                settings.getSlowModeInterval(),
                settings.isSubscriberOnly(),
                List.copyOf(settings.getFilteredWords()));
    }
}
