package com.streamchat.room.service;

import com.streamchat.auth.model.StreamIdentity;
import com.streamchat.room.dto.RoomSettingsUpdateDTO;
import com.streamchat.room.dto.RoomSummaryDTO;

import java.util.List;

public interface IChatRoomApiService {

    List<RoomSummaryDTO> getRooms();

    RoomSummaryDTO getRoom(String roomId);

    RoomSummaryDTO getRoomByStreamKey(String streamKey);

    RoomSummaryDTO updateSettings(String roomId, RoomSettingsUpdateDTO update, StreamIdentity caller);

    RoomSummaryDTO addModerator(String roomId, String userId, StreamIdentity caller);

    RoomSummaryDTO removeModerator(String roomId, String userId, StreamIdentity caller);
}
