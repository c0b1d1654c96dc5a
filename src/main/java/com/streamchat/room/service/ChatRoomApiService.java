package com.streamchat.room.service;

import com.streamchat.auth.model.StreamIdentity;
import com.streamchat.exception.ChatNotFoundException;
import com.streamchat.member.model.ChatRoles;
import com.streamchat.message.service.MessageRecorder;
import com.streamchat.room.converter.RoomSummaryConverter;
import com.streamchat.room.dto.RoomSettingsUpdateDTO;
import com.streamchat.room.dto.RoomSummaryDTO;
import com.streamchat.room.model.ChatRoom;
import com.streamchat.room.model.RoomSettings;
import com.streamchat.room.model.RoomState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * ChatRoomApiService
 * ──────────────────────────────────────────────────────────────
 * Read side (room summaries) and owner-only management (settings, moderator set) of rooms.
 * Ownership is enforced before these methods run, by the room API security chain; the caller
 * is only recorded here.
 */
@Service
public class ChatRoomApiService implements IChatRoomApiService {

    private static final Logger logger = LoggerFactory.getLogger(ChatRoomApiService.class);

    public static final String SETTINGS_UPDATED_MESSAGE = "Chat room settings have been updated";

    private final RoomRegistry roomRegistry;
    private final MessageRecorder messageRecorder;
    private final RoomSummaryConverter roomSummaryConverter;

    public ChatRoomApiService(
            RoomRegistry roomRegistry,
            MessageRecorder messageRecorder,
            RoomSummaryConverter roomSummaryConverter) {

        this.roomRegistry = roomRegistry;
        this.messageRecorder = messageRecorder;
        this.roomSummaryConverter = roomSummaryConverter;
    }

    @Override
    public List<RoomSummaryDTO> getRooms() {
        return roomRegistry.getRooms().stream()
                .filter(RoomState::isActive)
                .map(this::summarize)
                .sorted(Comparator.comparing(RoomSummaryDTO::getCreatedAt))
                .collect(Collectors.toList());
    }

    @Override
    public RoomSummaryDTO getRoom(String roomId) {
        return summarize(roomRegistry.require(roomId));
    }

    @Override
    public RoomSummaryDTO getRoomByStreamKey(String streamKey) {
        RoomState room = roomRegistry.findByStreamKey(streamKey)
                .orElseThrow(() -> new ChatNotFoundException("Room not found"));
        return summarize(room);
    }

    @Override
    public RoomSummaryDTO updateSettings(String roomId, RoomSettingsUpdateDTO update, StreamIdentity caller) {
        RoomState room = roomRegistry.require(roomId);

        return room.withLock(() -> {
            ChatRoom chatRoom = room.getRoom();
            RoomSettings.RoomSettingsBuilder settings = chatRoom.getSettings().toBuilder();
            if (update.getSlowMode() != null) {
                settings.slowMode(update.getSlowMode());
            }
            if (update.getSlowModeInterval() != null) {
                settings.slowModeInterval(update.getSlowModeInterval());
            }
            if (update.getSubscriberOnly() != null) {
                settings.subscriberOnly(update.getSubscriberOnly());
            }
            if (update.getFilteredWords() != null) {
                settings.filteredWords(List.copyOf(update.getFilteredWords()));
            }
            chatRoom.updateSettings(settings.build());
            messageRecorder.systemMessage(room, SETTINGS_UPDATED_MESSAGE);

            logger.info("[settings updated] roomId={}, by={}", roomId, callerId(caller));
            return roomSummaryConverter.toDto(room);
        });
    }

    @Override
    public RoomSummaryDTO addModerator(String roomId, String userId, StreamIdentity caller) {
        RoomState room = roomRegistry.require(roomId);

        return room.withLock(() -> {
            room.getRoom().addModerator(userId);
            room.findMember(userId).ifPresent(member -> member.grantRole(ChatRoles.MODERATOR));
            logger.info("[moderator added] roomId={}, userId={}, by={}", roomId, userId, callerId(caller));
            return roomSummaryConverter.toDto(room);
        });
    }

    @Override
    public RoomSummaryDTO removeModerator(String roomId, String userId, StreamIdentity caller) {
        RoomState room = roomRegistry.require(roomId);

        return room.withLock(() -> {
            room.getRoom().removeModerator(userId);
            room.findMember(userId).ifPresent(member -> member.revokeRole(ChatRoles.MODERATOR));
            logger.info("[moderator removed] roomId={}, userId={}, by={}", roomId, userId, callerId(caller));
            return roomSummaryConverter.toDto(room);
        });
    }

    private RoomSummaryDTO summarize(RoomState room) {
        return room.withLock(() -> roomSummaryConverter.toDto(room));
    }

    private static String callerId(StreamIdentity caller) {
        return caller == null ? "unknown" : caller.getUserId();
    }
}
