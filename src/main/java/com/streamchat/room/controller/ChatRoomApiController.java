package com.streamchat.room.controller;

import com.streamchat.auth.model.StreamIdentity;
import com.streamchat.room.dto.RoomSettingsUpdateDTO;
import com.streamchat.room.dto.RoomSummaryDTO;
import com.streamchat.room.service.IChatRoomApiService;
import jakarta.validation.Valid;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/* room summaries for the stream pages, and owner-side room management (guarded by SecurityConfig) */
@RestController
@RequestMapping("/api/chat")
public class ChatRoomApiController {

    private final IChatRoomApiService chatRoomApiService;

    public ChatRoomApiController(IChatRoomApiService chatRoomApiService) {
        this.chatRoomApiService = chatRoomApiService;
    }

    @GetMapping("/rooms")
    public List<RoomSummaryDTO> rooms() {
        return chatRoomApiService.getRooms();
    }

    @GetMapping("/rooms/{roomId}")
    public RoomSummaryDTO room(@PathVariable String roomId) {
        return chatRoomApiService.getRoom(roomId);
    }

    @GetMapping("/streams/{streamKey}/room")
    public RoomSummaryDTO roomOfStream(@PathVariable String streamKey) {
        return chatRoomApiService.getRoomByStreamKey(streamKey);
    }

    @PutMapping("/rooms/{roomId}/settings")
    public RoomSummaryDTO updateSettings(
            @PathVariable String roomId,
            @Valid @RequestBody RoomSettingsUpdateDTO update,
            @AuthenticationPrincipal StreamIdentity caller) {

        return chatRoomApiService.updateSettings(roomId, update, caller);
    }

    @PutMapping("/rooms/{roomId}/moderators/{userId}")
    public RoomSummaryDTO addModerator(
            @PathVariable String roomId,
            @PathVariable String userId,
            @AuthenticationPrincipal StreamIdentity caller) {

        return chatRoomApiService.addModerator(roomId, userId, caller);
    }

    @DeleteMapping("/rooms/{roomId}/moderators/{userId}")
    public RoomSummaryDTO removeModerator(
            @PathVariable String roomId,
            @PathVariable String userId,
            @AuthenticationPrincipal StreamIdentity caller) {

        return chatRoomApiService.removeModerator(roomId, userId, caller);
    }
}
