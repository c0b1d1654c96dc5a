package com.streamchat.auth.config;

import com.streamchat.auth.model.StreamIdentity;
import com.streamchat.auth.provider.IdentityProvider;
import com.streamchat.exception.ChatNotFoundException;
import com.streamchat.room.controller.ChatRoomApiController;
import com.streamchat.room.dto.RoomSettingsUpdateDTO;
import com.streamchat.room.dto.RoomSummaryDTO;
import com.streamchat.room.model.ChatRoom;
import com.streamchat.room.model.RoomSettings;
import com.streamchat.room.model.RoomState;
import com.streamchat.room.service.IChatRoomApiService;
import com.streamchat.room.service.RoomRegistry;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ChatRoomApiController.class)
@Import(SecurityConfig.class)
class SecurityConfigTest {

    private static final String SETTINGS_BODY = "{\"subscriberOnly\":true}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IChatRoomApiService chatRoomApiService;

    @MockBean
    private IdentityProvider identityProvider;

    @MockBean
    private RoomRegistry roomRegistry;

    private final StreamIdentity owner = StreamIdentity.builder()
            .userId("owner").username("owner").role(StreamIdentity.ROLE_STREAMER)
            .streamKey("abc").allowedToStream(true).build();
    private final StreamIdentity viewer = StreamIdentity.builder()
            .userId("viewer").username("viewer").role(StreamIdentity.ROLE_VIEWER).build();
    private final StreamIdentity admin = StreamIdentity.builder()
            .userId("root").username("root").role(StreamIdentity.ROLE_ADMIN).build();

    @BeforeEach
    void setUp() {
        when(identityProvider.verify(anyString())).thenReturn(Optional.empty());
        when(identityProvider.verify("owner-token")).thenReturn(Optional.of(owner));
        when(identityProvider.verify("viewer-token")).thenReturn(Optional.of(viewer));
        when(identityProvider.verify("admin-token")).thenReturn(Optional.of(admin));

        ChatRoom streamRoom = new ChatRoom("stream_abc", "Stream Chat: abc", "abc",
                Instant.parse("2024-05-01T12:00:00Z"), RoomSettings.defaults(3));
        when(roomRegistry.get("stream_abc"))
                .thenReturn(Optional.of(new RoomState(streamRoom, 1000, Instant.parse("2024-05-01T12:00:00Z"))));
        when(roomRegistry.get("nowhere")).thenReturn(Optional.empty());

        RoomSummaryDTO summary = new RoomSummaryDTO();
        summary.setId("stream_abc");
        when(chatRoomApiService.getRooms()).thenReturn(List.of(summary));
        when(chatRoomApiService.updateSettings(eq("stream_abc"), any(RoomSettingsUpdateDTO.class), any()))
                .thenReturn(summary);
        when(chatRoomApiService.removeModerator(eq("stream_abc"), eq("alice"), any())).thenReturn(summary);
    }

    @Test
    void readsArePublic() throws Exception {
        mockMvc.perform(get("/api/chat/rooms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("stream_abc"));
    }

    @Test
    void managementWithoutValidTokenIsUnauthorized() throws Exception {
        mockMvc.perform(put("/api/chat/rooms/stream_abc/settings")
                        .contentType(MediaType.APPLICATION_JSON).content(SETTINGS_BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("NOT_REGISTERED"))
                .andExpect(jsonPath("$.message").value("Authentication required"));

        mockMvc.perform(put("/api/chat/rooms/stream_abc/settings")
                        .header("Authorization", "Bearer forged")
                        .contentType(MediaType.APPLICATION_JSON).content(SETTINGS_BODY))
                .andExpect(status().isUnauthorized());

        verify(chatRoomApiService, never()).updateSettings(anyString(), any(), any());
    }

    @Test
    void nonOwnerIsForbidden() throws Exception {
        mockMvc.perform(put("/api/chat/rooms/stream_abc/settings")
                        .header("Authorization", "Bearer viewer-token")
                        .contentType(MediaType.APPLICATION_JSON).content(SETTINGS_BODY))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"))
                .andExpect(jsonPath("$.message").value("Only the room owner can manage this room"));

        mockMvc.perform(delete("/api/chat/rooms/stream_abc/moderators/alice")
                        .header("Authorization", "Bearer viewer-token"))
                .andExpect(status().isForbidden());

        verify(chatRoomApiService, never()).updateSettings(anyString(), any(), any());
        verify(chatRoomApiService, never()).removeModerator(anyString(), anyString(), any());
    }

    @Test
    void streamOwnerReachesServiceAsPrincipal() throws Exception {
        mockMvc.perform(put("/api/chat/rooms/stream_abc/settings")
                        .header("Authorization", "Bearer owner-token")
                        .contentType(MediaType.APPLICATION_JSON).content(SETTINGS_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("stream_abc"));

        verify(chatRoomApiService).updateSettings(eq("stream_abc"), any(RoomSettingsUpdateDTO.class), same(owner));
    }

    @Test
    void adminManagesAnyRoom() throws Exception {
        mockMvc.perform(delete("/api/chat/rooms/stream_abc/moderators/alice")
                        .cookie(new Cookie("Authorization", "admin-token")))
                .andExpect(status().isOk());

        verify(chatRoomApiService).removeModerator(eq("stream_abc"), eq("alice"), same(admin));
    }

    @Test
    void unknownRoomIsNotFoundForAuthenticatedCaller() throws Exception {
        when(chatRoomApiService.updateSettings(eq("nowhere"), any(RoomSettingsUpdateDTO.class), any()))
                .thenThrow(new ChatNotFoundException("Room not found"));

        mockMvc.perform(put("/api/chat/rooms/nowhere/settings")
                        .header("Authorization", "Bearer viewer-token")
                        .contentType(MediaType.APPLICATION_JSON).content(SETTINGS_BODY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }
}
