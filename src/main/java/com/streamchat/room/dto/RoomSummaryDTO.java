package com.streamchat.room.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoomSummaryDTO {

    private String id;
    private String name;
    private String streamKey;
    private boolean persistent;
    private int userCount;
    private int messageCount;
    private Instant createdAt;
    private Instant lastActivity;
    private RoomSettingsDTO settings;
    private List<String> moderatorIds;
}
