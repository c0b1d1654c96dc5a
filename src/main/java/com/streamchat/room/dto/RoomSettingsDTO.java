package com.streamchat.room.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoomSettingsDTO {

    private boolean slowMode;
    private int slowModeInterval;
    private boolean subscriberOnly;
    private List<String> filteredWords;
}
