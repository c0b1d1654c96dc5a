package com.streamchat.room.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial settings update: null fields keep their current value.
 */
@Data
@NoArgsConstructor
public class RoomSettingsUpdateDTO {

    private Boolean slowMode;

    @Min(1)
    @Max(3600)
    private Integer slowModeInterval;

    private Boolean subscriberOnly;

    @Size(max = 200)
    private List<@NotBlank @Size(max = 50) String> filteredWords;
}
