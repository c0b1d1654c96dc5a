package com.streamchat.room.model;

import com.streamchat.message.filter.ContentFilter;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.regex.Pattern;

/**
 * @class RoomSettings
 * @brief Admission policy of one room. Instances are immutable; an update swaps the whole
 *        object on the owning {@link ChatRoom}.
 *
 * The room's filtered words are compiled once here, so their patterns live exactly as long as
 * the settings that carry them.
 */
@Getter
public class RoomSettings {

    private final boolean slowMode;

    /** seconds between two accepted messages of one sender */
    private final int slowModeInterval;

    private final boolean subscriberOnly;

    /** merged with the global banned-word list at check time */
    private final List<String> filteredWords;

    private final List<Pattern> filterPatterns;

    @Builder(toBuilder = true)
    public RoomSettings(boolean slowMode, int slowModeInterval, boolean subscriberOnly, List<String> filteredWords) {
        this.slowMode = slowMode;
        this.slowModeInterval = slowModeInterval;
        this.subscriberOnly = subscriberOnly;
        this.filteredWords = filteredWords == null ? List.of() : List.copyOf(filteredWords);
        this.filterPatterns = ContentFilter.compile(this.filteredWords);
    }

    public static RoomSettings defaults(int slowModeInterval) {
        return new RoomSettings(false, slowModeInterval, false, List.of());
    }
}
