package com.streamchat.member.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Display colors for usernames. A user without a valid color of its own always gets the same
 * palette entry, picked from its user id.
 */
@Component
public class UserColorPalette {

    static final List<String> COLORS = List.of(
            "#FF4500", "#FF8C00", "#1E90FF", "#32CD32", "#9400D3",
            "#FF69B4", "#BA55D3", "#00BFFF", "#00FA9A", "#7CFC00",
            "#FF6347", "#8A2BE2", "#20B2AA", "#FF0000", "#4169E1");

    private static final Pattern HEX_COLOR = Pattern.compile("#[0-9A-Fa-f]{6}");

    public String resolve(String userId, String requested) {
        if (requested != null && HEX_COLOR.matcher(requested).matches()) {
            return requested.toUpperCase();
        }
        return COLORS.get(Math.floorMod(userId.hashCode(), COLORS.size()));
    }
}
