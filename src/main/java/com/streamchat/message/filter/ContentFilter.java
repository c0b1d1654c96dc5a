package com.streamchat.message.filter;

import com.streamchat.config.ChatProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redacts filtered words in a message body. Matching is case-insensitive and whole-word:
 * "bad" is masked in "so bad!" but not in "badge".
 */
@Component
public class ContentFilter {

    public static final String MASK = "***";

    /* compiled once at startup; room patterns are compiled with the room's settings */
    private final List<Pattern> globalPatterns;

    public ContentFilter(ChatProperties chatProperties) {
        this.globalPatterns = compile(chatProperties.getBannedWords());
    }

    /**
     * @param body         incoming message body
     * @param roomPatterns the room's own compiled words, applied after the global list
     * @return the body with every match replaced by {@link #MASK}; the same string if nothing matched
     */
    public String redact(String body, List<Pattern> roomPatterns) {
        List<Pattern> patterns = new ArrayList<>(globalPatterns);
        patterns.addAll(roomPatterns);

        String result = body;
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(result);
            if (matcher.find()) {
                result = matcher.replaceAll(Matcher.quoteReplacement(MASK));
            }
        }
        return result;
    }

    /** Blank entries are skipped, duplicates differing only in case compile once. */
    public static List<Pattern> compile(Collection<String> words) {
        if (words == null || words.isEmpty()) {
            return List.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String word : words) {
            if (word != null && !word.isBlank()) {
                normalized.add(word.trim().toLowerCase(Locale.ROOT));
            }
        }
        List<Pattern> patterns = new ArrayList<>(normalized.size());
        for (String word : normalized) {
            patterns.add(Pattern.compile("\\b" + Pattern.quote(word) + "\\b",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
        return List.copyOf(patterns);
    }
}
