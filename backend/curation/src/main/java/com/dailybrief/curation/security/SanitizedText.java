package com.dailybrief.curation.security;

import java.util.List;

/**
 * Sanitizer output. {@code flags} holds one description per pattern that
 * matched, never the matched text itself.
 */
public record SanitizedText(String text, List<String> flags) {
    public SanitizedText {
        flags = List.copyOf(flags);
    }

    public static SanitizedText clean(String text) {
        return new SanitizedText(text, List.of());
    }

    public boolean flagged() {
        return !flags.isEmpty();
    }
}
