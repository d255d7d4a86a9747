package com.dailybrief.core.events;

import java.time.Instant;

/**
 * Published when the sanitizer stripped instruction-like text from an item.
 * Carries only the count of patterns, never the matched text.
 */
public record ContentFlagged(Instant timestamp, String source, String url, int flagCount) implements Event {
    @Override
    public String type() {
        return "ContentFlagged";
    }
}
