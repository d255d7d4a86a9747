package com.dailybrief.curation.security;

import java.util.regex.Pattern;

/**
 * A known instruction-override phrasing and the description recorded when it matches.
 */
public record InjectionPattern(Pattern pattern, String description) {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    /** Compiles {@code regex} case-insensitively, with {@code \s} matching any Unicode whitespace. */
    public static InjectionPattern of(String regex, String description) {
        return new InjectionPattern(Pattern.compile(regex, FLAGS), description);
    }
}
