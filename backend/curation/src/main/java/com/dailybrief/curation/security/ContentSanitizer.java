package com.dailybrief.curation.security;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;

/**
 * Strips instruction-override phrasings from fetched text before it is shown to
 * a language model. Patterns are applied in order and re-applied until none
 * matches, so sanitizing sanitized text is a no-op.
 */
public class ContentSanitizer {
    private static final Logger LOGGER = Logger.getLogger(ContentSanitizer.class.getName());

    public static final String REDACTION = "[REDACTED]";

    public static final List<InjectionPattern> DEFAULT_PATTERNS = List.of(
            InjectionPattern.of("ignore\\s+(all\\s+)?previous\\s+instructions", "instruction override: ignore previous instructions"),
            InjectionPattern.of("ignore\\s+(all\\s+)?above\\s+instructions", "instruction override: ignore above instructions"),
            InjectionPattern.of("disregard\\s+(all\\s+)?previous", "instruction override: disregard previous"),
            InjectionPattern.of("forget\\s+(all\\s+)?prior", "instruction override: forget prior"),
            InjectionPattern.of("you\\s+are\\s+now\\s+a", "role hijack: you are now a"),
            InjectionPattern.of("new\\s+instructions?:", "instruction injection: new instructions"),
            InjectionPattern.of("system\\s*prompt:", "prompt delimiter: system prompt"),
            InjectionPattern.of("<\\s*system\\s*>", "prompt delimiter: <system> tag"),
            InjectionPattern.of("<\\s*/?\\s*instructions?\\s*>", "prompt delimiter: <instructions> tag"),
            InjectionPattern.of("respond\\s+with\\s+only", "output control: respond with only"),
            InjectionPattern.of("output\\s+only\\s+the\\s+following", "output control: output only the following"),
            InjectionPattern.of("do\\s+not\\s+follow\\s+any\\s+other", "instruction override: do not follow any other")
    );

    private final List<InjectionPattern> patterns;

    public ContentSanitizer() {
        this(DEFAULT_PATTERNS);
    }

    public ContentSanitizer(List<InjectionPattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public SanitizedText sanitize(String text, String sourceId) {
        if (text == null || text.isEmpty()) {
            return SanitizedText.clean(text);
        }

        Set<String> flags = new LinkedHashSet<>();
        String current = text;
        boolean changed = true;
        // rescan until a full pass over the table finds nothing
        for (int pass = 0; changed && pass <= patterns.size(); pass++) {
            changed = false;
            for (InjectionPattern injection : patterns) {
                Matcher matcher = injection.pattern().matcher(current);
                if (matcher.find()) {
                    flags.add(injection.description());
                    current = matcher.replaceAll(Matcher.quoteReplacement(REDACTION));
                    changed = true;
                }
            }
        }

        if (flags.isEmpty()) {
            return SanitizedText.clean(text);
        }
        LOGGER.warning("Content from " + (sourceId == null ? "unknown" : sourceId) + " had "
                + flags.size() + " injection pattern(s) stripped");
        return new SanitizedText(current, List.copyOf(flags));
    }
}
