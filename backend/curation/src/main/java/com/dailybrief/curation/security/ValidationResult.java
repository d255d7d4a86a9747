package com.dailybrief.curation.security;

import com.dailybrief.core.model.Enrichment;

import java.util.List;

/**
 * {@code cleaned} is always complete and safe to persist, whether or not the
 * raw annotation was valid.
 */
public record ValidationResult(boolean valid, Enrichment cleaned, List<String> errors) {
    public ValidationResult {
        errors = List.copyOf(errors);
    }
}
