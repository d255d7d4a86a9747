package com.dailybrief.curation.security;

import com.dailybrief.core.model.EntityRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Declarative check for one annotation field: the key it lives under, the value
 * used when it is absent or rejected, and a coercion that repairs what it can
 * and rejects the rest.
 *
 * @param key      annotation key
 * @param required whether an absent key is an error rather than a silent default
 * @param fallback value used for absent or rejected input
 * @param coercion returns the repaired value, or empty to reject the input
 * @param error    diagnostic recorded on rejection
 */
public record FieldRule<T>(
        String key,
        boolean required,
        T fallback,
        Function<Object, Optional<T>> coercion,
        String error
) {
    public static FieldRule<String> text(String key, int maxLength, boolean required, String error) {
        return new FieldRule<>(key, required, "", value -> {
            if (!(value instanceof String text)) {
                return Optional.empty();
            }
            if (required && text.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(truncate(text, maxLength));
        }, error);
    }

    public static FieldRule<List<String>> stringList(String key, String error) {
        return new FieldRule<>(key, false, List.of(), value -> {
            if (!(value instanceof List<?> list)) {
                return Optional.empty();
            }
            List<String> strings = new ArrayList<>();
            for (Object element : list) {
                if (element instanceof String text) {
                    strings.add(text);
                }
            }
            return Optional.of(List.copyOf(strings));
        }, error);
    }

    public static FieldRule<List<EntityRef>> entityList(String key, String error) {
        return new FieldRule<>(key, false, List.of(), value -> {
            if (!(value instanceof List<?> list)) {
                return Optional.empty();
            }
            List<EntityRef> entities = new ArrayList<>();
            for (Object element : list) {
                if (element instanceof Map<?, ?> entity && entity.get("name") != null) {
                    Object type = entity.get("type");
                    entities.add(new EntityRef(
                            String.valueOf(entity.get("name")),
                            type == null ? EntityRef.UNKNOWN_TYPE : String.valueOf(type)
                    ));
                }
            }
            return Optional.of(List.copyOf(entities));
        }, error);
    }

    public static FieldRule<Double> unitScore(String key, String error) {
        return new FieldRule<>(key, false, 0.0, value -> toDouble(value)
                .filter(score -> !score.isNaN())
                .map(score -> Math.max(0.0, Math.min(1.0, score))), error);
    }

    /**
     * Applies this rule to {@code raw}, appending to {@code errors} when the
     * field is rejected.
     */
    public T apply(Map<String, ?> raw, List<String> errors) {
        if (!raw.containsKey(key)) {
            if (required) {
                errors.add(error);
            }
            return fallback;
        }
        Optional<T> coerced = coercion.apply(raw.get(key));
        if (coerced.isEmpty()) {
            errors.add(error);
            return fallback;
        }
        return coerced.get();
    }

    private static Optional<Double> toDouble(Object value) {
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        if (value instanceof Boolean flag) {
            return Optional.of(flag ? 1.0 : 0.0);
        }
        if (value instanceof String text) {
            return parseDouble(text.trim());
        }
        return Optional.empty();
    }

    // Also accepts the spellings "inf" and "infinity", with an optional sign and any case.
    private static Optional<Double> parseDouble(String text) {
        String unsigned = text.startsWith("+") || text.startsWith("-") ? text.substring(1) : text;
        if (unsigned.equalsIgnoreCase("inf") || unsigned.equalsIgnoreCase("infinity")) {
            return Optional.of(text.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
        }
        try {
            return Optional.of(Double.parseDouble(text));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    // Limits are in code points, so a surrogate pair is never split or double counted.
    private static String truncate(String text, int maxLength) {
        if (text.codePointCount(0, text.length()) <= maxLength) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxLength));
    }
}
