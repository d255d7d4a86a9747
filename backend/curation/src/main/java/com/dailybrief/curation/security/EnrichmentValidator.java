package com.dailybrief.curation.security;

import com.dailybrief.core.model.Enrichment;
import com.dailybrief.core.model.EntityRef;
import com.dailybrief.core.model.Lanes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks and repairs a model annotation against the enrichment schema. Invalid
 * fields are clamped, truncated or defaulted and reported in the error list;
 * validation itself never fails.
 */
public class EnrichmentValidator {
    public static final int SUMMARY_SHORT_MAX = 500;
    public static final int SUMMARY_LONG_MAX = 2000;

    private final FieldRule<String> summaryShort =
            FieldRule.text("summary_short", SUMMARY_SHORT_MAX, true, "Missing or invalid summary_short");
    private final FieldRule<String> summaryLong =
            FieldRule.text("summary_long", SUMMARY_LONG_MAX, false, "Invalid summary_long type");
    private final FieldRule<List<String>> topics = FieldRule.stringList("topics", "Topics is not a list");
    private final FieldRule<List<EntityRef>> entities = FieldRule.entityList("entities", "Entities is not a list");
    private final Map<String, FieldRule<Double>> laneRules = new LinkedHashMap<>();

    public EnrichmentValidator() {
        this(Lanes.DEFAULT);
    }

    public EnrichmentValidator(List<String> lanes) {
        for (String lane : lanes) {
            String key = Lanes.annotationKey(lane);
            laneRules.put(lane, FieldRule.unitScore(key, "Invalid " + key + " score"));
        }
    }

    public ValidationResult validate(Map<String, ?> raw) {
        Map<String, ?> input = raw == null ? Map.of() : raw;
        List<String> errors = new ArrayList<>();

        String shortText = summaryShort.apply(input, errors);
        String longText = summaryLong.apply(input, errors);
        List<String> topicTags = topics.apply(input, errors);
        List<EntityRef> entityRefs = entities.apply(input, errors);
        Map<String, Double> laneScores = new LinkedHashMap<>();
        laneRules.forEach((lane, rule) -> laneScores.put(lane, rule.apply(input, errors)));

        Enrichment cleaned = new Enrichment(shortText, longText, topicTags, entityRefs, laneScores);
        return new ValidationResult(errors.isEmpty(), cleaned, errors);
    }
}
