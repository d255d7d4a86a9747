package com.dailybrief.curation.api;

import java.util.Map;

public record StageResult(boolean success, String message, Map<String, Object> stats) {
    public static StageResult success(String message, Map<String, Object> stats) {
        return new StageResult(true, message, stats);
    }

    public static StageResult failure(String message, Map<String, Object> stats) {
        return new StageResult(false, message, stats);
    }

    public int intStat(String key) {
        Object value = stats.get(key);
        return value instanceof Number number ? number.intValue() : 0;
    }
}
