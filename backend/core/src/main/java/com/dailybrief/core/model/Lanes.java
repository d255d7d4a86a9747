package com.dailybrief.core.model;

import java.util.List;

public final class Lanes {
    public static final String BUILDERS = "builders";
    public static final String SECURITY = "security";
    public static final String BUSINESS = "business";
    public static final List<String> DEFAULT = List.of(BUILDERS, SECURITY, BUSINESS);

    private Lanes() {
    }

    /**
     * Key under which a model annotation carries the affinity for {@code lane}.
     */
    public static String annotationKey(String lane) {
        return "lane_" + lane;
    }
}
