package com.dailybrief.curation.ranking;

/**
 * Running count of items selected across all clusters of one selection pass.
 */
final class SelectionBudget {
    private final int target;
    private int used;

    SelectionBudget(int target) {
        this.target = target;
    }

    boolean exhausted() {
        return used >= target;
    }

    void consume() {
        used++;
    }
}
