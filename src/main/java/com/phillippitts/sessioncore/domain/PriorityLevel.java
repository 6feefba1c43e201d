package com.phillippitts.sessioncore.domain;

/**
 * Named priority buckets. Any non-negative integer is a valid bucket; these are the values the
 * clients offer in their menus.
 */
public enum PriorityLevel {
    HIGH(1),
    MEDIUM(5),
    LOW(10);

    private final int value;

    PriorityLevel(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
