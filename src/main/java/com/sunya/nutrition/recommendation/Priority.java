package com.sunya.nutrition.recommendation;

public enum Priority {
    HIGH,
    MEDIUM,
    LOW;

    public static Priority of(int matchScore) {
        if (matchScore >= 80) return HIGH;
        if (matchScore >= 60) return MEDIUM;
        return LOW;
    }
}
