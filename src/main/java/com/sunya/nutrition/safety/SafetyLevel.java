package com.sunya.nutrition.safety;

/** Ordered from least to most severe. */
public enum SafetyLevel {
    SAFE,
    CAUTION,
    AVOID;

    public SafetyLevel worse(SafetyLevel other) {
        return other != null && other.compareTo(this) > 0 ? other : this;
    }
}
